package com.shopgrid.catalogservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "products", indexes = {
        @Index(name = "idx_products_shop_id", columnList = "shop_id"),
        @Index(name = "idx_products_category_id", columnList = "category_id")
})
public class Product {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @ToString.Include
    private Long id;

    // unique constraint is what settles concurrent SKU generation
    @Column(unique = true, length = 64)
    @ToString.Include
    private String sku;

    @Column(nullable = false)
    @ToString.Include
    private String name;

    @Column(length = 10000)
    private String description;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    // optional; detached when the category is deleted
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "category_id")
    private Category category;

    @Builder.Default
    @Column(nullable = false)
    private Boolean available = true;

    // shop snapshot, copied from the shop directory at creation and never refreshed
    @Column(name = "shop_id", nullable = false, updatable = false)
    private Long shopId;

    @Column(name = "shop_name", nullable = false, updatable = false)
    private String shopName;

    @Column(name = "shop_lat", updatable = false)
    private Double shopLat;

    @Column(name = "shop_lng", updatable = false)
    private Double shopLng;

    @Builder.Default
    @ElementCollection
    @CollectionTable(name = "product_tags", joinColumns = @JoinColumn(name = "product_id"))
    @OrderColumn(name = "tag_order")
    @Column(name = "tag", nullable = false)
    private List<String> tags = new ArrayList<>();

    @Builder.Default
    @OneToMany(mappedBy = "product", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<ProductImage> images = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public boolean hasLocation() {
        return shopLat != null && shopLng != null;
    }
}
