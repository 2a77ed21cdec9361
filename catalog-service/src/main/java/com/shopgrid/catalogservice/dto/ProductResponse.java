package com.shopgrid.catalogservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductResponse {

    private Long id;
    private String sku;
    private String name;
    private String description;
    private BigDecimal price;
    private Long categoryId;
    private Boolean available;

    private Long shopId;
    private String shopName;
    private Double shopLat;
    private Double shopLng;

    private List<String> tags;
    private List<ProductImageResponse> images;

    private Instant createdAt;
    private Instant updatedAt;
}
