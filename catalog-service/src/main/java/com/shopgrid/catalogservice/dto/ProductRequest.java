package com.shopgrid.catalogservice.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Payload for creating a product.
 * Shop fields are not part of it: they are copied from the shop directory by the server.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductRequest {

    // generated when blank
    @Size(max = 64, message = "SKU must be at most 64 characters")
    private String sku;

    @NotBlank(message = "Product name is required")
    @Size(max = 255)
    private String name;

    @Size(max = 10000)
    private String description;

    @NotNull(message = "Price is required")
    @DecimalMin(value = "0.0", message = "Price must be zero or positive")
    private BigDecimal price;

    private Long categoryId;

    private Boolean available;

    private List<@NotBlank String> tags;
}
