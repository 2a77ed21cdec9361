package com.shopgrid.catalogservice.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Partial update of a product. Null fields are left untouched.
 * Shop snapshot fields cannot be changed through this payload.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductUpdateRequest {

    @Size(min = 1, max = 64, message = "SKU must be between 1 and 64 characters")
    @Pattern(regexp = ".*\\S.*", message = "SKU cannot be blank")
    private String sku;

    @Size(min = 1, max = 255, message = "Product name cannot be blank")
    @Pattern(regexp = ".*\\S.*", message = "Product name cannot be blank")
    private String name;

    @Size(max = 10000)
    private String description;

    @DecimalMin(value = "0.0", message = "Price must be zero or positive")
    private BigDecimal price;

    private Long categoryId;

    private Boolean available;

    private List<String> tags;
}
