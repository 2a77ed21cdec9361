package com.shopgrid.catalogservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Facets of the public product listing. Every field is optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductFilter {

    // substring matched against name, description, shop name and tags
    private String search;

    // substring matched against the name only (search endpoint)
    private String name;

    private Long categoryId;
    private BigDecimal price;
    private BigDecimal minPrice;
    private BigDecimal maxPrice;
    private String sku;
}
