package com.shopgrid.catalogservice.services;

import com.shopgrid.catalogservice.model.Product;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * A product kept by radius search together with its full precision distance from the origin.
 */
public record RankedProduct(Product product, double distanceKm) {

    public double roundedDistanceKm() {
        return BigDecimal.valueOf(distanceKm).setScale(3, RoundingMode.HALF_UP).doubleValue();
    }
}
