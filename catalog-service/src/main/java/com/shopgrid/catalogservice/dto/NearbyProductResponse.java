package com.shopgrid.catalogservice.dto;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A product returned by radius search, annotated with its distance from the search origin
 * in kilometres rounded to 3 decimals.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NearbyProductResponse {

    @JsonUnwrapped
    private ProductResponse product;

    private double distanceKm;
}
