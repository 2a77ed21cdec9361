package com.shopgrid.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for inter-service communication regarding Shop information.
 * Returned by the shop directory when listing the shops of an owner.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShopResponse {
    private Long id;
    private String name;
    private String ownerId;

    // Shop location, either may be missing for shops without an address
    private Double latitude;
    private Double longitude;
}
