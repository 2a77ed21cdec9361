package com.shopgrid.catalogservice.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * @param baseUrl shop listing endpoint of the shop service, queried with {@code ?owner_id=}
 * @param timeout upper bound for a whole directory call
 */
@Validated
@ConfigurationProperties(prefix = "catalog.shop-directory")
public record ShopDirectoryProperties(
        @NotBlank String baseUrl,
        @DefaultValue("5s") Duration timeout) {
}
