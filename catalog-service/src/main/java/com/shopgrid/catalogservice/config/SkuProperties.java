package com.shopgrid.catalogservice.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "catalog.sku")
public record SkuProperties(@Positive @DefaultValue("10") int maxAttempts) {
}
