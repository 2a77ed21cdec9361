package com.shopgrid.catalogservice.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * @param storageDir root directory uploaded product images are written to
 * @param baseUrl    public URL prefix the stored image keys are served under
 */
@Validated
@ConfigurationProperties(prefix = "catalog.images")
public record ImageStorageProperties(
        @NotBlank @DefaultValue("media") String storageDir,
        @NotBlank @DefaultValue("/media/") String baseUrl) {
}
