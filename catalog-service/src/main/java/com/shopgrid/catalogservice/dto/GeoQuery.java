package com.shopgrid.catalogservice.dto;

import com.shopgrid.catalogservice.exception.InvalidSearchParameterException;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * Origin and radius of a radius search, parsed from raw query parameters.
 */
public record GeoQuery(double latitude, double longitude, double radiusKm) {

    public static final double DEFAULT_RADIUS_KM = 5.0;

    /**
     * Parses the search parameters.
     *
     * @return empty when lat or lng is missing, in which case the caller falls back to the plain listing
     * @throws InvalidSearchParameterException when a supplied value is not a finite number in range
     */
    public static Optional<GeoQuery> parse(String lat, String lng, String radiusKm) {
        double radius = parseRadius(radiusKm);
        if (!StringUtils.hasText(lat) || !StringUtils.hasText(lng)) {
            return Optional.empty();
        }

        double latitude;
        double longitude;
        try {
            latitude = Double.parseDouble(lat.trim());
            longitude = Double.parseDouble(lng.trim());
        } catch (NumberFormatException e) {
            throw new InvalidSearchParameterException("Invalid lat/lng");
        }
        if (!Double.isFinite(latitude) || !Double.isFinite(longitude)
                || Math.abs(latitude) > 90.0 || Math.abs(longitude) > 180.0) {
            throw new InvalidSearchParameterException("Invalid lat/lng");
        }
        return Optional.of(new GeoQuery(latitude, longitude, radius));
    }

    private static double parseRadius(String radiusKm) {
        if (!StringUtils.hasText(radiusKm)) {
            return DEFAULT_RADIUS_KM;
        }
        double radius;
        try {
            radius = Double.parseDouble(radiusKm.trim());
        } catch (NumberFormatException e) {
            throw new InvalidSearchParameterException("Invalid radius_km");
        }
        if (!Double.isFinite(radius) || radius < 0) {
            throw new InvalidSearchParameterException("Invalid radius_km");
        }
        return radius;
    }
}
