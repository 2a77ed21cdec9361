package com.shopgrid.catalogservice.services;

import com.shopgrid.catalogservice.model.Product;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Great-circle radius filter and ranking.
 *
 * Full scan over the candidates, callers narrow them down first (available products, optional name match).
 */
@Component
public class GeoRanker {

    public static final double EARTH_RADIUS_KM = 6371.0;

    /**
     * Keeps the candidates whose shop lies within {@code radiusKm} of the origin, closest first.
     * Candidates without shop coordinates are skipped. Equal distances keep their input order.
     */
    public List<RankedProduct> rank(List<Product> candidates, double originLat, double originLng, double radiusKm) {
        List<RankedProduct> ranked = new ArrayList<>();
        for (Product candidate : candidates) {
            if (!candidate.hasLocation()) {
                continue;
            }
            double distance = distanceKm(originLat, originLng, candidate.getShopLat(), candidate.getShopLng());
            if (distance <= radiusKm) {
                ranked.add(new RankedProduct(candidate, distance));
            }
        }
        // List.sort is stable
        ranked.sort(Comparator.comparingDouble(RankedProduct::distanceKm));
        return ranked;
    }

    /**
     * Haversine distance in kilometres between two points given in degrees.
     */
    public static double distanceKm(double lat1, double lng1, double lat2, double lng2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double dLat = phi2 - phi1;
        double dLng = Math.toRadians(lng2) - Math.toRadians(lng1);

        double a = Math.pow(Math.sin(dLat / 2), 2)
                + Math.cos(phi1) * Math.cos(phi2) * Math.pow(Math.sin(dLng / 2), 2);
        // rounding can push a slightly above 1 for antipodal points
        double c = 2 * Math.asin(Math.min(1.0, Math.sqrt(a)));
        return EARTH_RADIUS_KM * c;
    }
}
