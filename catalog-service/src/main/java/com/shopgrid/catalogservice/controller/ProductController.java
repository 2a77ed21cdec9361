package com.shopgrid.catalogservice.controller;

import com.shopgrid.catalogservice.dto.GeoQuery;
import com.shopgrid.catalogservice.dto.NearbyProductResponse;
import com.shopgrid.catalogservice.dto.PageResponse;
import com.shopgrid.catalogservice.dto.ProductFilter;
import com.shopgrid.catalogservice.dto.ProductRequest;
import com.shopgrid.catalogservice.dto.ProductResponse;
import com.shopgrid.catalogservice.dto.ProductUpdateRequest;
import com.shopgrid.catalogservice.security.AuthenticatedCaller;
import com.shopgrid.catalogservice.services.ProductService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/products")
@RequiredArgsConstructor
public class ProductController {

    static final int DEFAULT_PAGE_SIZE = 20;
    static final int MAX_PAGE_SIZE = 100;

    private static final Sort DEFAULT_SORT = Sort.by(Sort.Direction.DESC, "updatedAt");

    // accepted values of the ordering parameter
    private static final Map<String, Sort> ORDERINGS = Map.of(
            "price", Sort.by(Sort.Direction.ASC, "price"),
            "-price", Sort.by(Sort.Direction.DESC, "price"),
            "updated_at", Sort.by(Sort.Direction.ASC, "updatedAt"),
            "-updated_at", DEFAULT_SORT);

    private final ProductService productService;

    /**
     * PUBLIC ROUTES - available products only
     */

    // Faceted listing
    @GetMapping
    public ResponseEntity<PageResponse<ProductResponse>> listProducts(
            @RequestParam(required = false) String search,
            @RequestParam(required = false) Long category,
            @RequestParam(required = false) BigDecimal price,
            @RequestParam(name = "min_price", required = false) BigDecimal minPrice,
            @RequestParam(name = "max_price", required = false) BigDecimal maxPrice,
            @RequestParam(required = false) String sku,
            @RequestParam(required = false) String ordering,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "" + DEFAULT_PAGE_SIZE) int size) {
        ProductFilter filter = ProductFilter.builder()
                .search(search)
                .categoryId(category)
                .price(price)
                .minPrice(minPrice)
                .maxPrice(maxPrice)
                .sku(sku)
                .build();
        return ResponseEntity.ok(productService.listProducts(filter, pageable(page, size, ordering)));
    }

    // Radius search when lat and lng are given, plain name search otherwise
    @GetMapping("/search")
    public ResponseEntity<?> searchProducts(
            @RequestParam(required = false) String q,
            @RequestParam(required = false) String lat,
            @RequestParam(required = false) String lng,
            @RequestParam(name = "radius_km", required = false) String radiusKm,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "" + DEFAULT_PAGE_SIZE) int size) {
        Optional<GeoQuery> geoQuery = GeoQuery.parse(lat, lng, radiusKm);
        if (geoQuery.isPresent()) {
            List<NearbyProductResponse> nearby = productService.searchNearby(q, geoQuery.get());
            return ResponseEntity.ok(nearby);
        }

        ProductFilter filter = ProductFilter.builder().name(q).build();
        return ResponseEntity.ok(productService.listProducts(filter, pageable(page, size, null)));
    }

    @GetMapping("/{productId}")
    public ResponseEntity<ProductResponse> getProductById(@PathVariable Long productId) {
        ProductResponse productResponse = productService.getProductById(productId);
        return ResponseEntity.ok(productResponse);
    }

    /**
     * OWNER ROUTES - shop owners acting on products of their shops
     */

    @PostMapping
    public ResponseEntity<ProductResponse> createProduct(
            @Valid @RequestBody ProductRequest request,
            @AuthenticationPrincipal AuthenticatedCaller caller) {
        ProductResponse createdProduct = productService.createProduct(request, caller);
        return ResponseEntity.status(HttpStatus.CREATED).body(createdProduct);
    }

    @RequestMapping(value = "/{productId}", method = {RequestMethod.PUT, RequestMethod.PATCH})
    public ResponseEntity<ProductResponse> updateProduct(
            @PathVariable Long productId,
            @Valid @RequestBody ProductUpdateRequest request,
            @AuthenticationPrincipal AuthenticatedCaller caller) {
        ProductResponse updatedProduct = productService.updateProduct(productId, request, caller);
        return ResponseEntity.ok(updatedProduct);
    }

    @DeleteMapping("/{productId}")
    public ResponseEntity<Void> deleteProduct(
            @PathVariable Long productId,
            @AuthenticationPrincipal AuthenticatedCaller caller) {
        productService.deleteProduct(productId, caller);
        return ResponseEntity.noContent().build();
    }

    static Pageable pageable(int page, int size, String ordering) {
        int pageSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        Sort sort = ordering == null ? DEFAULT_SORT : ORDERINGS.getOrDefault(ordering.trim(), DEFAULT_SORT);
        return PageRequest.of(Math.max(page, 0), pageSize, sort.and(Sort.by(Sort.Direction.ASC, "id")));
    }
}
