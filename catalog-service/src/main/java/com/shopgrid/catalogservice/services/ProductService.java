package com.shopgrid.catalogservice.services;

import com.shopgrid.catalogservice.dto.GeoQuery;
import com.shopgrid.catalogservice.dto.NearbyProductResponse;
import com.shopgrid.catalogservice.dto.PageResponse;
import com.shopgrid.catalogservice.dto.ProductFilter;
import com.shopgrid.catalogservice.dto.ProductRequest;
import com.shopgrid.catalogservice.dto.ProductResponse;
import com.shopgrid.catalogservice.dto.ProductUpdateRequest;
import com.shopgrid.catalogservice.security.AuthenticatedCaller;
import org.springframework.data.domain.Pageable;

import java.util.List;

public interface ProductService {
    // CRUD Operations
    ProductResponse createProduct(ProductRequest request, AuthenticatedCaller caller);
    ProductResponse updateProduct(Long productId, ProductUpdateRequest request, AuthenticatedCaller caller);
    void deleteProduct(Long productId, AuthenticatedCaller caller);
    ProductResponse getProductById(Long productId);

    // Faceted listing of available products
    PageResponse<ProductResponse> listProducts(ProductFilter filter, Pageable pageable);

    // Radius search, closest first
    List<NearbyProductResponse> searchNearby(String query, GeoQuery geoQuery);
}
