package com.shopgrid.catalogservice.services;

import com.shopgrid.catalogservice.dto.ProductImageResponse;
import com.shopgrid.catalogservice.security.AuthenticatedCaller;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

public interface ProductImageService {
    ProductImageResponse uploadImage(Long productId, MultipartFile image, String altText, AuthenticatedCaller caller);
    List<ProductImageResponse> uploadImages(Long productId, List<MultipartFile> images, List<String> altTexts,
                                            AuthenticatedCaller caller);
    void deleteImage(Long productId, Long imageId, AuthenticatedCaller caller);
}
