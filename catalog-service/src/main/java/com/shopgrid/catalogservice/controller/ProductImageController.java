package com.shopgrid.catalogservice.controller;

import com.shopgrid.catalogservice.dto.ProductImageResponse;
import com.shopgrid.catalogservice.security.AuthenticatedCaller;
import com.shopgrid.catalogservice.services.ProductImageService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@RestController
@RequestMapping("/api/v1/products/{productId}/images")
@RequiredArgsConstructor
public class ProductImageController {

    private final ProductImageService productImageService;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ProductImageResponse> uploadImage(
            @PathVariable Long productId,
            @RequestPart(name = "image", required = false) MultipartFile image,
            @RequestParam(name = "alt_text", required = false) String altText,
            @AuthenticationPrincipal AuthenticatedCaller caller) {
        ProductImageResponse uploaded = productImageService.uploadImage(productId, image, altText, caller);
        return ResponseEntity.status(HttpStatus.CREATED).body(uploaded);
    }

    @PostMapping(value = "/batch", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<List<ProductImageResponse>> uploadImages(
            @PathVariable Long productId,
            @RequestPart(name = "images", required = false) List<MultipartFile> images,
            @RequestParam(name = "alt_texts", required = false) List<String> altTexts,
            @AuthenticationPrincipal AuthenticatedCaller caller) {
        List<ProductImageResponse> uploaded = productImageService.uploadImages(productId, images, altTexts, caller);
        return ResponseEntity.status(HttpStatus.CREATED).body(uploaded);
    }

    @DeleteMapping("/{imageId}")
    public ResponseEntity<Void> deleteImage(
            @PathVariable Long productId,
            @PathVariable Long imageId,
            @AuthenticationPrincipal AuthenticatedCaller caller) {
        productImageService.deleteImage(productId, imageId, caller);
        return ResponseEntity.noContent().build();
    }
}
