package com.shopgrid.catalogservice.services;

import com.shopgrid.catalogservice.dto.ProductImageResponse;
import com.shopgrid.catalogservice.event.ImagesRemovedEvent;
import com.shopgrid.catalogservice.mapper.ProductImageMapper;
import com.shopgrid.catalogservice.model.Product;
import com.shopgrid.catalogservice.model.ProductImage;
import com.shopgrid.catalogservice.repository.ProductImageRepository;
import com.shopgrid.catalogservice.repository.ProductRepository;
import com.shopgrid.catalogservice.security.AuthenticatedCaller;
import com.shopgrid.catalogservice.security.AuthorizationGuard;
import com.shopgrid.catalogservice.storage.ImageStorage;
import com.shopgrid.common.exception.AccessDeniedException;
import com.shopgrid.common.exception.ResourceNotFoundException;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ProductImageServiceImpl implements ProductImageService {

    static final int MAX_ALT_TEXT_LENGTH = 200;

    private final ProductRepository productRepository;
    private final ProductImageRepository productImageRepository;
    private final ProductImageMapper productImageMapper;
    private final AuthorizationGuard authorizationGuard;
    private final ImageStorage imageStorage;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    @Transactional
    public ProductImageResponse uploadImage(Long productId, MultipartFile image, String altText,
                                            AuthenticatedCaller caller) {
        Product product = loadOwnedProduct(productId, caller);
        if (image == null || image.isEmpty()) {
            throw new IllegalArgumentException("No image uploaded");
        }

        List<ProductImage> saved = storeAll(product, List.of(image), altText == null ? List.of() : List.of(altText));
        return productImageMapper.toProductImageResponse(saved.get(0));
    }

    @Override
    @Transactional
    public List<ProductImageResponse> uploadImages(Long productId, List<MultipartFile> images, List<String> altTexts,
                                                   AuthenticatedCaller caller) {
        Product product = loadOwnedProduct(productId, caller);
        List<MultipartFile> files = images == null ? List.of()
                : images.stream().filter(file -> file != null && !file.isEmpty()).toList();
        if (files.isEmpty()) {
            throw new IllegalArgumentException("No images uploaded");
        }

        List<ProductImage> saved = storeAll(product, files, altTexts == null ? List.of() : altTexts);
        return productImageMapper.toProductImageResponses(saved);
    }

    @Override
    @Transactional
    public void deleteImage(Long productId, Long imageId, AuthenticatedCaller caller) {
        Product product = loadOwnedProduct(productId, caller);
        ProductImage image = productImageRepository.findByIdAndProductId(imageId, productId)
                .orElseThrow(() -> new ResourceNotFoundException("Image not found"));

        product.getImages().remove(image);
        productImageRepository.delete(image);
        log.info("Product image deleted: productId={}, imageId={}, key={}", productId, imageId, image.getImagePath());

        eventPublisher.publishEvent(new ImagesRemovedEvent(this, productId, List.of(image.getImagePath())));
    }

    // alt texts are matched to files by position, missing ones default to empty
    private List<ProductImage> storeAll(Product product, List<MultipartFile> files, List<String> altTexts) {
        for (String altText : altTexts) {
            if (altText != null && altText.length() > MAX_ALT_TEXT_LENGTH) {
                throw new IllegalArgumentException("alt_text must be at most " + MAX_ALT_TEXT_LENGTH + " characters");
            }
        }

        List<String> storedKeys = new ArrayList<>();
        try {
            List<ProductImage> images = new ArrayList<>();
            for (int i = 0; i < files.size(); i++) {
                String key = imageStorage.store(files.get(i));
                storedKeys.add(key);

                String altText = i < altTexts.size() && altTexts.get(i) != null ? altTexts.get(i) : "";
                ProductImage image = ProductImage.builder()
                        .product(product)
                        .imagePath(key)
                        .altText(altText)
                        .build();
                product.getImages().add(image);
                images.add(image);
            }
            List<ProductImage> saved = productImageRepository.saveAllAndFlush(images);
            log.info("Product images uploaded: productId={}, count={}", product.getId(), saved.size());
            return saved;
        } catch (RuntimeException e) {
            // nothing references the files written so far
            storedKeys.forEach(this::deleteQuietly);
            throw e;
        }
    }

    private void deleteQuietly(String key) {
        try {
            imageStorage.delete(key);
        } catch (RuntimeException e) {
            log.warn("Could not remove image file {} after failed upload: {}", key, e.getMessage());
        }
    }

    private Product loadOwnedProduct(Long productId, AuthenticatedCaller caller) {
        Product product = productRepository.findById(productId)
                .orElseThrow(() -> new ResourceNotFoundException("Product not found"));

        if (!authorizationGuard.canMutate(caller != null ? caller.claims() : null, product)) {
            log.warn("Access denied: subject {} attempted to change images of product {} of shop {}",
                    caller != null ? caller.subjectId() : null, productId, product.getShopId());
            throw new AccessDeniedException("You can't modify products of other shops.");
        }
        return product;
    }
}
