package com.shopgrid.catalogservice.storage;

import org.springframework.web.multipart.MultipartFile;

/**
 * Binary storage for product images. The catalog only keeps the returned key.
 */
public interface ImageStorage {

    /**
     * Stores the file and returns the key it can later be resolved or deleted with.
     */
    String store(MultipartFile file);

    void delete(String key);

    String publicUrl(String key);
}
