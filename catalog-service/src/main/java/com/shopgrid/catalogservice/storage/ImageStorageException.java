package com.shopgrid.catalogservice.storage;

/**
 * Thrown when an image cannot be written to or removed from storage
 * HTTP Status: 500 Internal Server Error
 */
public class ImageStorageException extends RuntimeException {

    public ImageStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
