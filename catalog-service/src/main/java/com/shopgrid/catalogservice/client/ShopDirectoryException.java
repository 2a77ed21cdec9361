package com.shopgrid.catalogservice.client;

/**
 * Base class for failed shop directory lookups.
 * Callers collapse every subtype into the same "no shop found" denial.
 */
public abstract class ShopDirectoryException extends RuntimeException {

    protected ShopDirectoryException(String message) {
        super(message);
    }

    protected ShopDirectoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
