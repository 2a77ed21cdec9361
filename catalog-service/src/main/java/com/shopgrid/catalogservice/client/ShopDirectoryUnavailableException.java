package com.shopgrid.catalogservice.client;

/**
 * The shop directory could not be reached, timed out, answered with a non-2xx status
 * or returned a body that could not be read.
 */
public class ShopDirectoryUnavailableException extends ShopDirectoryException {

    public ShopDirectoryUnavailableException(String message) {
        super(message);
    }

    public ShopDirectoryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
