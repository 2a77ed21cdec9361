package com.shopgrid.catalogservice.client;

public class NoShopsFoundException extends ShopDirectoryException {

    public NoShopsFoundException(String subjectId) {
        super("No shops found for owner " + subjectId);
    }
}
