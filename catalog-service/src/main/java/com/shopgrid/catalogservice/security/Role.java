package com.shopgrid.catalogservice.security;

public enum Role {
    SHOP_OWNER,
    OTHER;

    static final String SHOP_OWNER_CLAIM = "shop_owner";

    static Role fromClaim(Object value) {
        return SHOP_OWNER_CLAIM.equals(value) ? SHOP_OWNER : OTHER;
    }
}
