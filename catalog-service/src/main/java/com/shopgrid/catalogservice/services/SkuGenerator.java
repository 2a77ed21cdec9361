package com.shopgrid.catalogservice.services;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * Random 8 character SKUs made of uppercase letters and digits.
 * Uniqueness is not checked here, the products table enforces it.
 */
@Component
public class SkuGenerator {

    static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    static final int LENGTH = 8;

    private final SecureRandom random = new SecureRandom();

    public String next() {
        char[] sku = new char[LENGTH];
        for (int i = 0; i < LENGTH; i++) {
            sku[i] = ALPHABET.charAt(random.nextInt(ALPHABET.length()));
        }
        return new String(sku);
    }
}
