package com.shopgrid.catalogservice.security;

import com.shopgrid.catalogservice.model.Product;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;

/**
 * Ownership and role decisions for mutating catalog operations.
 * Both rules are pure functions of already verified claims; missing input means DENY.
 * Read-only operations never go through this guard.
 */
@Slf4j
@Component
public class AuthorizationGuard {

    /**
     * Only shop owners may create products and manage categories.
     */
    public boolean canCreate(TokenClaims claims) {
        return claims != null && claims.isShopOwner();
    }

    /**
     * Decides whether the caller may update or delete the product, or attach images to it.
     *
     * When the token lists {@code shop_ids} the product's shop must be one of them. Tokens without
     * a shop list fall back to comparing the subject id with the product's shop id, which only works
     * when the identity service issues subject ids that double as shop ids. Owners whose user id and
     * shop id differ must get tokens carrying {@code shop_ids}.
     */
    public boolean canMutate(TokenClaims claims, Product product) {
        if (claims == null || product == null || product.getShopId() == null) {
            return false;
        }

        Optional<Set<Long>> shopIds = claims.getShopIds();
        if (shopIds.isPresent() && !shopIds.get().isEmpty()) {
            return shopIds.get().contains(product.getShopId());
        }

        Long subjectAsShopId = parseSubject(claims.getSubjectId());
        return subjectAsShopId != null && subjectAsShopId.equals(product.getShopId());
    }

    private static Long parseSubject(String subjectId) {
        if (subjectId == null) {
            return null;
        }
        try {
            return Long.valueOf(subjectId.trim());
        } catch (NumberFormatException e) {
            log.debug("Subject {} is not numeric, shop id fallback denies", subjectId);
            return null;
        }
    }
}
