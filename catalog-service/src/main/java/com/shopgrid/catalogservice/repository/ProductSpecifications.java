package com.shopgrid.catalogservice.repository;

import com.shopgrid.catalogservice.dto.ProductFilter;
import com.shopgrid.catalogservice.model.Product;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.JoinType;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Subquery;
import jakarta.persistence.criteria.Root;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Criteria for the public product listing.
 */
public final class ProductSpecifications {

    private ProductSpecifications() {
    }

    public static Specification<Product> listing(ProductFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            predicates.add(cb.isTrue(root.get("available")));

            if (StringUtils.hasText(filter.getName())) {
                predicates.add(cb.like(cb.lower(root.get("name")), pattern(filter.getName())));
            }

            if (StringUtils.hasText(filter.getSearch())) {
                String pattern = pattern(filter.getSearch());

                // tags live in a collection table, matched through a subquery to keep rows distinct
                Subquery<Long> tagMatch = query.subquery(Long.class);
                Root<Product> tagged = tagMatch.from(Product.class);
                Join<Product, String> tag = tagged.join("tags", JoinType.INNER);
                tagMatch.select(tagged.get("id"))
                        .where(cb.equal(tagged.get("id"), root.get("id")), cb.like(cb.lower(tag), pattern));

                predicates.add(cb.or(
                        cb.like(cb.lower(root.get("name")), pattern),
                        cb.like(cb.lower(root.get("description")), pattern),
                        cb.like(cb.lower(root.get("shopName")), pattern),
                        cb.exists(tagMatch)));
            }

            if (filter.getCategoryId() != null) {
                predicates.add(cb.equal(root.get("category").get("id"), filter.getCategoryId()));
            }
            if (filter.getPrice() != null) {
                predicates.add(cb.equal(root.get("price"), filter.getPrice()));
            }
            if (filter.getMinPrice() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("price"), filter.getMinPrice()));
            }
            if (filter.getMaxPrice() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.get("price"), filter.getMaxPrice()));
            }
            if (StringUtils.hasText(filter.getSku())) {
                predicates.add(cb.equal(root.get("sku"), filter.getSku().trim()));
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    /**
     * Radius search candidates: on sale, located, optionally matching a name substring.
     */
    public static Specification<Product> geoCandidates(String name) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            predicates.add(cb.isTrue(root.get("available")));
            predicates.add(cb.isNotNull(root.get("shopLat")));
            predicates.add(cb.isNotNull(root.get("shopLng")));
            if (StringUtils.hasText(name)) {
                predicates.add(cb.like(cb.lower(root.get("name")), pattern(name)));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    private static String pattern(String text) {
        return "%" + text.trim().toLowerCase(Locale.ROOT) + "%";
    }
}
