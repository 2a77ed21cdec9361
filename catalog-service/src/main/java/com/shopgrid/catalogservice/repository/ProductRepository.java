package com.shopgrid.catalogservice.repository;

import com.shopgrid.catalogservice.model.Product;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ProductRepository extends JpaRepository<Product, Long>, JpaSpecificationExecutor<Product> {

    // public retrieval only shows products that are on sale
    Optional<Product> findByIdAndAvailableTrue(Long id);

    boolean existsBySku(String sku);

    // detach products before their category is deleted
    @Modifying
    @Query("UPDATE Product p SET p.category = null WHERE p.category.id = :categoryId")
    int clearCategory(@Param("categoryId") Long categoryId);
}
