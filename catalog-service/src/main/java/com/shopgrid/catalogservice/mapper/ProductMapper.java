package com.shopgrid.catalogservice.mapper;

import com.shopgrid.catalogservice.dto.ProductRequest;
import com.shopgrid.catalogservice.dto.ProductResponse;
import com.shopgrid.catalogservice.dto.ProductUpdateRequest;
import com.shopgrid.catalogservice.model.Product;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;
import org.mapstruct.NullValuePropertyMappingStrategy;
import org.mapstruct.ReportingPolicy;

@Mapper(
        componentModel = "spring",
        uses = ProductImageMapper.class,
        unmappedTargetPolicy = ReportingPolicy.IGNORE,
        nullValuePropertyMappingStrategy = NullValuePropertyMappingStrategy.IGNORE
)
public interface ProductMapper {

    /**
     * Converts the Product entity to a ProductResponse DTO.
     * Maps the ID of the 'category' object to the 'categoryId' field.
     */
    @Mapping(source = "category.id", target = "categoryId")
    ProductResponse toProductResponse(Product product);

    /**
     * Creates a new Product entity from a ProductRequest DTO.
     * Category, availability and tags are resolved in the service layer,
     * shop snapshot fields come from the shop directory.
     */
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "category", ignore = true)
    @Mapping(target = "available", ignore = true)
    @Mapping(target = "tags", ignore = true)
    @Mapping(target = "images", ignore = true)
    @Mapping(target = "shopId", ignore = true)
    @Mapping(target = "shopName", ignore = true)
    @Mapping(target = "shopLat", ignore = true)
    @Mapping(target = "shopLng", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    Product toProduct(ProductRequest request);

    /**
     * Copies the non-null fields of the update request onto the product.
     * Shop snapshot fields are never touched, the SKU is applied by the service.
     */
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "sku", ignore = true)
    @Mapping(target = "category", ignore = true)
    @Mapping(target = "tags", ignore = true)
    @Mapping(target = "images", ignore = true)
    @Mapping(target = "shopId", ignore = true)
    @Mapping(target = "shopName", ignore = true)
    @Mapping(target = "shopLat", ignore = true)
    @Mapping(target = "shopLng", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    void updateProductFromRequest(ProductUpdateRequest request, @MappingTarget Product product);
}
