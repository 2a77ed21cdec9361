package com.shopgrid.catalogservice.mapper;

import com.shopgrid.catalogservice.dto.ProductImageResponse;
import com.shopgrid.catalogservice.model.ProductImage;
import com.shopgrid.catalogservice.storage.ImageStorage;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public abstract class ProductImageMapper {

    @Autowired
    protected ImageStorage imageStorage;

    // storage keys are turned into URLs clients can fetch
    @Mapping(target = "image", expression = "java(imageStorage.publicUrl(image.getImagePath()))")
    public abstract ProductImageResponse toProductImageResponse(ProductImage image);

    public abstract List<ProductImageResponse> toProductImageResponses(List<ProductImage> images);
}
