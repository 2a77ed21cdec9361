package com.shopgrid.catalogservice.services;

import com.shopgrid.catalogservice.dto.CategoryRequest;
import com.shopgrid.catalogservice.dto.CategoryResponse;
import com.shopgrid.catalogservice.security.AuthenticatedCaller;

import java.util.List;

public interface CategoryService {
    CategoryResponse createCategory(CategoryRequest request, AuthenticatedCaller caller);
    List<CategoryResponse> getAllCategories();
    CategoryResponse getCategoryById(Long categoryId);
    CategoryResponse updateCategory(Long categoryId, CategoryRequest request, AuthenticatedCaller caller);
    void deleteCategory(Long categoryId, AuthenticatedCaller caller);
}
