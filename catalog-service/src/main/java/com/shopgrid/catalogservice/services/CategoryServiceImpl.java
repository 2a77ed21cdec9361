package com.shopgrid.catalogservice.services;

import com.shopgrid.catalogservice.dto.CategoryRequest;
import com.shopgrid.catalogservice.dto.CategoryResponse;
import com.shopgrid.catalogservice.mapper.CategoryMapper;
import com.shopgrid.catalogservice.model.Category;
import com.shopgrid.catalogservice.repository.CategoryRepository;
import com.shopgrid.catalogservice.repository.ProductRepository;
import com.shopgrid.catalogservice.security.AuthenticatedCaller;
import com.shopgrid.catalogservice.security.AuthorizationGuard;
import com.shopgrid.common.exception.AccessDeniedException;
import com.shopgrid.common.exception.DuplicateResourceException;
import com.shopgrid.common.exception.ResourceNotFoundException;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.text.Normalizer;
import java.util.List;
import java.util.Locale;

@Service
@RequiredArgsConstructor
public class CategoryServiceImpl implements CategoryService {

    private static final Logger log = LoggerFactory.getLogger(CategoryServiceImpl.class);

    static final int MAX_SLUG_LENGTH = 120;

    private final CategoryRepository categoryRepository;
    private final ProductRepository productRepository;
    private final CategoryMapper categoryMapper;
    private final AuthorizationGuard authorizationGuard;

    @Override
    @Transactional
    public CategoryResponse createCategory(CategoryRequest request, AuthenticatedCaller caller) {
        requireShopOwner(caller, "create a category");

        String name = request.getName().trim();
        String slug = StringUtils.hasText(request.getSlug()) ? request.getSlug() : slugify(name);

        if (categoryRepository.existsByNameIgnoreCase(name)) {
            throw new DuplicateResourceException("Category with name '" + name + "' already exists");
        }
        if (categoryRepository.existsBySlug(slug)) {
            throw new DuplicateResourceException("Category with slug '" + slug + "' already exists");
        }

        Category category = categoryMapper.toCategory(request);
        category.setName(name);
        category.setSlug(slug);

        Category savedCategory = categoryRepository.save(category);
        log.info("Category created: id={}, name='{}', slug={}, by={}",
                savedCategory.getId(), savedCategory.getName(), savedCategory.getSlug(), caller.subjectId());
        return categoryMapper.toCategoryResponse(savedCategory);
    }

    @Override
    @Transactional
    public List<CategoryResponse> getAllCategories() {
        return categoryRepository.findAll(Sort.by("name")).stream()
                .map(categoryMapper::toCategoryResponse)
                .toList();
    }

    @Override
    @Transactional
    public CategoryResponse getCategoryById(Long categoryId) {
        return categoryMapper.toCategoryResponse(categoryRepository.findById(categoryId)
                .orElseThrow(() -> new ResourceNotFoundException("Category not found")));
    }

    @Override
    @Transactional
    public CategoryResponse updateCategory(Long categoryId, CategoryRequest request, AuthenticatedCaller caller) {
        requireShopOwner(caller, "update category " + categoryId);

        Category category = categoryRepository.findById(categoryId)
                .orElseThrow(() -> new ResourceNotFoundException("Category not found"));

        String name = request.getName().trim();
        if (categoryRepository.existsByNameIgnoreCaseAndIdNot(name, categoryId)) {
            throw new DuplicateResourceException("Category with name '" + name + "' already exists");
        }
        if (StringUtils.hasText(request.getSlug())
                && categoryRepository.existsBySlugAndIdNot(request.getSlug(), categoryId)) {
            throw new DuplicateResourceException("Category with slug '" + request.getSlug() + "' already exists");
        }

        categoryMapper.updateCategoryFromRequest(request, category);
        category.setName(name);

        Category updatedCategory = categoryRepository.save(category);
        log.info("Category updated: id={}, name='{}', slug={}, by={}",
                categoryId, updatedCategory.getName(), updatedCategory.getSlug(), caller.subjectId());
        return categoryMapper.toCategoryResponse(updatedCategory);
    }

    @Override
    @Transactional
    public void deleteCategory(Long categoryId, AuthenticatedCaller caller) {
        requireShopOwner(caller, "delete category " + categoryId);

        Category category = categoryRepository.findById(categoryId)
                .orElseThrow(() -> new ResourceNotFoundException("Category not found"));

        // products stay, they just lose their category
        int detached = productRepository.clearCategory(categoryId);
        categoryRepository.delete(category);
        log.info("Category deleted: id={}, name='{}', detachedProducts={}, by={}",
                categoryId, category.getName(), detached, caller.subjectId());
    }

    private void requireShopOwner(AuthenticatedCaller caller, String action) {
        if (!authorizationGuard.canCreate(caller != null ? caller.claims() : null)) {
            log.warn("Access denied: subject {} attempted to {}", caller != null ? caller.subjectId() : null, action);
            throw new AccessDeniedException("Only shop owners can manage categories");
        }
    }

    static String slugify(String name) {
        String ascii = Normalizer.normalize(name, Normalizer.Form.NFKD).replaceAll("\\p{M}", "");
        String slug = ascii.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-+)|(-+$)", "");
        if (slug.length() > MAX_SLUG_LENGTH) {
            slug = slug.substring(0, MAX_SLUG_LENGTH).replaceAll("-+$", "");
        }
        if (slug.isEmpty()) {
            throw new IllegalArgumentException("Cannot derive a slug from category name '" + name + "'");
        }
        return slug;
    }
}
