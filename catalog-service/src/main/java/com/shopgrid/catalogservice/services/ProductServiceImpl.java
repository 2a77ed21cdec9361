package com.shopgrid.catalogservice.services;

import com.shopgrid.catalogservice.client.NoShopsFoundException;
import com.shopgrid.catalogservice.client.ShopDirectoryClient;
import com.shopgrid.catalogservice.client.ShopDirectoryUnavailableException;
import com.shopgrid.catalogservice.config.SkuProperties;
import com.shopgrid.catalogservice.dto.GeoQuery;
import com.shopgrid.catalogservice.dto.NearbyProductResponse;
import com.shopgrid.catalogservice.dto.PageResponse;
import com.shopgrid.catalogservice.dto.ProductFilter;
import com.shopgrid.catalogservice.dto.ProductRequest;
import com.shopgrid.catalogservice.dto.ProductResponse;
import com.shopgrid.catalogservice.dto.ProductUpdateRequest;
import com.shopgrid.catalogservice.event.ImagesRemovedEvent;
import com.shopgrid.catalogservice.mapper.ProductMapper;
import com.shopgrid.catalogservice.model.Category;
import com.shopgrid.catalogservice.model.Product;
import com.shopgrid.catalogservice.model.ProductImage;
import com.shopgrid.catalogservice.repository.CategoryRepository;
import com.shopgrid.catalogservice.repository.ProductRepository;
import com.shopgrid.catalogservice.repository.ProductSpecifications;
import com.shopgrid.catalogservice.security.AuthenticatedCaller;
import com.shopgrid.catalogservice.security.AuthorizationGuard;
import com.shopgrid.catalogservice.security.TokenClaims;
import com.shopgrid.common.dto.ShopResponse;
import com.shopgrid.common.exception.AccessDeniedException;
import com.shopgrid.common.exception.DuplicateResourceException;
import com.shopgrid.common.exception.ResourceNotFoundException;
import jakarta.transaction.Transactional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

@Service
public class ProductServiceImpl implements ProductService {

        private static final Logger log = LoggerFactory.getLogger(ProductServiceImpl.class);

        static final String ONLY_SHOP_OWNERS = "Only shop owners can create products";
        static final String NO_SHOP_FOUND = "No shop found for this owner";
        static final String CANNOT_MODIFY = "You can't modify products of other shops.";
        static final String CANNOT_DELETE = "You can't delete products of other shops.";

        private final ProductRepository productRepository;
        private final CategoryRepository categoryRepository;
        private final ProductMapper productMapper;
        private final AuthorizationGuard authorizationGuard;
        private final ShopDirectoryClient shopDirectoryClient;
        private final GeoRanker geoRanker;
        private final SkuGenerator skuGenerator;
        private final SkuProperties skuProperties;
        private final TransactionTemplate transactionTemplate;
        private final ApplicationEventPublisher eventPublisher;

        public ProductServiceImpl(ProductRepository productRepository,
                                  CategoryRepository categoryRepository,
                                  ProductMapper productMapper,
                                  AuthorizationGuard authorizationGuard,
                                  ShopDirectoryClient shopDirectoryClient,
                                  GeoRanker geoRanker,
                                  SkuGenerator skuGenerator,
                                  SkuProperties skuProperties,
                                  TransactionTemplate transactionTemplate,
                                  ApplicationEventPublisher eventPublisher) {
                this.productRepository = productRepository;
                this.categoryRepository = categoryRepository;
                this.productMapper = productMapper;
                this.authorizationGuard = authorizationGuard;
                this.shopDirectoryClient = shopDirectoryClient;
                this.geoRanker = geoRanker;
                this.skuGenerator = skuGenerator;
                this.skuProperties = skuProperties;
                this.transactionTemplate = transactionTemplate;
                this.eventPublisher = eventPublisher;
        }

        /**
         * Not transactional on purpose: the shop directory call must not hold a database
         * connection, and every SKU attempt runs in its own transaction.
         */
        @Override
        public ProductResponse createProduct(ProductRequest request, AuthenticatedCaller caller) {
                TokenClaims claims = claimsOf(caller);
                if (!authorizationGuard.canCreate(claims)) {
                        log.warn("Access denied: subject {} with role {} attempted to create a product",
                                        claims != null ? claims.getSubjectId() : null,
                                        claims != null ? claims.getRole() : null);
                        throw new AccessDeniedException(ONLY_SHOP_OWNERS);
                }

                Category category = null;
                if (request.getCategoryId() != null) {
                        category = categoryRepository.findById(request.getCategoryId())
                                        .orElseThrow(() -> new ResourceNotFoundException("Category not found"));
                }

                ShopResponse shop = resolveShop(caller);
                Product savedProduct = saveWithUniqueSku(request, category, shop);

                log.info("Product created: id={}, sku={}, name='{}', shopId={}, shopName='{}', price={}",
                                savedProduct.getId(), savedProduct.getSku(), savedProduct.getName(),
                                savedProduct.getShopId(), savedProduct.getShopName(), savedProduct.getPrice());

                return productMapper.toProductResponse(savedProduct);
        }

        @Override
        @Transactional
        public ProductResponse updateProduct(Long productId, ProductUpdateRequest request, AuthenticatedCaller caller) {
                // Find product
                Product product = productRepository.findById(productId)
                                .orElseThrow(() -> new ResourceNotFoundException("Product not found"));

                // Check authorization
                TokenClaims claims = claimsOf(caller);
                if (!authorizationGuard.canMutate(claims, product)) {
                        log.warn("Access denied: subject {} attempted to update product {} of shop {}",
                                        claims != null ? claims.getSubjectId() : null, productId, product.getShopId());
                        throw new AccessDeniedException(CANNOT_MODIFY);
                }

                String newSku = request.getSku() != null ? request.getSku().trim() : null;
                if (newSku != null && newSku.isEmpty()) {
                        throw new IllegalArgumentException("SKU cannot be blank");
                }
                if (newSku != null && !newSku.equals(product.getSku()) && productRepository.existsBySku(newSku)) {
                        throw new DuplicateResourceException("Product with SKU '" + newSku + "' already exists");
                }

                // Update basic fields, shop snapshot is left alone
                productMapper.updateProductFromRequest(request, product);
                if (newSku != null) {
                        product.setSku(newSku);
                }
                if (request.getCategoryId() != null) {
                        product.setCategory(categoryRepository.findById(request.getCategoryId())
                                        .orElseThrow(() -> new ResourceNotFoundException("Category not found")));
                }
                if (request.getTags() != null) {
                        product.getTags().clear();
                        product.getTags().addAll(cleanTags(request.getTags()));
                }

                Product updatedProduct;
                try {
                        updatedProduct = productRepository.saveAndFlush(product);
                } catch (DataIntegrityViolationException e) {
                        throw new DuplicateResourceException("Product with SKU '" + newSku + "' already exists", e);
                }

                log.info("Product updated: id={}, sku={}, name='{}', shopId={}, price={}, available={}",
                                productId, updatedProduct.getSku(), updatedProduct.getName(),
                                updatedProduct.getShopId(), updatedProduct.getPrice(), updatedProduct.getAvailable());

                return productMapper.toProductResponse(updatedProduct);
        }

        @Override
        @Transactional
        public void deleteProduct(Long productId, AuthenticatedCaller caller) {
                // Find product
                Product product = productRepository.findById(productId)
                                .orElseThrow(() -> new ResourceNotFoundException("Product not found"));

                // Check authorization
                TokenClaims claims = claimsOf(caller);
                if (!authorizationGuard.canMutate(claims, product)) {
                        log.warn("Access denied: subject {} attempted to delete product {} of shop {}",
                                        claims != null ? claims.getSubjectId() : null, productId, product.getShopId());
                        throw new AccessDeniedException(CANNOT_DELETE);
                }

                // Delete, image rows and tags go with the product
                List<String> imageKeys = product.getImages().stream()
                                .map(ProductImage::getImagePath)
                                .toList();
                String productName = product.getName();
                productRepository.delete(product);

                log.info("Product deleted: id={}, name='{}', shopId={}, images={}",
                                productId, productName, product.getShopId(), imageKeys.size());

                // Stored files are removed after commit
                if (!imageKeys.isEmpty()) {
                        eventPublisher.publishEvent(new ImagesRemovedEvent(this, productId, imageKeys));
                }
        }

        @Override
        @Transactional
        public ProductResponse getProductById(Long productId) {
                Product product = productRepository.findByIdAndAvailableTrue(productId)
                                .orElseThrow(() -> new ResourceNotFoundException("Product not found"));

                return productMapper.toProductResponse(product);
        }

        @Override
        @Transactional
        public PageResponse<ProductResponse> listProducts(ProductFilter filter, Pageable pageable) {
                Page<Product> page = productRepository.findAll(ProductSpecifications.listing(filter), pageable);
                return PageResponse.of(page.map(productMapper::toProductResponse));
        }

        @Override
        @Transactional
        public List<NearbyProductResponse> searchNearby(String query, GeoQuery geoQuery) {
                List<Product> candidates = productRepository.findAll(ProductSpecifications.geoCandidates(query),
                                Sort.by(Sort.Direction.ASC, "id"));
                List<RankedProduct> ranked = geoRanker.rank(candidates,
                                geoQuery.latitude(), geoQuery.longitude(), geoQuery.radiusKm());

                log.debug("Radius search: origin=({}, {}), radiusKm={}, query='{}', candidates={}, matches={}",
                                geoQuery.latitude(), geoQuery.longitude(), geoQuery.radiusKm(), query,
                                candidates.size(), ranked.size());

                return ranked.stream()
                                .map(match -> new NearbyProductResponse(
                                                productMapper.toProductResponse(match.product()),
                                                match.roundedDistanceKm()))
                                .toList();
        }

        /**
         * Picks the shop the new product is attached to. Owners with several shops get their first one.
         * A failed lookup and an owner without shops end in the same denial but are logged differently.
         */
        private ShopResponse resolveShop(AuthenticatedCaller caller) {
                List<ShopResponse> shops;
                try {
                        shops = shopDirectoryClient.listOwnedShops(caller.subjectId(), caller.token());
                } catch (NoShopsFoundException e) {
                        log.warn("Product creation denied: owner {} has no shops", caller.subjectId());
                        throw new AccessDeniedException(NO_SHOP_FOUND);
                } catch (ShopDirectoryUnavailableException e) {
                        log.error("Product creation denied: shop directory lookup failed for owner {}: {}",
                                        caller.subjectId(), e.getMessage());
                        throw new AccessDeniedException(NO_SHOP_FOUND);
                }

                if (shops == null || shops.isEmpty()) {
                        log.warn("Product creation denied: owner {} has no shops", caller.subjectId());
                        throw new AccessDeniedException(NO_SHOP_FOUND);
                }
                if (shops.size() > 1) {
                        log.info("Owner {} has {} shops, attaching product to the first one: shopId={}",
                                        caller.subjectId(), shops.size(), shops.get(0).getId());
                }
                return shops.get(0);
        }

        /**
         * Inserts the product, generating SKUs until one is accepted by the unique constraint.
         * A client supplied SKU is tried once and a clash is reported as a conflict.
         */
        private Product saveWithUniqueSku(ProductRequest request, Category category, ShopResponse shop) {
                boolean clientSku = StringUtils.hasText(request.getSku());
                int maxAttempts = clientSku ? 1 : skuProperties.maxAttempts();

                for (int attempt = 1; ; attempt++) {
                        String sku = clientSku ? request.getSku().trim() : skuGenerator.next();
                        Product product = newProduct(request, category, shop, sku);
                        try {
                                return transactionTemplate.execute(status -> productRepository.saveAndFlush(product));
                        } catch (DataIntegrityViolationException e) {
                                if (!productRepository.existsBySku(sku)) {
                                        throw e;
                                }
                                if (clientSku) {
                                        throw new DuplicateResourceException("Product with SKU '" + sku + "' already exists", e);
                                }
                                if (attempt >= maxAttempts) {
                                        log.error("Giving up on SKU generation after {} collisions", attempt);
                                        throw new IllegalStateException("Could not generate a unique SKU", e);
                                }
                                log.warn("SKU collision on {}, retrying (attempt {}/{})", sku, attempt, maxAttempts);
                        }
                }
        }

        private Product newProduct(ProductRequest request, Category category, ShopResponse shop, String sku) {
                Product product = productMapper.toProduct(request);
                product.setSku(sku);
                product.setCategory(category);
                product.setAvailable(request.getAvailable() == null || request.getAvailable());
                product.setTags(request.getTags() == null ? new ArrayList<>() : cleanTags(request.getTags()));

                // Snapshot of the shop, frozen from here on
                product.setShopId(shop.getId());
                product.setShopName(shop.getName());
                product.setShopLat(shop.getLatitude());
                product.setShopLng(shop.getLongitude());
                return product;
        }

        private static List<String> cleanTags(List<String> tags) {
                List<String> cleaned = new ArrayList<>(tags.size());
                for (String tag : tags) {
                        if (StringUtils.hasText(tag)) {
                                cleaned.add(tag.trim());
                        }
                }
                return cleaned;
        }

        private static TokenClaims claimsOf(AuthenticatedCaller caller) {
                return caller != null ? caller.claims() : null;
        }
}
