package com.shopgrid.catalogservice;

import com.shopgrid.catalogservice.client.NoShopsFoundException;
import com.shopgrid.catalogservice.client.ShopDirectoryUnavailableException;
import com.shopgrid.catalogservice.model.Product;
import com.shopgrid.catalogservice.support.TestTokens;
import com.shopgrid.common.dto.ShopResponse;
import io.jsonwebtoken.Jwts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.matchesPattern;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@DisplayName("Product API Integration Tests")
class ProductApiIntegrationTest extends AbstractIntegrationTest {

    private static final String PRODUCTS = "/api/v1/products";

    // km per degree of latitude on the ranking sphere
    private static final double KM_PER_DEGREE = 6371.0 * Math.PI / 180.0;

    private static final String CREATE_PAYLOAD = "{"
            + "\"name\": \"Olive Oil\","
            + "\"description\": \"Cold pressed\","
            + "\"price\": 12.50,"
            + "\"tags\": [\"oil\", \"organic\"],"
            + "\"shop_id\": 999,"
            + "\"shop_name\": \"Forged Shop\","
            + "\"shop_lat\": 1.0,"
            + "\"shop_lng\": 1.0"
            + "}";

    private Product saveProduct(String name, long shopId, Double lat, Double lng, boolean available) {
        return productRepository.save(Product.builder()
                .sku(("S" + name.toUpperCase().replaceAll("[^A-Z0-9]", "") + "0000000").substring(0, 8))
                .name(name)
                .price(new BigDecimal("5.00"))
                .available(available)
                .shopId(shopId)
                .shopName("Shop " + shopId)
                .shopLat(lat)
                .shopLng(lng)
                .build());
    }

    private Product saveProductNorthOfOrigin(String name, double km) {
        return saveProduct(name, 7L, km / KM_PER_DEGREE, 0.0, true);
    }

    @Nested
    @DisplayName("Authentication")
    class AuthenticationTests {

        @Test
        @DisplayName("should serve the listing to anonymous callers")
        void shouldAllowAnonymousListing() throws Exception {
            saveProduct("Bread", 7L, 1.0, 1.0, true);
            saveProduct("Hidden", 7L, 1.0, 1.0, false);

            mockMvc.perform(get(PRODUCTS))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.count").value(1))
                    .andExpect(jsonPath("$.results[0].name").value("Bread"))
                    .andExpect(jsonPath("$.results[0].shop_id").value(7));
        }

        @Test
        @DisplayName("should reject mutations without credentials")
        void shouldRejectAnonymousCreate() throws Exception {
            mockMvc.perform(post(PRODUCTS).contentType(MediaType.APPLICATION_JSON).content(CREATE_PAYLOAD))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.message").value("Authentication credentials were not provided."))
                    .andExpect(jsonPath("$.error_code").value("AUTHENTICATION_FAILED"));

            assertThat(productRepository.count()).isZero();
        }

        @Test
        @DisplayName("should reject anonymous updates and deletes and leave the product untouched")
        void shouldRejectAnonymousUpdateAndDelete() throws Exception {
            Product product = saveProduct("Bread", 7L, 1.0, 1.0, true);
            String path = PRODUCTS + "/" + product.getId();

            mockMvc.perform(put(path).contentType(MediaType.APPLICATION_JSON).content("{\"price\": 1.00}"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.message").value("Authentication credentials were not provided."));
            mockMvc.perform(patch(path).contentType(MediaType.APPLICATION_JSON).content("{\"name\": \"Cake\"}"))
                    .andExpect(status().isUnauthorized());
            mockMvc.perform(delete(path))
                    .andExpect(status().isUnauthorized());

            Product stored = productRepository.findById(product.getId()).orElseThrow();
            assertThat(stored.getName()).isEqualTo("Bread");
            assertThat(stored.getPrice()).isEqualByComparingTo("5.00");
        }

        @Test
        @DisplayName("should reject anonymous image uploads and deletes")
        void shouldRejectAnonymousImageChanges() throws Exception {
            Product product = saveProduct("Bread", 7L, 1.0, 1.0, true);
            String images = PRODUCTS + "/" + product.getId() + "/images";

            mockMvc.perform(multipart(images)
                            .file(new MockMultipartFile("image", "bread.png", "image/png", new byte[]{1, 2, 3})))
                    .andExpect(status().isUnauthorized());
            mockMvc.perform(multipart(images + "/batch")
                            .file(new MockMultipartFile("images", "a.png", "image/png", new byte[]{1})))
                    .andExpect(status().isUnauthorized());
            mockMvc.perform(delete(images + "/1"))
                    .andExpect(status().isUnauthorized());

            assertThat(productImageRepository.count()).isZero();
        }

        @Test
        @DisplayName("should reject a malformed Authorization header")
        void shouldRejectMalformedHeader() throws Exception {
            mockMvc.perform(get(PRODUCTS).header(HttpHeaders.AUTHORIZATION, "Token abc"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, "Bearer"))
                    .andExpect(jsonPath("$.message").value("Invalid Authorization header format."));
        }

        @Test
        @DisplayName("should reject an invalid token")
        void shouldRejectInvalidToken() throws Exception {
            mockMvc.perform(get(PRODUCTS).header(HttpHeaders.AUTHORIZATION, "Bearer not.a.token"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.message").value("Invalid or expired token."));
        }

        @Test
        @DisplayName("should reject a refresh token")
        void shouldRejectRefreshToken() throws Exception {
            String refresh = TestTokens.accessToken(42)
                    .claim("type", "refresh")
                    .signWith(TestTokens.KEY, Jwts.SIG.HS256)
                    .compact();

            mockMvc.perform(post(PRODUCTS)
                            .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(refresh))
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(CREATE_PAYLOAD))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.message").value("Token is not an access token."));
        }
    }

    @Nested
    @DisplayName("Create Product")
    class CreateProductTests {

        @Test
        @DisplayName("should create a product with the owner's first shop frozen onto it")
        void shouldCreateWithShopSnapshot() throws Exception {
            // Arrange
            String token = TestTokens.shopOwner(42, 7L, 8L);
            when(shopDirectoryClient.listOwnedShops("42", token)).thenReturn(List.of(
                    ShopResponse.builder().id(7L).name("Corner Deli").latitude(41.0).longitude(29.0).build(),
                    ShopResponse.builder().id(8L).name("Second Shop").latitude(40.0).longitude(28.0).build()));

            // Act & Assert
            mockMvc.perform(post(PRODUCTS)
                            .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(token))
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(CREATE_PAYLOAD))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.shop_id").value(7))
                    .andExpect(jsonPath("$.shop_name").value("Corner Deli"))
                    .andExpect(jsonPath("$.shop_lat").value(41.0))
                    .andExpect(jsonPath("$.shop_lng").value(29.0))
                    .andExpect(jsonPath("$.sku").value(matchesPattern("[A-Z0-9]{8}")))
                    .andExpect(jsonPath("$.available").value(true))
                    .andExpect(jsonPath("$.tags", contains("oil", "organic")));

            assertThat(productRepository.count()).isEqualTo(1);
        }

        @Test
        @DisplayName("should deny callers without the shop owner role")
        void shouldDenyCustomer() throws Exception {
            mockMvc.perform(post(PRODUCTS)
                            .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(TestTokens.customer(42)))
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(CREATE_PAYLOAD))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.message").value("Only shop owners can create products"))
                    .andExpect(jsonPath("$.error_code").value("ACCESS_DENIED"));

            verifyNoInteractions(shopDirectoryClient);
            assertThat(productRepository.count()).isZero();
        }

        @Test
        @DisplayName("should deny owners without shops and create nothing")
        void shouldDenyOwnerWithoutShops() throws Exception {
            when(shopDirectoryClient.listOwnedShops(anyString(), anyString())).thenThrow(new NoShopsFoundException("42"));

            mockMvc.perform(post(PRODUCTS)
                            .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(TestTokens.shopOwner(42)))
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(CREATE_PAYLOAD))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.message").value("No shop found for this owner"));

            assertThat(productRepository.count()).isZero();
        }

        @Test
        @DisplayName("should answer a directory outage with the same denial")
        void shouldDenyWhenDirectoryDown() throws Exception {
            when(shopDirectoryClient.listOwnedShops(anyString(), anyString()))
                    .thenThrow(new ShopDirectoryUnavailableException("Shop directory answered 503"));

            mockMvc.perform(post(PRODUCTS)
                            .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(TestTokens.shopOwner(42)))
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(CREATE_PAYLOAD))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.message").value("No shop found for this owner"));

            assertThat(productRepository.count()).isZero();
        }

        @Test
        @DisplayName("should reject an invalid payload with field errors")
        void shouldRejectInvalidPayload() throws Exception {
            mockMvc.perform(post(PRODUCTS)
                            .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(TestTokens.shopOwner(42, 7L)))
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"name\": \"\", \"price\": -1}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error_code").value("VALIDATION_FAILED"))
                    .andExpect(jsonPath("$.validation_errors.name").exists())
                    .andExpect(jsonPath("$.validation_errors.price").exists());

            verifyNoInteractions(shopDirectoryClient);
        }
    }

    @Nested
    @DisplayName("Update And Delete")
    class UpdateAndDeleteTests {

        @Test
        @DisplayName("should let the owner update but never move the product to another shop")
        void shouldUpdateOwnProduct() throws Exception {
            Product product = saveProduct("Bread", 7L, 1.0, 1.0, true);

            mockMvc.perform(patch(PRODUCTS + "/" + product.getId())
                            .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(TestTokens.shopOwner(42, 7L)))
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"price\": 3.25, \"shop_id\": 8, \"shop_name\": \"Elsewhere\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.price").value(3.25))
                    .andExpect(jsonPath("$.shop_id").value(7))
                    .andExpect(jsonPath("$.shop_name").value("Shop 7"));
        }

        @Test
        @DisplayName("should reject a blank SKU and keep the stored one")
        void shouldRejectBlankSku() throws Exception {
            Product product = saveProduct("Bread", 7L, 1.0, 1.0, true);
            String sku = product.getSku();

            mockMvc.perform(patch(PRODUCTS + "/" + product.getId())
                            .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(TestTokens.shopOwner(42, 7L)))
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"sku\": \"   \"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error_code").value("VALIDATION_FAILED"))
                    .andExpect(jsonPath("$.validation_errors.sku").value("SKU cannot be blank"));

            assertThat(productRepository.findById(product.getId()).orElseThrow().getSku()).isEqualTo(sku);
        }

        @Test
        @DisplayName("should deny updates from owners of other shops")
        void shouldDenyForeignUpdate() throws Exception {
            Product product = saveProduct("Bread", 7L, 1.0, 1.0, true);

            mockMvc.perform(put(PRODUCTS + "/" + product.getId())
                            .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(TestTokens.shopOwner(43, 99L)))
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"price\": 1.00}"))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.message").value("You can't modify products of other shops."));

            assertThat(productRepository.findById(product.getId()).orElseThrow().getPrice())
                    .isEqualByComparingTo("5.00");
        }

        @Test
        @DisplayName("should fall back to the subject id for tokens without shop_ids")
        void shouldUseSubjectFallback() throws Exception {
            Product product = saveProduct("Bread", 7L, 1.0, 1.0, true);

            mockMvc.perform(delete(PRODUCTS + "/" + product.getId())
                            .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(TestTokens.shopOwner(7))))
                    .andExpect(status().isNoContent());

            assertThat(productRepository.existsById(product.getId())).isFalse();
        }

        @Test
        @DisplayName("should answer 404 for unknown products")
        void shouldAnswerNotFound() throws Exception {
            mockMvc.perform(delete(PRODUCTS + "/424242")
                            .header(HttpHeaders.AUTHORIZATION, TestTokens.bearer(TestTokens.shopOwner(7, 7L))))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error_code").value("RESOURCE_NOT_FOUND"));
        }
    }

    @Nested
    @DisplayName("Search")
    class SearchTests {

        @Test
        @DisplayName("should rank products within the radius closest first")
        void shouldRankByDistance() throws Exception {
            saveProductNorthOfOrigin("Medium", 3.2);
            saveProductNorthOfOrigin("Near", 1.0);
            saveProductNorthOfOrigin("Far", 4.9);
            saveProductNorthOfOrigin("Outside", 6.0);
            saveProduct("Unlocated", 7L, null, null, true);
            saveProduct("Withdrawn", 7L, 0.0, 0.0, false);

            mockMvc.perform(get(PRODUCTS + "/search").param("lat", "0").param("lng", "0").param("radius_km", "5"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$", hasSize(3)))
                    .andExpect(jsonPath("$[*].name", contains("Near", "Medium", "Far")))
                    .andExpect(jsonPath("$[0].distance_km").value(1.0))
                    .andExpect(jsonPath("$[1].distance_km").value(3.2))
                    .andExpect(jsonPath("$[2].distance_km").value(4.9));
        }

        @Test
        @DisplayName("should narrow radius matches by name")
        void shouldFilterByName() throws Exception {
            saveProductNorthOfOrigin("Olive Oil", 1.0);
            saveProductNorthOfOrigin("Bread", 0.5);

            mockMvc.perform(get(PRODUCTS + "/search").param("q", "OIL").param("lat", "0").param("lng", "0"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$[*].name", contains("Olive Oil")));
        }

        @Test
        @DisplayName("should fall back to the paginated name search without coordinates")
        void shouldFallBackToListing() throws Exception {
            saveProduct("Olive Oil", 7L, null, null, true);
            saveProduct("Bread", 7L, null, null, true);

            mockMvc.perform(get(PRODUCTS + "/search").param("q", "oil"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.count").value(1))
                    .andExpect(jsonPath("$.results[0].name").value("Olive Oil"));
        }

        @Test
        @DisplayName("should answer 400 for invalid coordinates")
        void shouldRejectInvalidCoordinates() throws Exception {
            mockMvc.perform(get(PRODUCTS + "/search").param("lat", "abc").param("lng", "10"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("Invalid lat/lng"));

            mockMvc.perform(get(PRODUCTS + "/search").param("lat", "95").param("lng", "10"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("Invalid lat/lng"));
        }

        @Test
        @DisplayName("should filter and order the listing")
        void shouldFilterListing() throws Exception {
            Product cheap = saveProduct("Cheap Oil", 7L, null, null, true);
            cheap.setPrice(new BigDecimal("2.00"));
            cheap.setTags(new ArrayList<>(List.of("pantry")));
            productRepository.save(cheap);
            saveProduct("Bread", 7L, null, null, true);

            mockMvc.perform(get(PRODUCTS).param("search", "PANTRY"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.results[*].name", contains("Cheap Oil")));

            mockMvc.perform(get(PRODUCTS).param("ordering", "price"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.results[*].name", contains("Cheap Oil", "Bread")));

            mockMvc.perform(get(PRODUCTS).param("min_price", "3"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.results[*].name", contains("Bread")));
        }
    }
}
