package com.shopgrid.catalogservice.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopgrid.catalogservice.config.ShopDirectoryProperties;
import com.shopgrid.common.dto.ShopResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Shop directory lookup over HTTP: {@code GET <base-url>?owner_id=<subject>}.
 *
 * The call blocks for at most the configured timeout and is never retried. The directory answers
 * either with a bare JSON array of shops or with a paginated envelope holding them under {@code results}.
 */
@Slf4j
@Component
public class WebClientShopDirectoryClient implements ShopDirectoryClient {

    static final String OWNER_ID_PARAM = "owner_id";
    static final String RESULTS_FIELD = "results";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public WebClientShopDirectoryClient(@Qualifier("shopDirectoryWebClient") WebClient webClient,
                                        ObjectMapper objectMapper,
                                        ShopDirectoryProperties properties) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.timeout = properties.timeout();
    }

    @Override
    public List<ShopResponse> listOwnedShops(String subjectId, String credential) {
        JsonNode body;
        try {
            body = webClient.get()
                    .uri(uriBuilder -> uriBuilder.queryParam(OWNER_ID_PARAM, subjectId).build())
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + credential)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .onStatus(status -> !status.is2xxSuccessful(),
                            response -> Mono.error(new ShopDirectoryUnavailableException(
                                    "Shop directory answered " + response.statusCode().value())))
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block();
        } catch (ShopDirectoryUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ShopDirectoryUnavailableException("Shop directory unavailable: " + e.getMessage(), e);
        }

        List<ShopResponse> shops = readShops(body);
        if (shops.isEmpty()) {
            throw new NoShopsFoundException(subjectId);
        }
        log.debug("Shop directory returned {} shop(s) for owner {}", shops.size(), subjectId);
        return shops;
    }

    private List<ShopResponse> readShops(JsonNode body) {
        JsonNode items = body;
        if (body != null && body.isObject() && body.has(RESULTS_FIELD)) {
            items = body.get(RESULTS_FIELD);
        }
        if (items == null || items.isNull() || items.isMissingNode()) {
            return List.of();
        }
        if (!items.isArray()) {
            throw new ShopDirectoryUnavailableException("Unexpected shop directory response: " + items.getNodeType());
        }

        List<ShopResponse> shops = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            ShopResponse shop;
            try {
                shop = objectMapper.treeToValue(item, ShopResponse.class);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new ShopDirectoryUnavailableException("Unreadable shop record: " + e.getMessage(), e);
            }
            if (shop == null || shop.getId() == null || shop.getName() == null) {
                throw new ShopDirectoryUnavailableException("Shop record without id or name");
            }
            shops.add(shop);
        }
        return shops;
    }
}
