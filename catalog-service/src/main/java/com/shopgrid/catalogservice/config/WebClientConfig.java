package com.shopgrid.catalogservice.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class WebClientConfig {

    @Bean
    public WebClient shopDirectoryWebClient(WebClient.Builder builder, ShopDirectoryProperties properties) {
        return builder.baseUrl(properties.baseUrl()).build();
    }
}
