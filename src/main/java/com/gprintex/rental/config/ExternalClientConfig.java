package com.gprintex.rental.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * HTTP client setup for the record services and the content generation service.
 */
@Configuration
public class ExternalClientConfig {

    private static final Logger log = LoggerFactory.getLogger(ExternalClientConfig.class);
    private static final int MAX_GENERATED_DOCUMENT_BYTES = 4 * 1024 * 1024;

    private final RentalContractProperties properties;

    public ExternalClientConfig(RentalContractProperties properties) {
        this.properties = properties;
    }

    /**
     * WebClient for the profile, rental-request and equipment services.
     * Each service has its own base URL, so requests carry absolute URIs.
     */
    @Bean
    public WebClient recordServicesWebClient(WebClient.Builder builder) {
        return builder.clone()
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .filter(loggingFilter("record-service"))
            .build();
    }

    /**
     * WebClient for the generative text service with API key authentication.
     */
    @Bean
    public WebClient generationWebClient(WebClient.Builder builder) {
        var generation = properties.generation();
        return builder.clone()
            .baseUrl(generation.baseUrl())
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_GENERATED_DOCUMENT_BYTES))
            .filter(apiKeyFilter(generation.apiKey()))
            .filter(loggingFilter("generation"))
            .build();
    }

    private ExchangeFilterFunction apiKeyFilter(String apiKey) {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            if (apiKey == null || apiKey.isBlank()) {
                log.warn("Generation API key is not configured, sending unauthenticated request");
                return Mono.just(clientRequest);
            }
            return Mono.just(ClientRequest.from(clientRequest)
                .header("x-goog-api-key", apiKey)
                .build());
        });
    }

    private ExchangeFilterFunction loggingFilter(String target) {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("{} request: {} {}", target, clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
