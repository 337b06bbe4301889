package com.gprintex.rental.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.gprintex.rental.config.RentalContractProperties;
import com.gprintex.rental.domain.ContractPipelineException;
import com.gprintex.rental.domain.PipelineErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Gemini generateContent REST client.
 */
@Component
public class GeminiContentClient implements ContentGenerationClient {

    private static final Logger log = LoggerFactory.getLogger(GeminiContentClient.class);
    private static final int MAX_ERROR_BODY_LENGTH = 500;

    private final WebClient webClient;
    private final RentalContractProperties.GenerationProperties generation;

    public GeminiContentClient(
        @Qualifier("generationWebClient") WebClient webClient,
        RentalContractProperties properties
    ) {
        this.webClient = webClient;
        this.generation = properties.generation();
    }

    @Override
    public String generate(String prompt) {
        var body = Map.of("contents", List.of(Map.of("parts", List.of(Map.of("text", prompt)))));

        var response = webClient.post()
            .uri("/v1beta/models/{model}:generateContent", generation.model())
            .bodyValue(body)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(generation.timeout())
            .onErrorResume(TimeoutException.class, e -> {
                log.error("Generation call timed out after {}", generation.timeout());
                return Mono.error(new ContractPipelineException(
                    PipelineErrorCode.GENERATION_FAILED,
                    "Generation timed out after " + generation.timeout().toSeconds() + "s", e));
            })
            .onErrorResume(WebClientResponseException.class, e -> {
                log.error("Generation call failed: status={}", e.getStatusCode().value());
                return Mono.error(new ContractPipelineException(
                    PipelineErrorCode.GENERATION_FAILED,
                    "Generation service returned " + e.getStatusCode().value() + ": "
                        + truncate(e.getResponseBodyAsString()), e));
            })
            .onErrorResume(e -> !(e instanceof ContractPipelineException), e -> {
                log.error("Generation call failed: {}", e.getMessage());
                return Mono.error(new ContractPipelineException(
                    PipelineErrorCode.GENERATION_FAILED, "Generation call failed: " + e.getMessage(), e));
            })
            .block();

        var text = extractText(response);
        if (text.isBlank()) {
            throw new ContractPipelineException(PipelineErrorCode.GENERATION_FAILED, "Generation service returned no text");
        }
        return text;
    }

    /**
     * Concatenate the text parts of the first candidate.
     */
    static String extractText(JsonNode response) {
        if (response == null) {
            return "";
        }
        var parts = response.path("candidates").path(0).path("content").path("parts");
        var text = new StringBuilder();
        parts.forEach(part -> {
            var value = part.get("text");
            if (value != null && value.isTextual()) {
                text.append(value.asText());
            }
        });
        return text.toString();
    }

    private static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_ERROR_BODY_LENGTH ? body : body.substring(0, MAX_ERROR_BODY_LENGTH) + "...";
    }
}
