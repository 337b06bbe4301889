package com.gprintex.rental.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.gprintex.rental.config.RentalContractProperties;
import com.gprintex.rental.domain.ContractPipelineException;
import com.gprintex.rental.domain.EquipmentRecord;
import com.gprintex.rental.domain.PartyProfile;
import com.gprintex.rental.domain.PipelineErrorCode;
import com.gprintex.rental.domain.PostalAddress;
import com.gprintex.rental.domain.RentalRequestRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Read-only client for the profile, rental-request and equipment services.
 * A missing id or a 404 yields an empty Optional. A timeout, any other error status or an
 * unreadable body is signalled as a {@link ContractPipelineException} with FETCH_FAILED.
 */
@Component
public class RentalDataClient {

    private static final Logger log = LoggerFactory.getLogger(RentalDataClient.class);

    private final WebClient webClient;
    private final RentalContractProperties.ServicesProperties services;

    public RentalDataClient(
        @Qualifier("recordServicesWebClient") WebClient webClient,
        RentalContractProperties properties
    ) {
        this.webClient = webClient;
        this.services = properties.services();
    }

    public Mono<Optional<PartyProfile>> fetchProfile(String userId) {
        return fetch("profile", services.profileUri(), userId, RentalDataClient::toProfile);
    }

    public Mono<Optional<RentalRequestRecord>> fetchRentalRequest(String requestId) {
        return fetch("rental-request", services.rentalUri(), requestId, RentalDataClient::toRentalRequest);
    }

    public Mono<Optional<EquipmentRecord>> fetchEquipment(String equipmentId) {
        return fetch("equipment", services.equipmentUri(), equipmentId, RentalDataClient::toEquipment);
    }

    private <T> Mono<Optional<T>> fetch(
        String resource,
        String uriTemplate,
        String id,
        Function<JsonNode, Optional<T>> mapper
    ) {
        if (id == null || id.isBlank()) {
            return Mono.just(Optional.empty());
        }
        return webClient.get()
            .uri(uriTemplate, id)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(services.timeout())
            .map(mapper)
            .defaultIfEmpty(Optional.empty())
            .onErrorResume(WebClientResponseException.NotFound.class, e -> {
                log.debug("No {} record for {}", resource, id);
                return Mono.just(Optional.empty());
            })
            .onErrorMap(e -> !(e instanceof ContractPipelineException), e -> fetchFailed(resource, id, e));
    }

    private ContractPipelineException fetchFailed(String resource, String id, Throwable cause) {
        String detail;
        if (cause instanceof TimeoutException) {
            detail = "Fetching " + resource + " " + id + " timed out after " + services.timeout().toMillis() + "ms";
        } else if (cause instanceof WebClientResponseException e) {
            detail = "Fetching " + resource + " " + id + " failed: status=" + e.getStatusCode().value();
        } else {
            detail = "Fetching " + resource + " " + id + " failed: " + cause.getMessage();
        }
        log.warn(detail);
        return new ContractPipelineException(PipelineErrorCode.FETCH_FAILED, detail, cause);
    }

    // ========================================================================
    // PAYLOAD MAPPING
    // ========================================================================

    /**
     * The profile service answers a user filter with a list; the first entry wins.
     */
    static Optional<PartyProfile> toProfile(JsonNode body) {
        var node = body;
        if (node != null && node.isArray()) {
            node = node.isEmpty() ? null : node.get(0);
        }
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        var address = node.path("address");
        return Optional.of(new PartyProfile(
            text(node, "first_name"),
            text(node, "last_name"),
            text(node, "phone"),
            new PostalAddress(
                text(address, "street"),
                text(address, "city"),
                text(address, "state"),
                text(address, "postal_code"),
                text(address, "country")
            )
        ));
    }

    static Optional<EquipmentRecord> toEquipment(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        return Optional.of(new EquipmentRecord(
            text(node, "stuffname"),
            text(node, "brand"),
            text(node, "location"),
            text(node, "price_per_day"),
            text(node, "state"),
            text(node, "rental_location"),
            text(node, "short_description"),
            text(node, "detailed_description")
        ));
    }

    static Optional<RentalRequestRecord> toRentalRequest(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        return Optional.of(new RentalRequestRecord(
            optionalText(node, "id"),
            optionalText(node, "status"),
            optionalText(node, "quantity").flatMap(RentalDataClient::parseInteger),
            optionalText(node, "total_price").flatMap(RentalDataClient::parseDecimal),
            optionalText(node, "start_date").flatMap(RentalRequestRecord::parseDatePortion),
            optionalText(node, "end_date").flatMap(RentalRequestRecord::parseDatePortion)
        ));
    }

    private static String text(JsonNode node, String field) {
        return optionalText(node, field).orElse("");
    }

    private static Optional<String> optionalText(JsonNode node, String field) {
        if (node == null) {
            return Optional.empty();
        }
        var value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return Optional.empty();
        }
        return Optional.of(value.asText());
    }

    private static Optional<Integer> parseInteger(String value) {
        try {
            return Optional.of(Integer.valueOf(value.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<BigDecimal> parseDecimal(String value) {
        try {
            return Optional.of(new BigDecimal(value.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
