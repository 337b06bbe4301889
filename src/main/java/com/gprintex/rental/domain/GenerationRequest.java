package com.gprintex.rental.domain;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Inbound contract generation request. Field names follow the existing client payloads.
 */
public record GenerationRequest(
    @JsonProperty("rentalId") String ownerId,
    @JsonProperty("clientId") String clientId,
    @JsonProperty("equipmentId")
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    List<String> equipmentIds,
    @JsonProperty("requestId") String requestId,
    @JsonProperty("startDate") String startDate,
    @JsonProperty("endDate") String endDate,
    @JsonProperty("total_price") BigDecimal totalPrice,
    @JsonProperty("status") String status,
    @JsonProperty("signer_email") String signerEmail,
    @JsonProperty("signer_name") String signerName,
    @JsonProperty("return_url") String returnUrl
) {
    public GenerationRequest {
        equipmentIds = equipmentIds != null
            ? equipmentIds.stream().filter(id -> id != null && !id.isBlank()).toList()
            : List.of();
    }

    /**
     * Caller-supplied terms; request-level values from the rental service take precedence later.
     */
    public ContractTerms terms() {
        return new ContractTerms(
            ownerId,
            clientId,
            equipmentIds,
            parsedStartDate(),
            parsedEndDate(),
            Optional.ofNullable(totalPrice),
            status
        );
    }

    public Optional<LocalDate> parsedStartDate() {
        return RentalRequestRecord.parseDatePortion(startDate);
    }

    public Optional<LocalDate> parsedEndDate() {
        return RentalRequestRecord.parseDatePortion(endDate);
    }
}
