package com.gprintex.rental.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Contract terms supplied by the caller. Request-level values override these when present.
 */
public record ContractTerms(
    String ownerName,
    String clientName,
    List<String> equipmentRefs,
    Optional<LocalDate> startDate,
    Optional<LocalDate> endDate,
    Optional<BigDecimal> totalValue,
    String details
) {
    public ContractTerms {
        equipmentRefs = equipmentRefs != null ? List.copyOf(equipmentRefs) : List.of();
        startDate = startDate != null ? startDate : Optional.empty();
        endDate = endDate != null ? endDate : Optional.empty();
        totalValue = totalValue != null ? totalValue : Optional.empty();
        details = details != null ? details : "";
    }

    /**
     * Start date after request precedence.
     */
    public Optional<LocalDate> effectiveStartDate(AggregatedContext context) {
        return context.request().flatMap(RentalRequestRecord::startDate).or(() -> startDate);
    }

    /**
     * End date after request precedence.
     */
    public Optional<LocalDate> effectiveEndDate(AggregatedContext context) {
        return context.request().flatMap(RentalRequestRecord::endDate).or(() -> endDate);
    }

    /**
     * Total after request precedence, zero when neither side supplies one.
     */
    public BigDecimal effectiveTotal(AggregatedContext context) {
        return context.request().flatMap(RentalRequestRecord::totalPrice)
            .or(() -> totalValue)
            .orElse(BigDecimal.ZERO);
    }
}
