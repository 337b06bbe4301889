package com.gprintex.rental.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Rental request from the rental-request service.
 * Dates are already reduced to their date portion.
 */
public record RentalRequestRecord(
    Optional<String> id,
    Optional<String> status,
    Optional<Integer> quantity,
    Optional<BigDecimal> totalPrice,
    Optional<LocalDate> startDate,
    Optional<LocalDate> endDate
) {
    public RentalRequestRecord {
        id = id != null ? id : Optional.empty();
        status = status != null ? status : Optional.empty();
        quantity = quantity != null ? quantity : Optional.empty();
        totalPrice = totalPrice != null ? totalPrice : Optional.empty();
        startDate = startDate != null ? startDate : Optional.empty();
        endDate = endDate != null ? endDate : Optional.empty();
    }

    /**
     * Keep only the date part of an ISO date or date-time such as 2024-05-01T10:00:00Z.
     */
    public static Optional<LocalDate> parseDatePortion(String value) {
        if (value == null) {
            return Optional.empty();
        }
        var datePart = value.split("T", 2)[0].trim();
        if (datePart.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(datePart));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
