package com.gprintex.rental.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Contract lifecycle status. Stored and exposed as lowercase tokens.
 */
public enum ContractStatus {
    DRAFT,
    SENT_FOR_SIGNING,
    SENT,
    COMPLETED,
    DECLINED;

    /**
     * Check if transition to target status is valid.
     */
    public boolean canTransitionTo(ContractStatus target) {
        return switch (this) {
            case DRAFT -> target == SENT_FOR_SIGNING;
            case SENT_FOR_SIGNING -> target == SENT || target == COMPLETED || target == DECLINED;
            case SENT -> target == COMPLETED || target == DECLINED;
            case COMPLETED, DECLINED -> false;
        };
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == DECLINED;
    }

    @JsonValue
    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ContractStatus> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        var normalized = token.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(s -> s.name().equals(normalized))
            .findFirst();
    }
}
