package com.gprintex.rental.domain;

import java.util.Locale;

/**
 * Envelope status tokens reported by the signature provider.
 * Anything outside the modelled set maps to {@link #UNRECOGNIZED}.
 */
public enum SigningEventStatus {
    SENT(ContractStatus.SENT),
    COMPLETED(ContractStatus.COMPLETED),
    DECLINED(ContractStatus.DECLINED),
    UNRECOGNIZED(null);

    private final ContractStatus target;

    SigningEventStatus(ContractStatus target) {
        this.target = target;
    }

    /**
     * Contract status this event drives the record towards; null for {@link #UNRECOGNIZED}.
     */
    public ContractStatus target() {
        return target;
    }

    /**
     * Case-insensitive parse. Also accepts the "envelope-completed" style event names.
     */
    public static SigningEventStatus fromToken(String token) {
        if (token == null || token.isBlank()) {
            return UNRECOGNIZED;
        }
        var normalized = token.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("envelope-")) {
            normalized = normalized.substring("envelope-".length());
        }
        return switch (normalized) {
            case "sent" -> SENT;
            case "completed" -> COMPLETED;
            case "declined" -> DECLINED;
            default -> UNRECOGNIZED;
        };
    }
}
