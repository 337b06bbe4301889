package com.gprintex.rental.domain;

import java.time.Instant;
import java.util.Optional;

/**
 * One inbound envelope notification. Consumed by the reconciler and discarded.
 */
public record SigningEvent(
    String envelopeId,
    String statusToken,
    SigningEventStatus status,
    Optional<Instant> occurredAt
) {
    public SigningEvent {
        occurredAt = occurredAt != null ? occurredAt : Optional.empty();
        status = status != null ? status : SigningEventStatus.fromToken(statusToken);
    }

    public static SigningEvent of(String envelopeId, String statusToken, Instant occurredAt) {
        return new SigningEvent(
            envelopeId,
            statusToken,
            SigningEventStatus.fromToken(statusToken),
            Optional.ofNullable(occurredAt)
        );
    }

    /**
     * Check the structural minimum: an envelope id and a status token.
     */
    public boolean isWellFormed() {
        return envelopeId != null && !envelopeId.isBlank()
            && statusToken != null && !statusToken.isBlank();
    }

    /**
     * Event time, or the supplied processing time when the provider omitted it.
     */
    public Instant effectiveTime(Instant processingTime) {
        return occurredAt.orElse(processingTime);
    }
}
