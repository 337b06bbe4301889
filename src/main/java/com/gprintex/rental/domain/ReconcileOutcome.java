package com.gprintex.rental.domain;

import java.util.Optional;

/**
 * Decision reached for one signing event.
 */
public enum ReconcileOutcome {
    /** Status and timestamp written. */
    APPLIED(null),
    /** Duplicate, stale or post-terminal event; nothing written. */
    NO_CHANGE(null),
    /** Status token outside the modelled set; acknowledged and ignored. */
    IGNORED_STATUS(PipelineErrorCode.WEBHOOK_UNKNOWN_STATUS),
    /** No contract carries the envelope id. */
    UNKNOWN_ENVELOPE(PipelineErrorCode.WEBHOOK_UNKNOWN_ENVELOPE),
    /** Envelope id or status token missing. */
    MALFORMED(PipelineErrorCode.WEBHOOK_MALFORMED),
    /** The record store could not be queried, so nothing was resolved. */
    LOOKUP_FAILED(null),
    /** Resolved, but the write failed; acknowledged to stop redelivery. */
    ERROR_ACKNOWLEDGED(null);

    private final PipelineErrorCode errorCode;

    ReconcileOutcome(PipelineErrorCode errorCode) {
        this.errorCode = errorCode;
    }

    /**
     * Error code reported alongside this outcome, if it is one of the webhook error cases.
     */
    public Optional<PipelineErrorCode> errorCode() {
        return Optional.ofNullable(errorCode);
    }

    /**
     * Whether the provider should treat the notification as delivered.
     */
    public boolean acknowledged() {
        return this == APPLIED || this == NO_CHANGE || this == IGNORED_STATUS || this == ERROR_ACKNOWLEDGED;
    }
}
