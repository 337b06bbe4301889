package com.gprintex.rental.domain;

/**
 * Error taxonomy for the generation pipeline and signing-event intake.
 */
public enum PipelineErrorCode {
    /** One external record could not be fetched; degrades to absent data. */
    FETCH_FAILED,
    GENERATION_FAILED,
    RENDER_FAILED,
    AUTH_FAILED,
    SUBMISSION_FAILED,
    /** Envelope exists and is persisted; URL retrieval can be retried on its own. */
    SIGNING_URL_UNAVAILABLE,
    MISSING_FIELDS,
    /** The record store rejected the draft or the envelope binding. */
    PERSISTENCE_FAILED,
    /** Envelope status could not be read from the provider. */
    PROVIDER_UNAVAILABLE,
    /** Notification without envelope id or status. */
    WEBHOOK_MALFORMED,
    WEBHOOK_UNKNOWN_ENVELOPE,
    /** Status outside the modelled set; acknowledged without a transition. */
    WEBHOOK_UNKNOWN_STATUS
}
