package com.gprintex.rental.domain;

import java.util.Optional;

/**
 * Raised by pipeline adapters; carries the taxonomy code and a human-readable detail.
 */
public class ContractPipelineException extends RuntimeException {

    private final PipelineErrorCode code;
    private final String envelopeId;

    public ContractPipelineException(PipelineErrorCode code, String detail) {
        this(code, detail, null, null);
    }

    public ContractPipelineException(PipelineErrorCode code, String detail, Throwable cause) {
        this(code, detail, null, cause);
    }

    public ContractPipelineException(PipelineErrorCode code, String detail, String envelopeId, Throwable cause) {
        super(detail, cause);
        this.code = code;
        this.envelopeId = envelopeId;
    }

    public PipelineErrorCode getCode() {
        return code;
    }

    public Optional<String> getEnvelopeId() {
        return Optional.ofNullable(envelopeId);
    }
}
