package com.gprintex.rental.domain;

import java.util.Optional;

/**
 * Consolidated pipeline failure returned to the caller.
 * Envelope and contract ids are set when the failure happened after submission.
 */
public record PipelineError(
    PipelineErrorCode code,
    String detail,
    Optional<String> envelopeId,
    Optional<Long> contractId
) {
    public PipelineError {
        envelopeId = envelopeId != null ? envelopeId : Optional.empty();
        contractId = contractId != null ? contractId : Optional.empty();
    }

    public static PipelineError of(PipelineErrorCode code, String detail) {
        return new PipelineError(code, detail, Optional.empty(), Optional.empty());
    }

    /**
     * Map a thrown failure; anything that is not a pipeline exception gets the fallback code.
     */
    public static PipelineError from(Throwable error, PipelineErrorCode fallback) {
        if (error instanceof ContractPipelineException e) {
            return new PipelineError(e.getCode(), e.getMessage(), e.getEnvelopeId(), Optional.empty());
        }
        return of(fallback, String.valueOf(error.getMessage()));
    }

    public PipelineError withContractId(Long id) {
        return new PipelineError(code, detail, envelopeId, Optional.ofNullable(id));
    }
}
