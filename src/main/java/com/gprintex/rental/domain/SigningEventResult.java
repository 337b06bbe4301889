package com.gprintex.rental.domain;

import java.util.Optional;

/**
 * Result of reconciling one signing event against the record store.
 */
public record SigningEventResult(
    ReconcileOutcome outcome,
    Optional<Long> contractId,
    Optional<ContractStatus> status,
    String detail
) {
    public SigningEventResult {
        contractId = contractId != null ? contractId : Optional.empty();
        status = status != null ? status : Optional.empty();
    }

    public static SigningEventResult of(ReconcileOutcome outcome, String detail) {
        return new SigningEventResult(outcome, Optional.empty(), Optional.empty(), detail);
    }

    public static SigningEventResult of(ReconcileOutcome outcome, Contract contract, String detail) {
        return new SigningEventResult(outcome, contract.id(), Optional.of(contract.status()), detail);
    }

    /**
     * The webhook error this result stands for, if any.
     */
    public Optional<PipelineError> toError() {
        return outcome.errorCode().map(code -> new PipelineError(code, detail, Optional.empty(), contractId));
    }
}
