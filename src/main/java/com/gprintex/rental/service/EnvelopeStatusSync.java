package com.gprintex.rental.service;

import com.gprintex.rental.domain.Contract;
import com.gprintex.rental.domain.PipelineError;
import com.gprintex.rental.domain.PipelineErrorCode;
import com.gprintex.rental.domain.SigningEvent;
import com.gprintex.rental.domain.SigningEventResult;
import com.gprintex.rental.signature.SignatureProvider;
import io.vavr.control.Either;
import io.vavr.control.Try;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Pulls an envelope's status from the provider and feeds it to the reconciler,
 * covering notifications that never arrived.
 */
@Service
public class EnvelopeStatusSync {

    private static final Logger log = LoggerFactory.getLogger(EnvelopeStatusSync.class);

    private final SignatureProvider provider;
    private final SigningEventReconciler reconciler;

    public EnvelopeStatusSync(SignatureProvider provider, SigningEventReconciler reconciler) {
        this.provider = provider;
        this.reconciler = reconciler;
    }

    public Either<PipelineError, SigningEventResult> sync(Contract contract) {
        var contractId = contract.id().orElse(null);
        if (contract.envelopeId().isEmpty()) {
            return Either.left(PipelineError.of(PipelineErrorCode.MISSING_FIELDS,
                "Contract " + contractId + " has not been submitted").withContractId(contractId));
        }
        var envelopeId = contract.envelopeId().get();

        return Try.of(() -> provider.fetchEnvelopeStatus(envelopeId))
            .toEither()
            .mapLeft(e -> PipelineError.from(e, PipelineErrorCode.PROVIDER_UNAVAILABLE).withContractId(contractId))
            .map(status -> {
                log.info("Provider reports envelope {} as {}", envelopeId, status);
                return reconciler.reconcile(SigningEvent.of(envelopeId, status, null));
            });
    }
}
