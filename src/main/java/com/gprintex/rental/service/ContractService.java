package com.gprintex.rental.service;

import com.gprintex.rental.config.RentalContractProperties;
import com.gprintex.rental.domain.Contract;
import com.gprintex.rental.domain.ContractLifecycle;
import com.gprintex.rental.domain.ReconcileOutcome;
import com.gprintex.rental.domain.SigningEventResult;
import com.gprintex.rental.domain.SigningEventStatus;
import com.gprintex.rental.domain.ValidationResult;
import com.gprintex.rental.repository.ContractRepository;
import com.gprintex.rental.repository.ContractRepository.ContractFilter;
import io.vavr.control.Either;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable contract record operations.
 * Status writes go through an optimistic version check so that concurrent writers
 * for the same contract are serialized.
 */
@Service
public class ContractService {

    private static final Logger log = LoggerFactory.getLogger(ContractService.class);

    private final ContractRepository repository;
    private final RentalContractProperties properties;

    public ContractService(ContractRepository repository, RentalContractProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    // ========================================================================
    // CREATE
    // ========================================================================

    /**
     * Persist a freshly generated draft.
     */
    @Transactional
    public Either<List<ValidationResult>, Contract> createDraft(Contract contract) {
        return repository.insert(contract);
    }

    // ========================================================================
    // READ
    // ========================================================================

    @Transactional(readOnly = true)
    public Optional<Contract> findById(Long id) {
        return repository.findById(id);
    }

    @Transactional(readOnly = true)
    public Optional<Contract> findByEnvelopeId(String envelopeId) {
        return repository.findByEnvelopeId(envelopeId);
    }

    /**
     * Find contracts by filter - Stream materialized within the transaction.
     */
    @Transactional(readOnly = true)
    public List<Contract> findByFilter(ContractFilter filter) {
        try (var contracts = repository.findByFilter(filter)) {
            return contracts.toList();
        }
    }

    // ========================================================================
    // SUBMISSION
    // ========================================================================

    /**
     * Bind the envelope id and advance to SENT_FOR_SIGNING as one write.
     */
    @Transactional
    public Either<ValidationResult, Contract> assignEnvelope(Long contractId, String envelopeId, String artifactDigest) {
        if (envelopeId == null || envelopeId.isBlank()) {
            return Either.left(ValidationResult.required("envelope_id"));
        }
        if (!repository.assignEnvelope(contractId, envelopeId, artifactDigest)) {
            return Either.left(ValidationResult.error(
                "ENVELOPE_NOT_ASSIGNED",
                "Contract " + contractId + " is not a draft without an envelope"));
        }
        return repository.findById(contractId)
            .<Either<ValidationResult, Contract>>map(Either::right)
            .orElseGet(() -> Either.left(ValidationResult.error("NOT_FOUND", "Contract " + contractId + " not found")));
    }

    // ========================================================================
    // SIGNING EVENTS
    // ========================================================================

    /**
     * Apply a signing event with read, decide, compare-and-set, retrying on a version conflict.
     *
     * @throws IllegalStateException when every attempt lost the race or the contract vanished
     */
    public SigningEventResult applySigningEvent(Long contractId, SigningEventStatus event, Instant at) {
        var maxAttempts = properties.reconciliation().maxUpdateAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            var current = repository.findById(contractId)
                .orElseThrow(() -> new IllegalStateException("Contract " + contractId + " disappeared"));

            var next = ContractLifecycle.apply(current, event, at);
            if (next.isEmpty()) {
                return SigningEventResult.of(ReconcileOutcome.NO_CHANGE, current,
                    "Contract already " + current.status().token());
            }

            if (repository.updateSigningState(next.get(), current.version())) {
                log.info("Contract {} moved {} -> {}", contractId, current.status().token(), next.get().status().token());
                return SigningEventResult.of(ReconcileOutcome.APPLIED, next.get(),
                    "Contract moved to " + next.get().status().token());
            }
            log.debug("Version conflict on contract {} (attempt {}/{})", contractId, attempt, maxAttempts);
        }
        throw new IllegalStateException(
            "Contract " + contractId + " kept changing; gave up after " + maxAttempts + " attempts");
    }
}
