package com.gprintex.rental.repository;

import com.gprintex.rental.domain.Contract;
import com.gprintex.rental.domain.ValidationResult;
import io.vavr.control.Either;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Functional repository interface for rental contract records.
 * All methods return functional types (Optional, Either, Stream).
 */
public interface ContractRepository {

    // ========================================================================
    // INSERT OPERATIONS
    // ========================================================================

    /**
     * Insert a draft contract.
     * @return Either with validation errors (Left) or the created contract with ID (Right)
     */
    Either<List<ValidationResult>, Contract> insert(Contract contract);

    // ========================================================================
    // QUERY OPERATIONS
    // ========================================================================

    Optional<Contract> findById(Long id);

    /**
     * Find the contract bound to a provider envelope.
     */
    Optional<Contract> findByEnvelopeId(String envelopeId);

    /**
     * Stream contracts matching filter criteria, ordered by id.
     */
    Stream<Contract> findByFilter(ContractFilter filter);

    // ========================================================================
    // UPDATE OPERATIONS
    // ========================================================================

    /**
     * Bind an envelope and advance to SENT_FOR_SIGNING in one statement.
     * Only succeeds for a DRAFT contract without an envelope, so the id is written once.
     *
     * @return true when the row was updated
     */
    boolean assignEnvelope(Long id, String envelopeId, String artifactDigest);

    /**
     * Write status and event timestamps if the stored version still matches.
     * The envelope id is never touched.
     *
     * @return true when the row was updated, false on a concurrent modification
     */
    boolean updateSigningState(Contract contract, long expectedVersion);

    // ========================================================================
    // FILTER RECORD
    // ========================================================================

    record ContractFilter(
        Optional<String> ownerName,
        Optional<String> clientName
    ) {
        public static ContractFilter all() {
            return new ContractFilter(Optional.empty(), Optional.empty());
        }

        public ContractFilter withOwner(String owner) {
            return new ContractFilter(Optional.ofNullable(owner).filter(s -> !s.isBlank()), clientName);
        }

        public ContractFilter withClient(String client) {
            return new ContractFilter(ownerName, Optional.ofNullable(client).filter(s -> !s.isBlank()));
        }
    }
}
