package com.gprintex.rental.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Rental contract record - immutable value object matching the rental_contract table.
 * Functional style with Optional for nullable fields.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Contract(
    Optional<Long> id,
    String ownerName,
    String clientName,
    List<String> equipmentRefs,
    LocalDate startDate,
    LocalDate endDate,
    BigDecimal totalValue,
    String contractText,
    Optional<String> artifactDigest,
    Optional<String> envelopeId,
    ContractStatus status,
    Optional<Instant> sentAt,
    Optional<Instant> completedAt,
    Optional<Instant> declinedAt,
    Optional<Instant> createdAt,
    Optional<Instant> updatedAt,
    long version
) {
    // Compact constructor for validation
    public Contract {
        if (ownerName == null || ownerName.isBlank()) {
            throw new IllegalArgumentException("ownerName is required");
        }
        if (clientName == null || clientName.isBlank()) {
            throw new IllegalArgumentException("clientName is required");
        }
        if (startDate == null || endDate == null) {
            throw new IllegalArgumentException("startDate and endDate are required");
        }
        if (startDate.isAfter(endDate)) {
            throw new IllegalArgumentException("startDate must not be after endDate");
        }
        totalValue = totalValue != null ? totalValue : BigDecimal.ZERO;
        if (totalValue.signum() < 0) {
            throw new IllegalArgumentException("totalValue must not be negative");
        }
        if (status == null) {
            status = ContractStatus.DRAFT;
        }
        equipmentRefs = equipmentRefs != null ? List.copyOf(equipmentRefs) : List.of();
        // Normalize Optional fields to prevent NPE on subsequent operations
        id = id != null ? id : Optional.empty();
        artifactDigest = artifactDigest != null ? artifactDigest : Optional.empty();
        envelopeId = envelopeId != null ? envelopeId : Optional.empty();
        sentAt = sentAt != null ? sentAt : Optional.empty();
        completedAt = completedAt != null ? completedAt : Optional.empty();
        declinedAt = declinedAt != null ? declinedAt : Optional.empty();
        createdAt = createdAt != null ? createdAt : Optional.empty();
        updatedAt = updatedAt != null ? updatedAt : Optional.empty();
    }

    /**
     * Factory method for a freshly generated draft contract.
     */
    public static Contract draft(
        String ownerName,
        String clientName,
        List<String> equipmentRefs,
        LocalDate startDate,
        LocalDate endDate,
        BigDecimal totalValue,
        String contractText
    ) {
        return new Contract(
            Optional.empty(),
            ownerName,
            clientName,
            equipmentRefs,
            startDate,
            endDate,
            totalValue,
            contractText,
            Optional.empty(),
            Optional.empty(),
            ContractStatus.DRAFT,
            Optional.empty(),
            Optional.empty(),
            Optional.empty(),
            Optional.empty(),
            Optional.empty(),
            0L
        );
    }

    /**
     * Create a copy with ID (after insert).
     */
    public Contract withId(Long newId) {
        return new Contract(
            Optional.ofNullable(newId), ownerName, clientName, equipmentRefs, startDate, endDate,
            totalValue, contractText, artifactDigest, envelopeId, status,
            sentAt, completedAt, declinedAt, createdAt, updatedAt, version
        );
    }

    /**
     * Create a copy bound to a provider envelope and advanced to SENT_FOR_SIGNING.
     * The envelope id can only be assigned once.
     */
    public Contract withEnvelope(String newEnvelopeId, String digest) {
        if (newEnvelopeId == null || newEnvelopeId.isBlank()) {
            throw new IllegalArgumentException("envelopeId is required");
        }
        if (envelopeId.isPresent()) {
            throw new IllegalStateException("Contract " + id.orElse(null) + " already has envelope " + envelopeId.get());
        }
        if (!status.canTransitionTo(ContractStatus.SENT_FOR_SIGNING)) {
            throw new IllegalStateException("Cannot submit contract in status " + status.token());
        }
        return new Contract(
            id, ownerName, clientName, equipmentRefs, startDate, endDate,
            totalValue, contractText, Optional.ofNullable(digest), Optional.of(newEnvelopeId),
            ContractStatus.SENT_FOR_SIGNING,
            sentAt, completedAt, declinedAt, createdAt, Optional.of(Instant.now()), version
        );
    }

    /**
     * Create a copy with the signing status and its event timestamps replaced.
     * Envelope id and document fields are preserved.
     */
    public Contract withSigningState(
        ContractStatus newStatus,
        Optional<Instant> newSentAt,
        Optional<Instant> newCompletedAt,
        Optional<Instant> newDeclinedAt
    ) {
        return new Contract(
            id, ownerName, clientName, equipmentRefs, startDate, endDate,
            totalValue, contractText, artifactDigest, envelopeId, newStatus,
            newSentAt, newCompletedAt, newDeclinedAt, createdAt, Optional.of(Instant.now()), version
        );
    }

    /**
     * Check if the contract is still waiting on the signer.
     */
    @JsonIgnore
    public boolean isAwaitingSignature() {
        return envelopeId.isPresent() && !status.isTerminal();
    }
}
