package com.gprintex.rental.domain;

import java.util.List;
import java.util.Optional;

/**
 * Transient union of the externally fetched records for one generation request.
 * Each record is independently absent; equipment keeps the order of the requested ids.
 * Fetches that failed, as opposed to records that do not exist, are listed in {@code fetchFailures}.
 */
public record AggregatedContext(
    Optional<PartyProfile> owner,
    Optional<PartyProfile> client,
    List<Optional<EquipmentRecord>> equipment,
    Optional<RentalRequestRecord> request,
    List<PipelineError> fetchFailures
) {
    public AggregatedContext {
        owner = owner != null ? owner : Optional.empty();
        client = client != null ? client : Optional.empty();
        equipment = equipment != null ? List.copyOf(equipment) : List.of();
        request = request != null ? request : Optional.empty();
        fetchFailures = fetchFailures != null ? List.copyOf(fetchFailures) : List.of();
    }

    public AggregatedContext(
        Optional<PartyProfile> owner,
        Optional<PartyProfile> client,
        List<Optional<EquipmentRecord>> equipment,
        Optional<RentalRequestRecord> request
    ) {
        this(owner, client, equipment, request, List.of());
    }

    public static AggregatedContext empty() {
        return new AggregatedContext(Optional.empty(), Optional.empty(), List.of(), Optional.empty());
    }
}
