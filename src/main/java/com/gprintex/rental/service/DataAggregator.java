package com.gprintex.rental.service;

import com.gprintex.rental.client.RentalDataClient;
import com.gprintex.rental.domain.AggregatedContext;
import com.gprintex.rental.domain.PipelineError;
import com.gprintex.rental.domain.PipelineErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fetches owner, client, equipment and rental-request records concurrently.
 * A failed sub-fetch leaves its slot empty and is recorded as FETCH_FAILED; the aggregation itself never fails.
 */
@Service
public class DataAggregator {

    private static final Logger log = LoggerFactory.getLogger(DataAggregator.class);

    private final RentalDataClient client;

    public DataAggregator(RentalDataClient client) {
        this.client = client;
    }

    public AggregatedContext aggregate(String ownerId, String clientId, List<String> equipmentIds, String requestId) {
        var ids = equipmentIds != null ? equipmentIds : List.<String>of();
        log.info("Aggregating records: owner={}, client={}, equipment={}, request={}", ownerId, clientId, ids, requestId);

        var failures = new CopyOnWriteArrayList<PipelineError>();
        var equipment = Flux.fromIterable(ids)
            .flatMapSequential(id -> degrade(client.fetchEquipment(id), failures))
            .collectList();

        var context = Mono.zip(
                degrade(client.fetchProfile(ownerId), failures),
                degrade(client.fetchProfile(clientId), failures),
                equipment,
                degrade(client.fetchRentalRequest(requestId), failures))
            .map(t -> new AggregatedContext(t.getT1(), t.getT2(), t.getT3(), t.getT4(), failures))
            .block();

        if (context == null) {
            return AggregatedContext.empty();
        }
        log.info("Aggregated records: owner={}, client={}, equipment={}/{}, request={}, failed fetches={}",
            context.owner().isPresent(), context.client().isPresent(),
            context.equipment().stream().filter(Optional::isPresent).count(), ids.size(),
            context.request().isPresent(), context.fetchFailures().size());
        return context;
    }

    private static <T> Mono<Optional<T>> degrade(Mono<Optional<T>> fetch, List<PipelineError> failures) {
        return fetch.onErrorResume(e -> {
            var error = PipelineError.from(e, PipelineErrorCode.FETCH_FAILED);
            failures.add(error);
            log.warn("{}: {} (continuing without it)", error.code(), error.detail());
            return Mono.just(Optional.empty());
        });
    }
}
