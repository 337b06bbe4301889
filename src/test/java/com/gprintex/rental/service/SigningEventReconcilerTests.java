package com.gprintex.rental.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gprintex.rental.config.RentalContractProperties;
import com.gprintex.rental.domain.Contract;
import com.gprintex.rental.domain.ContractStatus;
import com.gprintex.rental.domain.ReconcileOutcome;
import com.gprintex.rental.domain.SigningEvent;
import com.gprintex.rental.repository.JdbcContractRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Reconciler tests against the real repository on H2.
 */
class SigningEventReconcilerTests {

    private static final Instant NOW = Instant.parse("2024-05-02T08:00:00Z");

    private EmbeddedDatabase database;
    private JdbcContractRepository repository;
    private ContractService contractService;
    private SigningEventReconciler reconciler;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
            .setType(EmbeddedDatabaseType.H2)
            .setName("reconciler-" + UUID.randomUUID())
            .addScript("classpath:schema.sql")
            .build();
        var clock = Clock.fixed(NOW, ZoneOffset.UTC);
        repository = new JdbcContractRepository(new NamedParameterJdbcTemplate(database), new ObjectMapper(), clock);
        contractService = new ContractService(repository, new RentalContractProperties(null, null, null, null));
        reconciler = new SigningEventReconciler(contractService, clock);
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    private Long submittedContract(String envelopeId) {
        var draft = Contract.draft("owner", "client", List.of("7"),
            LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 3), new BigDecimal("150.00"), "<p>contract</p>");
        var id = repository.insert(draft).get().id().orElseThrow();
        assertTrue(repository.assignEnvelope(id, envelopeId, "digest"));
        return id;
    }

    private ContractStatus statusOf(Long id) {
        return repository.findById(id).orElseThrow().status();
    }

    @Test
    void completed_isApplied() {
        var id = submittedContract("env-1");
        var at = Instant.parse("2024-05-01T18:00:00Z");

        var result = reconciler.reconcile(SigningEvent.of("env-1", "Completed", at));

        assertEquals(ReconcileOutcome.APPLIED, result.outcome());
        var stored = repository.findById(id).orElseThrow();
        assertEquals(ContractStatus.COMPLETED, stored.status());
        assertEquals(at, stored.completedAt().orElseThrow());
    }

    @Test
    void missingTimestamp_usesProcessingTime() {
        var id = submittedContract("env-1");

        reconciler.reconcile(SigningEvent.of("env-1", "sent", null));

        assertEquals(NOW, repository.findById(id).orElseThrow().sentAt().orElseThrow());
    }

    @Test
    void sentAfterCompleted_leavesCompleted() {
        var id = submittedContract("env-1");

        reconciler.reconcile(SigningEvent.of("env-1", "completed", null));
        var late = reconciler.reconcile(SigningEvent.of("env-1", "sent", null));

        assertEquals(ReconcileOutcome.NO_CHANGE, late.outcome());
        assertTrue(late.outcome().acknowledged());
        assertEquals(ContractStatus.COMPLETED, statusOf(id));
        assertTrue(repository.findById(id).orElseThrow().sentAt().isEmpty());
    }

    @Test
    void replayedEvent_isIdempotent() {
        var id = submittedContract("env-1");

        reconciler.reconcile(SigningEvent.of("env-1", "declined", null));
        var version = repository.findById(id).orElseThrow().version();
        for (int i = 0; i < 3; i++) {
            assertEquals(ReconcileOutcome.NO_CHANGE, reconciler.reconcile(SigningEvent.of("env-1", "declined", null)).outcome());
        }

        assertEquals(version, repository.findById(id).orElseThrow().version());
    }

    @Test
    void missingEnvelopeId_isMalformed() {
        var id = submittedContract("env-1");

        var result = reconciler.reconcile(SigningEvent.of(null, "completed", null));

        assertEquals(ReconcileOutcome.MALFORMED, result.outcome());
        assertEquals("Missing envelopeId", result.detail());
        assertEquals(ContractStatus.SENT_FOR_SIGNING, statusOf(id));
    }

    @Test
    void missingStatus_isMalformed() {
        assertEquals("Missing status", reconciler.reconcile(SigningEvent.of("env-1", null, null)).detail());
    }

    @Test
    void unknownEnvelope_mutatesNothing() {
        var id = submittedContract("env-1");
        var version = repository.findById(id).orElseThrow().version();

        var result = reconciler.reconcile(SigningEvent.of("env-404", "completed", null));

        assertEquals(ReconcileOutcome.UNKNOWN_ENVELOPE, result.outcome());
        assertEquals(version, repository.findById(id).orElseThrow().version());
    }

    @Test
    void unrecognizedStatus_isAcknowledgedAndIgnored() {
        var id = submittedContract("env-1");

        var result = reconciler.reconcile(SigningEvent.of("env-1", "delivered", null));

        assertEquals(ReconcileOutcome.IGNORED_STATUS, result.outcome());
        assertEquals(id, result.contractId().orElseThrow());
        assertEquals(ContractStatus.SENT_FOR_SIGNING, statusOf(id));
    }

    @Test
    void concurrentEvents_convergeOnTerminalStatus() throws Exception {
        var id = submittedContract("env-1");
        var pool = Executors.newFixedThreadPool(4);
        try {
            var tasks = List.<Callable<Object>>of(
                () -> reconciler.reconcile(SigningEvent.of("env-1", "sent", null)),
                () -> reconciler.reconcile(SigningEvent.of("env-1", "completed", null)),
                () -> reconciler.reconcile(SigningEvent.of("env-1", "sent", null)),
                () -> reconciler.reconcile(SigningEvent.of("env-1", "completed", null)));
            for (var future : pool.invokeAll(tasks)) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(ContractStatus.COMPLETED, statusOf(id));
    }

    @Test
    void lookupFailure_isReportedAsUnresolved() {
        var failing = mock(ContractService.class);
        when(failing.findByEnvelopeId(any())).thenThrow(new IllegalStateException("pool exhausted"));

        var result = new SigningEventReconciler(failing, Clock.systemUTC())
            .reconcile(SigningEvent.of("env-1", "completed", null));

        assertEquals(ReconcileOutcome.LOOKUP_FAILED, result.outcome());
        assertFalse(result.outcome().acknowledged());
    }

    @Test
    void writeFailureAfterResolution_isAcknowledged() {
        var service = mock(ContractService.class);
        var contract = Contract.draft("o", "c", List.of(), LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 1),
            BigDecimal.ONE, "x").withId(3L).withEnvelope("env-1", null);
        when(service.findByEnvelopeId("env-1")).thenReturn(Optional.of(contract));
        when(service.applySigningEvent(any(), any(), any())).thenThrow(new IllegalStateException("gave up"));

        var result = new SigningEventReconciler(service, Clock.systemUTC())
            .reconcile(SigningEvent.of("env-1", "completed", null));

        assertEquals(ReconcileOutcome.ERROR_ACKNOWLEDGED, result.outcome());
        assertTrue(result.outcome().acknowledged());
    }
}
