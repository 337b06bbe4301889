package com.gprintex.rental.domain;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for signing-event transitions.
 */
class ContractLifecycleTests {

    private static final Instant T1 = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant T2 = Instant.parse("2024-05-01T11:00:00Z");

    private static Contract submitted() {
        return Contract.draft("owner-1", "client-1", List.of("7"),
                LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 3), new BigDecimal("150.00"), "<p>x</p>")
            .withId(1L)
            .withEnvelope("env-1", "digest");
    }

    @Test
    void completed_setsStatusAndCompletedAt() {
        var updated = ContractLifecycle.apply(submitted(), SigningEventStatus.COMPLETED, T1).orElseThrow();

        assertEquals(ContractStatus.COMPLETED, updated.status());
        assertEquals(T1, updated.completedAt().orElseThrow());
        assertTrue(updated.sentAt().isEmpty());
        assertEquals("env-1", updated.envelopeId().orElseThrow());
    }

    @Test
    void sentAfterCompleted_isNoOp() {
        var completed = ContractLifecycle.apply(submitted(), SigningEventStatus.COMPLETED, T1).orElseThrow();

        assertTrue(ContractLifecycle.apply(completed, SigningEventStatus.SENT, T2).isEmpty());
    }

    @Test
    void duplicateEvent_isNoOp() {
        var sent = ContractLifecycle.apply(submitted(), SigningEventStatus.SENT, T1).orElseThrow();

        assertTrue(ContractLifecycle.apply(sent, SigningEventStatus.SENT, T2).isEmpty());
    }

    @Test
    void unrecognized_isNoOp() {
        assertTrue(ContractLifecycle.apply(submitted(), SigningEventStatus.UNRECOGNIZED, T1).isEmpty());
    }

    @Test
    void draft_isNotMovedBySigningEvents() {
        var draft = Contract.draft("o", "c", List.of(), LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 1),
            BigDecimal.ONE, "x");

        assertTrue(ContractLifecycle.apply(draft, SigningEventStatus.COMPLETED, T1).isEmpty());
    }

    @Test
    void sentThenDeclined_keepsSentAt() {
        var sent = ContractLifecycle.apply(submitted(), SigningEventStatus.SENT, T1).orElseThrow();
        var declined = ContractLifecycle.apply(sent, SigningEventStatus.DECLINED, T2).orElseThrow();

        assertEquals(ContractStatus.DECLINED, declined.status());
        assertEquals(T1, declined.sentAt().orElseThrow());
        assertEquals(T2, declined.declinedAt().orElseThrow());
    }

    @ParameterizedTest
    @ValueSource(strings = {"COMPLETED", "DECLINED"})
    void everyOrdering_convergesOnTheFirstTerminalEvent(String terminal) {
        var terminalEvent = SigningEventStatus.valueOf(terminal);
        var events = List.of(SigningEventStatus.SENT, terminalEvent, SigningEventStatus.SENT, SigningEventStatus.UNRECOGNIZED);

        for (var ordering : permutations(events)) {
            var contract = submitted();
            for (var event : ordering) {
                contract = ContractLifecycle.apply(contract, event, T1).orElse(contract);
            }
            assertEquals(terminalEvent.target(), contract.status(), "ordering " + ordering);
        }
    }

    @Test
    void replayingOneEvent_matchesApplyingItOnce() {
        var once = ContractLifecycle.apply(submitted(), SigningEventStatus.COMPLETED, T1).orElseThrow();

        var replayed = once;
        for (int i = 0; i < 5; i++) {
            replayed = ContractLifecycle.apply(replayed, SigningEventStatus.COMPLETED, T2).orElse(replayed);
        }

        assertEquals(once.status(), replayed.status());
        assertEquals(once.completedAt(), replayed.completedAt());
    }

    private static <T> List<List<T>> permutations(List<T> items) {
        if (items.isEmpty()) {
            return List.of(List.of());
        }
        var result = new ArrayList<List<T>>();
        for (int i = 0; i < items.size(); i++) {
            var rest = new ArrayList<>(items);
            var head = rest.remove(i);
            for (var tail : permutations(rest)) {
                var permutation = new ArrayList<T>();
                permutation.add(head);
                permutation.addAll(tail);
                result.add(permutation);
            }
        }
        return result;
    }
}
