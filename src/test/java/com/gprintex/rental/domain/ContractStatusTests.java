package com.gprintex.rental.domain;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the ContractStatus transition graph.
 */
class ContractStatusTests {

    @ParameterizedTest
    @CsvSource({
        "DRAFT, SENT_FOR_SIGNING, true",
        "DRAFT, SENT, false",
        "DRAFT, COMPLETED, false",
        "SENT_FOR_SIGNING, SENT, true",
        "SENT_FOR_SIGNING, COMPLETED, true",
        "SENT_FOR_SIGNING, DECLINED, true",
        "SENT_FOR_SIGNING, DRAFT, false",
        "SENT, COMPLETED, true",
        "SENT, DECLINED, true",
        "SENT, SENT_FOR_SIGNING, false",
        "SENT, DRAFT, false",
        "COMPLETED, SENT, false",
        "COMPLETED, DECLINED, false",
        "DECLINED, COMPLETED, false",
        "DECLINED, SENT, false"
    })
    void canTransitionTo_shouldValidateStateTransitions(String from, String to, boolean expected) {
        var fromStatus = ContractStatus.valueOf(from);
        var toStatus = ContractStatus.valueOf(to);

        assertEquals(expected, fromStatus.canTransitionTo(toStatus));
    }

    @Test
    void nothingReturnsToDraft() {
        for (var status : ContractStatus.values()) {
            assertFalse(status.canTransitionTo(ContractStatus.DRAFT), status + " -> DRAFT");
        }
    }

    @Test
    void terminalStates_cannotTransition() {
        assertTrue(ContractStatus.COMPLETED.isTerminal());
        assertTrue(ContractStatus.DECLINED.isTerminal());
        assertFalse(ContractStatus.SENT.isTerminal());
        for (var target : ContractStatus.values()) {
            assertFalse(ContractStatus.COMPLETED.canTransitionTo(target));
            assertFalse(ContractStatus.DECLINED.canTransitionTo(target));
        }
    }

    @ParameterizedTest
    @CsvSource({
        "draft, DRAFT",
        "sent_for_signing, SENT_FOR_SIGNING",
        "COMPLETED, COMPLETED",
        "' declined ', DECLINED"
    })
    void fromToken_shouldParseStoredTokens(String token, String expected) {
        assertEquals(ContractStatus.valueOf(expected), ContractStatus.fromToken(token).orElseThrow());
    }

    @Test
    void fromToken_unknownIsEmpty() {
        assertTrue(ContractStatus.fromToken("voided").isEmpty());
        assertTrue(ContractStatus.fromToken(null).isEmpty());
    }

    @Test
    void token_isLowercase() {
        assertEquals("sent_for_signing", ContractStatus.SENT_FOR_SIGNING.token());
    }
}
