package com.gprintex.rental.service;

import com.gprintex.rental.domain.Contract;
import com.gprintex.rental.domain.ReconcileOutcome;
import com.gprintex.rental.domain.SigningEvent;
import com.gprintex.rental.domain.SigningEventResult;
import com.gprintex.rental.domain.SigningEventStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Single entry point for every signing-event source: webhook, replay queue and provider sync.
 * <p>
 * Only a malformed event, an unknown envelope or an unreachable record store is reported as
 * unacknowledged. Once the contract is resolved, every outcome is an acknowledgment.
 */
@Service
public class SigningEventReconciler {

    private static final Logger log = LoggerFactory.getLogger(SigningEventReconciler.class);

    private final ContractService contractService;
    private final Clock clock;

    public SigningEventReconciler(ContractService contractService, Clock clock) {
        this.contractService = contractService;
        this.clock = clock;
    }

    public SigningEventResult reconcile(SigningEvent event) {
        if (event == null || !event.isWellFormed()) {
            var detail = (event == null || event.envelopeId() == null || event.envelopeId().isBlank())
                ? "Missing envelopeId"
                : "Missing status";
            log.warn("Rejecting malformed signing event: {}", detail);
            return SigningEventResult.of(ReconcileOutcome.MALFORMED, detail);
        }

        Optional<Contract> found;
        try {
            found = contractService.findByEnvelopeId(event.envelopeId());
        } catch (RuntimeException e) {
            log.error("Contract lookup failed for envelope {}", event.envelopeId(), e);
            return SigningEventResult.of(ReconcileOutcome.LOOKUP_FAILED, "Contract lookup failed");
        }

        if (found.isEmpty()) {
            log.warn("No contract for envelope {} (status {})", event.envelopeId(), event.statusToken());
            return SigningEventResult.of(ReconcileOutcome.UNKNOWN_ENVELOPE, "Contract not found");
        }

        var contract = found.get();
        if (event.status() == SigningEventStatus.UNRECOGNIZED) {
            log.warn("Ignoring unrecognized status '{}' for envelope {}", event.statusToken(), event.envelopeId());
            return SigningEventResult.of(ReconcileOutcome.IGNORED_STATUS, contract,
                "Status '" + event.statusToken() + "' ignored");
        }

        try {
            var contractId = contract.id()
                .orElseThrow(() -> new IllegalStateException("Stored contract has no id"));
            var result = contractService.applySigningEvent(contractId, event.status(), event.effectiveTime(clock.instant()));
            log.info("Signing event {} for envelope {}: {}", event.statusToken(), event.envelopeId(), result.outcome());
            return result;
        } catch (RuntimeException e) {
            log.error("Failed to apply {} to envelope {}; acknowledging", event.statusToken(), event.envelopeId(), e);
            return SigningEventResult.of(ReconcileOutcome.ERROR_ACKNOWLEDGED, contract, "Event acknowledged but not applied");
        }
    }
}
