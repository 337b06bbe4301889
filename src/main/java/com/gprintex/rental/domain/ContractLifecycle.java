package com.gprintex.rental.domain;

import java.time.Instant;
import java.util.Optional;

/**
 * Transition rules for signing events.
 * <p>
 * Terminal states absorb every later event, a repeated status is a no-op, and a SENT
 * notification arriving after COMPLETED or DECLINED never overturns it.
 */
public final class ContractLifecycle {

    private ContractLifecycle() {
    }

    /**
     * Apply a signing event to a contract.
     *
     * @return the updated contract, or empty when the event produces no mutation
     */
    public static Optional<Contract> apply(Contract contract, SigningEventStatus event, Instant at) {
        var target = event.target();
        if (target == null) {
            return Optional.empty();
        }
        var current = contract.status();
        if (current.isTerminal() || current == target || !current.canTransitionTo(target)) {
            return Optional.empty();
        }
        var when = Optional.of(at);
        return Optional.of(switch (target) {
            case SENT -> contract.withSigningState(target, when, contract.completedAt(), contract.declinedAt());
            case COMPLETED -> contract.withSigningState(target, contract.sentAt(), when, contract.declinedAt());
            case DECLINED -> contract.withSigningState(target, contract.sentAt(), contract.completedAt(), when);
            default -> throw new IllegalStateException("Signing events cannot move a contract to " + target.token());
        });
    }
}
