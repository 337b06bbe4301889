package com.gprintex.rental.camel;

import com.gprintex.rental.config.RentalContractProperties;
import com.gprintex.rental.handler.SigningEventRetryException;
import org.apache.camel.LoggingLevel;
import org.apache.camel.builder.RouteBuilder;
import org.springframework.stereotype.Component;

/**
 * Asynchronous signing-event intake.
 * Every queued notification ends up in the same reconciler the webhook uses.
 */
@Component
public class SigningEventRoute extends RouteBuilder {

    private final RentalContractProperties properties;

    public SigningEventRoute(RentalContractProperties properties) {
        this.properties = properties;
    }

    @Override
    public void configure() throws Exception {
        var reconciliation = properties.reconciliation();

        onException(SigningEventRetryException.class)
            .maximumRedeliveries(reconciliation.maxRedeliveries())
            .redeliveryDelay(reconciliation.redeliveryDelay().toMillis())
            .retryAttemptedLogLevel(LoggingLevel.WARN)
            .handled(true)
            .log(LoggingLevel.ERROR, "Giving up on signing notification ${header.messageId}: ${exception.message}");

        // ====================================================================
        // WORKER - queued notifications from replay and other async sources
        // ====================================================================
        from("seda:signing-events?concurrentConsumers=" + reconciliation.consumerThreads())
            .routeId("signing-event-worker")
            .log(LoggingLevel.DEBUG, "Dequeued signing notification ${header.messageId}")
            .to("direct:reconcile-signing-event");

        // ====================================================================
        // RECONCILE
        // ====================================================================
        from("direct:reconcile-signing-event")
            .routeId("reconcile-signing-event")
            .bean("signingEventHandler", "reconcile")
            .log("Signing notification ${header.messageId} reconciled: ${header.reconcileOutcome}");
    }
}
