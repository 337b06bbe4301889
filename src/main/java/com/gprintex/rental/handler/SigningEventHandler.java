package com.gprintex.rental.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gprintex.rental.domain.ReconcileOutcome;
import com.gprintex.rental.domain.SigningEventResult;
import com.gprintex.rental.service.SigningEventReconciler;
import org.apache.camel.Exchange;
import org.apache.camel.Handler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Camel bean that feeds queued notifications into the reconciler.
 */
@Component("signingEventHandler")
public class SigningEventHandler {

    private static final Logger log = LoggerFactory.getLogger(SigningEventHandler.class);

    private final SigningNotificationParser parser;
    private final SigningEventReconciler reconciler;
    private final ObjectMapper objectMapper;

    public SigningEventHandler(
        SigningNotificationParser parser,
        SigningEventReconciler reconciler,
        ObjectMapper objectMapper
    ) {
        this.parser = parser;
        this.reconciler = reconciler;
        this.objectMapper = objectMapper;
    }

    @Handler
    public void reconcile(Exchange exchange) {
        var body = exchange.getIn().getBody();

        JsonNode payload;
        try {
            payload = body instanceof JsonNode node
                ? node
                : objectMapper.readTree(exchange.getIn().getBody(String.class));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Discarding unreadable signing notification: {}", e.getMessage());
            exchange.getIn().setBody(SigningEventResult.of(ReconcileOutcome.MALFORMED, "Unreadable payload"));
            return;
        }

        var result = reconciler.reconcile(parser.parse(payload));
        if (result.outcome() == ReconcileOutcome.LOOKUP_FAILED) {
            throw new SigningEventRetryException("Contract lookup failed, will retry: " + result.detail());
        }
        exchange.getIn().setHeader("reconcileOutcome", result.outcome().name());
        exchange.getIn().setBody(result);
    }
}
