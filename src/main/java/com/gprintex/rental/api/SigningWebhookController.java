package com.gprintex.rental.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gprintex.rental.domain.ReconcileOutcome;
import com.gprintex.rental.domain.SigningEventResult;
import com.gprintex.rental.handler.SigningEventPublisher;
import com.gprintex.rental.handler.SigningNotificationParser;
import com.gprintex.rental.service.SigningEventReconciler;
import com.gprintex.rental.signature.WebhookSignatureVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.Map;

/**
 * DocuSign Connect notification endpoint and replay intake.
 */
@RestController
@RequestMapping("/api/v1/contracts/docusign")
public class SigningWebhookController {

    private static final Logger log = LoggerFactory.getLogger(SigningWebhookController.class);

    private final WebhookSignatureVerifier verifier;
    private final SigningNotificationParser parser;
    private final SigningEventReconciler reconciler;
    private final SigningEventPublisher publisher;
    private final ObjectMapper objectMapper;

    public SigningWebhookController(
        WebhookSignatureVerifier verifier,
        SigningNotificationParser parser,
        SigningEventReconciler reconciler,
        SigningEventPublisher publisher,
        ObjectMapper objectMapper
    ) {
        this.verifier = verifier;
        this.parser = parser;
        this.reconciler = reconciler;
        this.publisher = publisher;
        this.objectMapper = objectMapper;
    }

    @PostMapping("/webhook")
    public ResponseEntity<?> webhook(
        @RequestBody byte[] body,
        @RequestHeader(name = WebhookSignatureVerifier.SIGNATURE_HEADER, required = false) String signature
    ) {
        log.info("Received DocuSign webhook notification");
        if (!verifier.verify(body, signature)) {
            log.warn("Rejected webhook with invalid signature");
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("error", "Unauthorized"));
        }

        JsonNode payload;
        try {
            payload = objectMapper.readTree(body);
        } catch (IOException e) {
            log.warn("Unreadable webhook body: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid JSON body"));
        }

        var result = reconciler.reconcile(parser.parse(payload));
        return toResponse(result);
    }

    /**
     * Queue a batch of notifications, e.g. an export of failed Connect deliveries.
     */
    @PostMapping("/events/replay")
    public ResponseEntity<?> replay(@RequestBody JsonNode notifications) {
        if (notifications == null || !notifications.isArray()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Expected a JSON array of notifications"));
        }
        var queued = publisher.publishAll(notifications);
        log.info("Queued {} signing notifications for replay", queued);
        return ResponseEntity.accepted().body(Map.of("queued", queued));
    }

    /**
     * Unacknowledged webhook errors become error bodies. Acknowledged outcomes answer with the
     * result body, carrying the webhook error code when there is one.
     */
    static ResponseEntity<?> toResponse(SigningEventResult result) {
        if (result.outcome() == ReconcileOutcome.LOOKUP_FAILED) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", result.detail()));
        }
        var error = result.toError();
        if (error.isPresent() && !result.outcome().acknowledged()) {
            return PipelineErrorResponses.toResponse(error.get());
        }
        var body = ContractController.resultBody(result);
        body.put("message", "Webhook processed successfully");
        return ResponseEntity.status(error.map(PipelineErrorResponses::status).orElse(HttpStatus.OK)).body(body);
    }
}
