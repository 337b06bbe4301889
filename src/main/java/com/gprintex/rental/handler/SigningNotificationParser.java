package com.gprintex.rental.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.gprintex.rental.domain.SigningEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Reads envelope notifications in either of the two Connect JSON shapes:
 * <pre>
 * {"envelopeId": "...", "status": "completed", "statusChangedDateTime": "..."}
 * {"event": "envelope-completed", "generatedDateTime": "...", "data": {"envelopeId": "..."}}
 * </pre>
 * Missing fields stay null; the reconciler decides whether the event is usable.
 */
@Component
public class SigningNotificationParser {

    private static final Logger log = LoggerFactory.getLogger(SigningNotificationParser.class);

    public SigningEvent parse(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return SigningEvent.of(null, null, null);
        }
        if (payload.hasNonNull("event") && payload.path("data").isObject()) {
            var data = payload.path("data");
            var summaryStatus = text(data.path("envelopeSummary"), "status");
            return SigningEvent.of(
                text(data, "envelopeId"),
                summaryStatus != null ? summaryStatus : text(payload, "event"),
                timestamp(text(payload, "generatedDateTime")));
        }
        return SigningEvent.of(
            text(payload, "envelopeId"),
            text(payload, "status"),
            timestamp(text(payload, "statusChangedDateTime")));
    }

    /**
     * ISO-8601 instant or offset date-time; anything else counts as absent.
     */
    static Instant timestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(value).toInstant();
            } catch (DateTimeParseException ignored) {
                log.warn("Unreadable event timestamp '{}', using processing time", value);
                return null;
            }
        }
    }

    private static String text(JsonNode node, String field) {
        var value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        var text = value.asText();
        return text.isBlank() ? null : text;
    }
}
