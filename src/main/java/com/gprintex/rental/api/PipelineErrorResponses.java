package com.gprintex.rental.api;

import com.gprintex.rental.domain.PipelineError;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps a consolidated pipeline error to its HTTP response.
 */
final class PipelineErrorResponses {

    private PipelineErrorResponses() {
    }

    static ResponseEntity<Map<String, Object>> toResponse(PipelineError error) {
        return ResponseEntity.status(status(error)).body(body(error));
    }

    static HttpStatus status(PipelineError error) {
        return switch (error.code()) {
            case MISSING_FIELDS, WEBHOOK_MALFORMED -> HttpStatus.BAD_REQUEST;
            case WEBHOOK_UNKNOWN_ENVELOPE -> HttpStatus.NOT_FOUND;
            case RENDER_FAILED, PERSISTENCE_FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
            case FETCH_FAILED, GENERATION_FAILED, AUTH_FAILED, SUBMISSION_FAILED,
                 SIGNING_URL_UNAVAILABLE, PROVIDER_UNAVAILABLE -> HttpStatus.BAD_GATEWAY;
            case WEBHOOK_UNKNOWN_STATUS -> HttpStatus.OK;
        };
    }

    static Map<String, Object> body(PipelineError error) {
        var body = new LinkedHashMap<String, Object>();
        body.put("error", summary(error));
        body.put("code", error.code().name());
        body.put("details", error.detail());
        error.envelopeId().ifPresent(id -> body.put("envelope_id", id));
        error.contractId().ifPresent(id -> body.put("contract_id", id));
        return body;
    }

    private static String summary(PipelineError error) {
        return switch (error.code()) {
            case MISSING_FIELDS -> "Missing required fields";
            case FETCH_FAILED -> "Failed to fetch rental data";
            case GENERATION_FAILED -> "Failed to generate contract";
            case RENDER_FAILED -> "Failed to render contract";
            case PERSISTENCE_FAILED -> "Failed to save contract";
            case AUTH_FAILED -> "Failed to authenticate with signature provider";
            case SUBMISSION_FAILED -> "Failed to send contract";
            case SIGNING_URL_UNAVAILABLE -> "Contract created but failed to generate signing URL";
            case PROVIDER_UNAVAILABLE -> "Failed to read envelope status";
            case WEBHOOK_MALFORMED -> "Malformed notification";
            case WEBHOOK_UNKNOWN_ENVELOPE -> "Contract not found";
            case WEBHOOK_UNKNOWN_STATUS -> "Status ignored";
        };
    }
}
