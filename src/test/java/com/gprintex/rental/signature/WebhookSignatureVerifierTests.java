package com.gprintex.rental.signature;

import com.gprintex.rental.config.DocuSignProperties;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class WebhookSignatureVerifierTests {

    private static final byte[] BODY = "{\"envelopeId\":\"env-1\",\"status\":\"completed\"}".getBytes(StandardCharsets.UTF_8);

    private static WebhookSignatureVerifier verifier(String secret) {
        var properties = new DocuSignProperties();
        properties.setConnectHmacSecret(secret);
        return new WebhookSignatureVerifier(properties);
    }

    @Test
    void noSecret_acceptsAnything() {
        assertTrue(verifier(null).verify(BODY, null));
        assertTrue(verifier(" ").verify(BODY, "garbage"));
    }

    @Test
    void matchingSignature_isAccepted() {
        var signature = WebhookSignatureVerifier.sign("s3cret", BODY);

        assertTrue(verifier("s3cret").verify(BODY, signature));
    }

    @Test
    void tamperedBodyOrWrongSecret_isRejected() {
        var signature = WebhookSignatureVerifier.sign("s3cret", BODY);
        var tampered = "{\"envelopeId\":\"env-2\",\"status\":\"completed\"}".getBytes(StandardCharsets.UTF_8);

        assertFalse(verifier("s3cret").verify(tampered, signature));
        assertFalse(verifier("other").verify(BODY, signature));
        assertFalse(verifier("s3cret").verify(BODY, null));
    }
}
