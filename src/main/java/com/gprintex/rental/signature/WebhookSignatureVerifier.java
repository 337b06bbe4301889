package com.gprintex.rental.signature;

import com.gprintex.rental.config.DocuSignProperties;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;

/**
 * Checks the Connect HMAC header: Base64(HMAC-SHA256(secret, raw body)).
 * Always passes when no secret is configured.
 */
@Component
public class WebhookSignatureVerifier {

    public static final String SIGNATURE_HEADER = "X-DocuSign-Signature-1";
    private static final String ALGORITHM = "HmacSHA256";

    private final DocuSignProperties properties;

    public WebhookSignatureVerifier(DocuSignProperties properties) {
        this.properties = properties;
    }

    public boolean verify(byte[] body, String signature) {
        if (!properties.isHmacVerificationEnabled()) {
            return true;
        }
        if (signature == null || signature.isBlank() || body == null) {
            return false;
        }
        var expected = sign(properties.getConnectHmacSecret(), body);
        return MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.US_ASCII),
            signature.trim().getBytes(StandardCharsets.US_ASCII));
    }

    static String sign(String secret, byte[] body) {
        try {
            var mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return Base64.getEncoder().encodeToString(mac.doFinal(body));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
