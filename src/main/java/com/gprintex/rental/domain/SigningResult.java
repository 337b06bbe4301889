package com.gprintex.rental.domain;

/**
 * Successful pipeline run: the envelope is out for signature and the signer has a URL.
 */
public record SigningResult(
    String message,
    String envelopeId,
    Long contractId,
    String signingUrl
) {
}
