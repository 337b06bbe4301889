package com.gprintex.rental.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of a signing-URL retry.
 */
public record SigningUrlRequest(
    @JsonProperty("signer_email") String signerEmail,
    @JsonProperty("signer_name") String signerName,
    @JsonProperty("return_url") String returnUrl
) {
}
