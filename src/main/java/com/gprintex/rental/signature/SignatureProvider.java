package com.gprintex.rental.signature;

/**
 * Port to the e-signature provider. Each call authenticates on its own;
 * failures are raised as {@link com.gprintex.rental.domain.ContractPipelineException}.
 */
public interface SignatureProvider {

    /**
     * Create and send an envelope with one document and one signer.
     *
     * @return the provider envelope id
     */
    String createEnvelope(EnvelopeRequest request);

    /**
     * Create an embedded signing view for the envelope's signer.
     *
     * @return the signing URL
     */
    String createSigningUrl(SigningViewRequest request);

    /**
     * Read the envelope's current status token, e.g. "sent" or "completed".
     */
    String fetchEnvelopeStatus(String envelopeId);

    record EnvelopeRequest(
        byte[] document,
        String documentName,
        String emailSubject,
        String signerEmail,
        String signerName,
        String webhookUrl
    ) {
    }

    record SigningViewRequest(
        String envelopeId,
        String signerEmail,
        String signerName,
        String returnUrl
    ) {
    }
}
