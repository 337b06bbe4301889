package com.gprintex.rental.signature;

import com.gprintex.rental.config.DocuSignProperties;
import com.gprintex.rental.signature.SignatureProvider.EnvelopeRequest;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class DocuSignSignatureProviderTests {

    private final DocuSignSignatureProvider provider = new DocuSignSignatureProvider(new DocuSignProperties());

    private static EnvelopeRequest request(String webhookUrl) {
        return new EnvelopeRequest(
            "%PDF-1.4 body".getBytes(StandardCharsets.US_ASCII),
            "Rental Contract",
            "Please Sign the Rental Contract",
            "amal@example.com",
            "Amal",
            webhookUrl);
    }

    @Test
    void envelope_carriesOneDocumentAndOneSigner() {
        var envelope = provider.buildEnvelopeDefinition(request("https://rental.example/webhook"));

        assertEquals("sent", envelope.getStatus());
        assertEquals("Please Sign the Rental Contract", envelope.getEmailSubject());

        assertEquals(1, envelope.getDocuments().size());
        var document = envelope.getDocuments().get(0);
        assertEquals("1", document.getDocumentId());
        assertEquals("pdf", document.getFileExtension());
        assertEquals("%PDF-1.4 body",
            new String(Base64.getDecoder().decode(document.getDocumentBase64()), StandardCharsets.US_ASCII));

        var signers = envelope.getRecipients().getSigners();
        assertEquals(1, signers.size());
        var signer = signers.get(0);
        assertEquals("amal@example.com", signer.getEmail());
        assertEquals("Amal", signer.getName());
        assertEquals("1", signer.getClientUserId());

        var tabs = signer.getTabs().getSignHereTabs();
        assertEquals(1, tabs.size());
        assertEquals("100", tabs.get(0).getXPosition());
        assertEquals("150", tabs.get(0).getYPosition());
        assertEquals("1", tabs.get(0).getPageNumber());
    }

    @Test
    void envelope_subscribesToSigningEvents() {
        var notification = provider.buildEnvelopeDefinition(request("https://rental.example/webhook")).getEventNotification();

        assertEquals("https://rental.example/webhook", notification.getUrl());
        var codes = notification.getEnvelopeEvents().stream()
            .map(event -> event.getEnvelopeEventStatusCode())
            .toList();
        assertEquals(DocuSignSignatureProvider.SUBSCRIBED_EVENTS, codes);
    }

    @Test
    void envelope_withoutWebhookUrl_hasNoNotification() {
        assertNull(provider.buildEnvelopeDefinition(request(null)).getEventNotification());
    }
}
