package com.gprintex.rental.signature;

import com.gprintex.rental.config.DocuSignProperties;
import com.gprintex.rental.config.RentalContractProperties;
import com.gprintex.rental.domain.Contract;
import com.gprintex.rental.domain.ContractPipelineException;
import com.gprintex.rental.domain.PipelineErrorCode;
import com.gprintex.rental.domain.RenderedDocument;
import com.gprintex.rental.domain.ValidationResult;
import com.gprintex.rental.service.ContractService;
import com.gprintex.rental.signature.SignatureGateway.SigningRequest;
import com.gprintex.rental.signature.SignatureProvider.EnvelopeRequest;
import com.gprintex.rental.signature.SignatureProvider.SigningViewRequest;
import io.vavr.control.Either;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SignatureGatewayTests {

    private SignatureProvider provider;
    private ContractService contractService;
    private SignatureGateway gateway;

    private final Contract draft = Contract.draft("owner-1", "client-1", List.of("7"),
        LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 3), new BigDecimal("150.00"), "<p>x</p>").withId(11L);
    private final RenderedDocument document = RenderedDocument.of("%PDF-1.4".getBytes(StandardCharsets.US_ASCII));

    @BeforeEach
    void setUp() {
        provider = mock(SignatureProvider.class);
        contractService = mock(ContractService.class);
        var docuSign = new DocuSignProperties();
        docuSign.setWebhookUrl("https://rental.example/api/v1/contracts/docusign/webhook");
        gateway = new SignatureGateway(provider, contractService,
            new RentalContractProperties(null, null, null, null), docuSign);
    }

    private SigningRequest request(String email, String name, String returnUrl) {
        return new SigningRequest(draft, document, email, name, returnUrl);
    }

    @Test
    void submit_happyPath_persistsBeforeFetchingUrl() {
        when(provider.createEnvelope(any())).thenReturn("env-1");
        when(contractService.assignEnvelope(11L, "env-1", document.digest()))
            .thenReturn(Either.right(draft.withEnvelope("env-1", document.digest())));
        when(provider.createSigningUrl(any())).thenReturn("https://sign.example/1");

        var result = gateway.submit(request("amal@example.com", "Amal", "https://app.example/done"));

        assertTrue(result.isRight());
        assertEquals(SignatureGateway.SENT_MESSAGE, result.get().message());
        assertEquals("env-1", result.get().envelopeId());
        assertEquals(11L, result.get().contractId());
        assertEquals("https://sign.example/1", result.get().signingUrl());

        var order = inOrder(provider, contractService);
        order.verify(provider).createEnvelope(any());
        order.verify(contractService).assignEnvelope(11L, "env-1", document.digest());
        order.verify(provider).createSigningUrl(any());

        var envelope = ArgumentCaptor.forClass(EnvelopeRequest.class);
        verify(provider).createEnvelope(envelope.capture());
        assertEquals("amal@example.com", envelope.getValue().signerEmail());
        assertEquals("https://rental.example/api/v1/contracts/docusign/webhook", envelope.getValue().webhookUrl());
        assertEquals("Please Sign the Rental Contract", envelope.getValue().emailSubject());
    }

    @Test
    void submit_missingSignerEmail_failsBeforeAnyProviderCall() {
        var result = gateway.submit(request(" ", "Amal", null));

        assertTrue(result.isLeft());
        assertEquals(PipelineErrorCode.MISSING_FIELDS, result.getLeft().code());
        assertTrue(result.getLeft().detail().contains("signer_email"));
        verifyNoInteractions(provider, contractService);
    }

    @Test
    void submit_authFailure_leavesDraftUntouched() {
        when(provider.createEnvelope(any()))
            .thenThrow(new ContractPipelineException(PipelineErrorCode.AUTH_FAILED, "consent_required"));

        var result = gateway.submit(request("amal@example.com", "Amal", null));

        assertEquals(PipelineErrorCode.AUTH_FAILED, result.getLeft().code());
        assertTrue(result.getLeft().envelopeId().isEmpty());
        assertEquals(11L, result.getLeft().contractId().orElseThrow());
        verifyNoInteractions(contractService);
    }

    @Test
    void submit_unexpectedProviderError_isSubmissionFailure() {
        when(provider.createEnvelope(any())).thenThrow(new IllegalStateException("socket closed"));

        var result = gateway.submit(request("amal@example.com", "Amal", null));

        assertEquals(PipelineErrorCode.SUBMISSION_FAILED, result.getLeft().code());
        verify(provider, never()).createSigningUrl(any());
    }

    @Test
    void submit_bindingRejected_reportsEnvelopeId() {
        when(provider.createEnvelope(any())).thenReturn("env-1");
        when(contractService.assignEnvelope(anyLong(), anyString(), any()))
            .thenReturn(Either.left(ValidationResult.error("ENVELOPE_NOT_ASSIGNED", "already bound")));

        var result = gateway.submit(request("amal@example.com", "Amal", null));

        assertEquals(PipelineErrorCode.PERSISTENCE_FAILED, result.getLeft().code());
        assertEquals("env-1", result.getLeft().envelopeId().orElseThrow());
        verify(provider, never()).createSigningUrl(any());
    }

    @Test
    void submit_signingUrlFailure_keepsEnvelopeAndContractIds() {
        when(provider.createEnvelope(any())).thenReturn("env-1");
        when(contractService.assignEnvelope(anyLong(), anyString(), any()))
            .thenReturn(Either.right(draft.withEnvelope("env-1", null)));
        when(provider.createSigningUrl(any()))
            .thenThrow(new ContractPipelineException(PipelineErrorCode.SIGNING_URL_UNAVAILABLE, "view failed", "env-1", null));

        var result = gateway.submit(request("amal@example.com", "Amal", null));

        var error = result.getLeft();
        assertEquals(PipelineErrorCode.SIGNING_URL_UNAVAILABLE, error.code());
        assertEquals("env-1", error.envelopeId().orElseThrow());
        assertEquals(11L, error.contractId().orElseThrow());
        assertTrue(error.detail().startsWith("Contract created but failed to generate signing URL"));
    }

    @Test
    void signingUrl_blankReturnUrl_usesDefault() {
        when(provider.createSigningUrl(any())).thenReturn("https://sign.example/2");

        var result = gateway.signingUrl("env-9", "amal@example.com", "Amal", "");

        assertEquals("https://sign.example/2", result.get());
        var view = ArgumentCaptor.forClass(SigningViewRequest.class);
        verify(provider).createSigningUrl(view.capture());
        assertEquals("http://localhost:5173/client/sign-status/", view.getValue().returnUrl());
        assertEquals("env-9", view.getValue().envelopeId());
        verify(provider, never()).createEnvelope(any());
    }

    @Test
    void signingUrl_neverResubmits() {
        when(provider.createSigningUrl(any())).thenThrow(new IllegalStateException("down"));

        var result = gateway.signingUrl("env-9", "amal@example.com", "Amal", "https://app.example/done");

        assertTrue(result.isLeft());
        assertEquals("env-9", result.getLeft().envelopeId().orElseThrow());
        verify(provider, never()).createEnvelope(any());
        verify(contractService, never()).assignEnvelope(anyLong(), eq("env-9"), any());
    }
}
