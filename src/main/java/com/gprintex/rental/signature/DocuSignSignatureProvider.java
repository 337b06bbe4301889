package com.gprintex.rental.signature;

import com.docusign.esign.api.EnvelopesApi;
import com.docusign.esign.client.ApiClient;
import com.docusign.esign.client.ApiException;
import com.docusign.esign.model.Document;
import com.docusign.esign.model.EnvelopeDefinition;
import com.docusign.esign.model.EnvelopeEvent;
import com.docusign.esign.model.EventNotification;
import com.docusign.esign.model.RecipientViewRequest;
import com.docusign.esign.model.Recipients;
import com.docusign.esign.model.SignHere;
import com.docusign.esign.model.Signer;
import com.docusign.esign.model.Tabs;
import com.gprintex.rental.config.DocuSignProperties;
import com.gprintex.rental.domain.ContractPipelineException;
import com.gprintex.rental.domain.PipelineErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Base64;
import java.util.List;

/**
 * DocuSign eSignature adapter using JWT grant authentication.
 */
@Component
public class DocuSignSignatureProvider implements SignatureProvider {

    private static final Logger log = LoggerFactory.getLogger(DocuSignSignatureProvider.class);

    private static final List<String> SCOPES = List.of("signature", "impersonation");
    static final List<String> SUBSCRIBED_EVENTS = List.of("sent", "completed", "declined");

    static final String DOCUMENT_ID = "1";
    static final String RECIPIENT_ID = "1";
    static final String CLIENT_USER_ID = "1";

    private final DocuSignProperties properties;

    public DocuSignSignatureProvider(DocuSignProperties properties) {
        this.properties = properties;
    }

    @Override
    public String createEnvelope(EnvelopeRequest request) {
        var apiClient = authenticate();
        try {
            var summary = new EnvelopesApi(apiClient)
                .createEnvelope(properties.getAccountId(), buildEnvelopeDefinition(request));
            var envelopeId = summary.getEnvelopeId();
            if (envelopeId == null || envelopeId.isBlank()) {
                throw new ContractPipelineException(PipelineErrorCode.SUBMISSION_FAILED, "Provider returned no envelope id");
            }
            log.info("Envelope {} created (status {})", envelopeId, summary.getStatus());
            return envelopeId;
        } catch (ApiException e) {
            log.error("Envelope creation failed: status={}", e.getCode());
            throw new ContractPipelineException(PipelineErrorCode.SUBMISSION_FAILED,
                "Envelope creation failed (" + e.getCode() + "): " + e.getResponseBody(), e);
        }
    }

    @Override
    public String createSigningUrl(SigningViewRequest request) {
        var apiClient = authenticate();
        var view = new RecipientViewRequest();
        view.setAuthenticationMethod("none");
        view.setClientUserId(CLIENT_USER_ID);
        view.setRecipientId(RECIPIENT_ID);
        view.setReturnUrl(request.returnUrl());
        view.setUserName(request.signerName());
        view.setEmail(request.signerEmail());

        try {
            var url = new EnvelopesApi(apiClient)
                .createRecipientView(properties.getAccountId(), request.envelopeId(), view)
                .getUrl();
            if (url == null || url.isBlank()) {
                throw new ContractPipelineException(PipelineErrorCode.SIGNING_URL_UNAVAILABLE,
                    "Provider returned no signing URL", request.envelopeId(), null);
            }
            return url;
        } catch (ApiException e) {
            log.error("Signing view for envelope {} failed: status={}", request.envelopeId(), e.getCode());
            throw new ContractPipelineException(PipelineErrorCode.SIGNING_URL_UNAVAILABLE,
                "Signing view failed (" + e.getCode() + "): " + e.getResponseBody(), request.envelopeId(), e);
        }
    }

    @Override
    public String fetchEnvelopeStatus(String envelopeId) {
        var apiClient = authenticate();
        try {
            return new EnvelopesApi(apiClient).getEnvelope(properties.getAccountId(), envelopeId).getStatus();
        } catch (ApiException e) {
            log.error("Status lookup for envelope {} failed: status={}", envelopeId, e.getCode());
            throw new ContractPipelineException(PipelineErrorCode.PROVIDER_UNAVAILABLE,
                "Envelope status lookup failed (" + e.getCode() + ")", envelopeId, e);
        }
    }

    /**
     * Exchange the RSA key for a bearer token and return a client carrying it.
     */
    ApiClient authenticate() {
        var apiClient = new ApiClient(properties.getBasePath());
        apiClient.setOAuthBasePath(properties.getOauthHost());
        apiClient.setConnectTimeout(properties.getRequestTimeout());
        apiClient.setReadTimeout(properties.getRequestTimeout());
        try {
            var token = apiClient.requestJWTUserToken(
                properties.getIntegrationKey(),
                properties.getUserId(),
                SCOPES,
                properties.privateKeyBytes(),
                properties.getTokenExpirySeconds()
            );
            apiClient.addDefaultHeader("Authorization", "Bearer " + token.getAccessToken());
            return apiClient;
        } catch (ApiException e) {
            log.error("DocuSign token exchange failed: status={}", e.getCode());
            throw new ContractPipelineException(PipelineErrorCode.AUTH_FAILED,
                "Token exchange failed (" + e.getCode() + "): " + e.getResponseBody(), e);
        } catch (IOException | IllegalArgumentException e) {
            log.error("DocuSign token exchange failed: {}", e.getMessage());
            throw new ContractPipelineException(PipelineErrorCode.AUTH_FAILED, "Token exchange failed: " + e.getMessage(), e);
        }
    }

    /**
     * One PDF, one signer with one signature tab, and a notification subscription.
     */
    EnvelopeDefinition buildEnvelopeDefinition(EnvelopeRequest request) {
        var document = new Document();
        document.setDocumentBase64(Base64.getEncoder().encodeToString(request.document()));
        document.setName(request.documentName());
        document.setFileExtension("pdf");
        document.setDocumentId(DOCUMENT_ID);

        var signHere = new SignHere();
        signHere.setDocumentId(DOCUMENT_ID);
        signHere.setPageNumber("1");
        signHere.setRecipientId(RECIPIENT_ID);
        signHere.setTabLabel("SignHereTab");
        signHere.setXPosition("100");
        signHere.setYPosition("150");

        var tabs = new Tabs();
        tabs.setSignHereTabs(List.of(signHere));

        var signer = new Signer();
        signer.setEmail(request.signerEmail());
        signer.setName(request.signerName());
        signer.setRecipientId(RECIPIENT_ID);
        signer.setRoutingOrder("1");
        signer.setClientUserId(CLIENT_USER_ID);
        signer.setTabs(tabs);

        var recipients = new Recipients();
        recipients.setSigners(List.of(signer));

        var envelope = new EnvelopeDefinition();
        envelope.setEmailSubject(request.emailSubject());
        envelope.setDocuments(List.of(document));
        envelope.setRecipients(recipients);
        if (request.webhookUrl() != null && !request.webhookUrl().isBlank()) {
            envelope.setEventNotification(eventNotification(request.webhookUrl()));
        }
        envelope.setStatus("sent");
        return envelope;
    }

    private static EventNotification eventNotification(String url) {
        var notification = new EventNotification();
        notification.setUrl(url);
        notification.setLoggingEnabled("true");
        notification.setRequireAcknowledgment("true");
        notification.setEnvelopeEvents(SUBSCRIBED_EVENTS.stream().map(code -> {
            var event = new EnvelopeEvent();
            event.setEnvelopeEventStatusCode(code);
            return event;
        }).toList());
        return notification;
    }
}
