package com.gprintex.rental.signature;

import com.gprintex.rental.config.DocuSignProperties;
import com.gprintex.rental.config.RentalContractProperties;
import com.gprintex.rental.domain.Contract;
import com.gprintex.rental.domain.ContractPipelineException;
import com.gprintex.rental.domain.PipelineError;
import com.gprintex.rental.domain.PipelineErrorCode;
import com.gprintex.rental.domain.RenderedDocument;
import com.gprintex.rental.domain.SigningResult;
import com.gprintex.rental.service.ContractService;
import com.gprintex.rental.signature.SignatureProvider.EnvelopeRequest;
import com.gprintex.rental.signature.SignatureProvider.SigningViewRequest;
import io.vavr.control.Either;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Optional;

/**
 * Submits a rendered contract for signature in two phases: create the envelope, then
 * persist envelope id and status as the commit point. The signing URL is fetched last
 * and its failure leaves the committed contract untouched.
 */
@Service
public class SignatureGateway {

    private static final Logger log = LoggerFactory.getLogger(SignatureGateway.class);

    static final String SENT_MESSAGE = "Contract sent to DocuSign for signature";

    private final SignatureProvider provider;
    private final ContractService contractService;
    private final RentalContractProperties.SigningProperties signing;
    private final DocuSignProperties docuSignProperties;

    public SignatureGateway(
        SignatureProvider provider,
        ContractService contractService,
        RentalContractProperties properties,
        DocuSignProperties docuSignProperties
    ) {
        this.provider = provider;
        this.contractService = contractService;
        this.signing = properties.signing();
        this.docuSignProperties = docuSignProperties;
    }

    public record SigningRequest(
        Contract contract,
        RenderedDocument document,
        String signerEmail,
        String signerName,
        String returnUrl
    ) {
    }

    public Either<PipelineError, SigningResult> submit(SigningRequest request) {
        var missing = missingFields(request);
        if (missing.isPresent()) {
            log.warn("Signature submission rejected: {}", missing.get());
            return Either.left(PipelineError.of(PipelineErrorCode.MISSING_FIELDS, missing.get()));
        }

        var contract = request.contract();
        var contractId = contract.id().orElseThrow();

        String envelopeId;
        try {
            envelopeId = provider.createEnvelope(new EnvelopeRequest(
                request.document().content(),
                signing.documentName(),
                signing.emailSubject(),
                request.signerEmail(),
                request.signerName(),
                docuSignProperties.getWebhookUrl()
            ));
        } catch (RuntimeException e) {
            log.error("Envelope submission failed for contract {}: {}", contractId, e.getMessage());
            return Either.left(PipelineError.from(e, PipelineErrorCode.SUBMISSION_FAILED).withContractId(contractId));
        }

        var assigned = contractService.assignEnvelope(contractId, envelopeId, request.document().digest());
        if (assigned.isLeft()) {
            log.error("Envelope {} created but contract {} could not be bound: {}",
                envelopeId, contractId, assigned.getLeft().errorMessage());
            return Either.left(new PipelineError(
                PipelineErrorCode.PERSISTENCE_FAILED,
                "Envelope created but not recorded: " + assigned.getLeft().errorMessage(),
                Optional.of(envelopeId),
                Optional.of(contractId)));
        }
        log.info("Contract {} sent for signing with envelope {}", contractId, envelopeId);

        return signingUrl(envelopeId, request.signerEmail(), request.signerName(), request.returnUrl())
            .mapLeft(error -> error.withContractId(contractId))
            .map(url -> new SigningResult(SENT_MESSAGE, envelopeId, contractId, url));
    }

    /**
     * Fetch a signing URL for an already submitted envelope. Never re-submits.
     */
    public Either<PipelineError, String> signingUrl(String envelopeId, String signerEmail, String signerName, String returnUrl) {
        var effectiveReturnUrl = (returnUrl == null || returnUrl.isBlank()) ? signing.defaultReturnUrl() : returnUrl;
        try {
            return Either.right(provider.createSigningUrl(
                new SigningViewRequest(envelopeId, signerEmail, signerName, effectiveReturnUrl)));
        } catch (RuntimeException e) {
            log.error("Signing URL unavailable for envelope {}: {}", envelopeId, e.getMessage());
            return Either.left(new PipelineError(
                PipelineErrorCode.SIGNING_URL_UNAVAILABLE,
                "Contract created but failed to generate signing URL: " + e.getMessage(),
                Optional.of(envelopeId),
                Optional.empty()));
        }
    }

    private static Optional<String> missingFields(SigningRequest request) {
        var missing = new ArrayList<String>();
        var contract = request.contract();
        if (contract == null || contract.id().isEmpty()) {
            missing.add("contract");
        }
        if (request.document() == null) {
            missing.add("document");
        }
        if (isBlank(request.signerEmail())) {
            missing.add("signer_email");
        }
        if (isBlank(request.signerName())) {
            missing.add("signer_name");
        }
        if (contract == null || isBlank(contract.ownerName())) {
            missing.add("owner_name");
        }
        if (contract == null || isBlank(contract.clientName())) {
            missing.add("client_name");
        }
        return missing.isEmpty()
            ? Optional.empty()
            : Optional.of("Missing required fields: " + String.join(", ", missing));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
