package com.gprintex.rental.service;

import com.gprintex.rental.domain.AggregatedContext;
import com.gprintex.rental.domain.Contract;
import com.gprintex.rental.domain.ContractTerms;
import com.gprintex.rental.domain.GenerationRequest;
import com.gprintex.rental.domain.PartyProfile;
import com.gprintex.rental.domain.PipelineError;
import com.gprintex.rental.domain.PipelineErrorCode;
import com.gprintex.rental.domain.RenderedDocument;
import com.gprintex.rental.domain.SigningResult;
import com.gprintex.rental.domain.ValidationResult;
import com.gprintex.rental.signature.SignatureGateway;
import com.gprintex.rental.signature.SignatureGateway.SigningRequest;
import io.vavr.control.Either;
import io.vavr.control.Try;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Contract generation pipeline: aggregate, generate, persist draft, render, submit for signature.
 * <p>
 * Each step either hands its result to the next or ends the run with one consolidated error.
 * Nothing is rolled back; a failed run leaves the contract in the last state it reached.
 */
@Service
public class ContractGenerationService {

    private static final Logger log = LoggerFactory.getLogger(ContractGenerationService.class);

    private final DataAggregator aggregator;
    private final ContentGenerator contentGenerator;
    private final DocumentRenderer renderer;
    private final ContractService contractService;
    private final SignatureGateway gateway;

    public ContractGenerationService(
        DataAggregator aggregator,
        ContentGenerator contentGenerator,
        DocumentRenderer renderer,
        ContractService contractService,
        SignatureGateway gateway
    ) {
        this.aggregator = aggregator;
        this.contentGenerator = contentGenerator;
        this.renderer = renderer;
        this.contractService = contractService;
        this.gateway = gateway;
    }

    public Either<PipelineError, SigningResult> generate(GenerationRequest request) {
        var missing = missingRequestFields(request);
        if (!missing.isEmpty()) {
            return Either.left(PipelineError.of(PipelineErrorCode.MISSING_FIELDS,
                "Missing required fields: " + String.join(", ", missing)));
        }

        log.info("Step 1: aggregating records for owner {} and client {}", request.ownerId(), request.clientId());
        var context = aggregator.aggregate(
            request.ownerId(), request.clientId(), request.equipmentIds(), request.requestId());
        var terms = request.terms();

        var signerName = isBlank(request.signerName())
            ? context.client().map(PartyProfile::firstName).orElse("")
            : request.signerName();
        if (isBlank(signerName)) {
            return Either.left(PipelineError.of(PipelineErrorCode.MISSING_FIELDS,
                "Missing required fields: signer_name (no client profile to fall back on)"));
        }

        return prepareDraft(terms, context)
            .flatMap(draft -> {
                log.info("Step 2: generating contract text");
                return Try.of(() -> contentGenerator.generate(terms, context))
                    .toEither()
                    .mapLeft(e -> PipelineError.from(e, PipelineErrorCode.GENERATION_FAILED))
                    .map(text -> Contract.draft(draft.ownerName(), draft.clientName(), draft.equipmentRefs(),
                        draft.startDate(), draft.endDate(), draft.totalValue(), text));
            })
            .flatMap(draft -> {
                log.info("Step 3: persisting draft");
                return contractService.createDraft(draft)
                    .mapLeft(errors -> PipelineError.of(PipelineErrorCode.PERSISTENCE_FAILED, describe(errors)));
            })
            .flatMap(contract -> {
                var contractId = contract.id().orElse(null);
                log.info("Step 4: rendering contract {}", contractId);
                return Try.of(() -> renderer.render(contract.contractText()))
                    .toEither()
                    .mapLeft(e -> PipelineError.from(e, PipelineErrorCode.RENDER_FAILED).withContractId(contractId))
                    .flatMap(document -> submit(contract, document, request, signerName));
            })
            .peek(result -> log.info("Contract {} ready for signing (envelope {})", result.contractId(), result.envelopeId()))
            .peekLeft(error -> log.error("Contract generation failed: {} - {}", error.code(), error.detail()));
    }

    private Either<PipelineError, SigningResult> submit(
        Contract contract, RenderedDocument document, GenerationRequest request, String signerName
    ) {
        log.info("Step 5: sending contract {} for signing", contract.id().orElse(null));
        return gateway.submit(new SigningRequest(
            contract, document, request.signerEmail(), signerName, request.returnUrl()));
    }

    /**
     * Resolve dates and total, with rental-request values winning over caller-supplied ones.
     * The contract text is filled in once generated.
     */
    private Either<PipelineError, Contract> prepareDraft(ContractTerms terms, AggregatedContext context) {
        var start = terms.effectiveStartDate(context);
        var end = terms.effectiveEndDate(context);
        if (start.isEmpty() || end.isEmpty()) {
            return Either.left(PipelineError.of(PipelineErrorCode.MISSING_FIELDS,
                "Missing required fields: " + (start.isEmpty() ? "startDate" : "endDate")));
        }
        return Try.of(() -> Contract.draft(
                terms.ownerName(),
                terms.clientName(),
                terms.equipmentRefs(),
                start.get(),
                end.get(),
                terms.effectiveTotal(context),
                ""))
            .toEither()
            .mapLeft(e -> PipelineError.of(PipelineErrorCode.MISSING_FIELDS, "Invalid contract terms: " + e.getMessage()));
    }

    private static List<String> missingRequestFields(GenerationRequest request) {
        var missing = new ArrayList<String>();
        if (isBlank(request.ownerId())) {
            missing.add("rentalId");
        }
        if (isBlank(request.clientId())) {
            missing.add("clientId");
        }
        if (isBlank(request.signerEmail())) {
            missing.add("signer_email");
        }
        return missing;
    }

    private static String describe(List<ValidationResult> errors) {
        return errors.stream()
            .map(error -> error.errorCode() + ": " + error.errorMessage())
            .collect(Collectors.joining("; "));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
