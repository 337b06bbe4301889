package com.gprintex.rental.api;

import com.gprintex.rental.domain.GenerationRequest;
import com.gprintex.rental.domain.SigningEventResult;
import com.gprintex.rental.domain.SigningResult;
import com.gprintex.rental.repository.ContractRepository.ContractFilter;
import com.gprintex.rental.service.ContractGenerationService;
import com.gprintex.rental.service.ContractService;
import com.gprintex.rental.service.EnvelopeStatusSync;
import com.gprintex.rental.signature.SignatureGateway;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST API for rental contracts.
 * Contracts are created only through the generation pipeline and never deleted here.
 */
@RestController
@RequestMapping("/api/v1/contracts")
public class ContractController {

    private final ContractService contractService;
    private final ContractGenerationService generationService;
    private final SignatureGateway signatureGateway;
    private final EnvelopeStatusSync envelopeStatusSync;

    public ContractController(
        ContractService contractService,
        ContractGenerationService generationService,
        SignatureGateway signatureGateway,
        EnvelopeStatusSync envelopeStatusSync
    ) {
        this.contractService = contractService;
        this.generationService = generationService;
        this.signatureGateway = signatureGateway;
        this.envelopeStatusSync = envelopeStatusSync;
    }

    @GetMapping
    public ResponseEntity<?> list(
        @RequestParam(name = "owner_name", required = false) String ownerName,
        @RequestParam(name = "client_name", required = false) String clientName
    ) {
        var filter = ContractFilter.all().withOwner(ownerName).withClient(clientName);
        return ResponseEntity.ok(contractService.findByFilter(filter));
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getById(@PathVariable Long id) {
        return contractService.findById(id)
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/generate")
    public ResponseEntity<?> generate(@RequestBody GenerationRequest request) {
        return generationService.generate(request).fold(
            PipelineErrorResponses::toResponse,
            result -> ResponseEntity.ok(signingBody(result))
        );
    }

    /**
     * Fetch a fresh signing URL for a contract that is already out for signature.
     */
    @PostMapping("/{id}/signing-url")
    public ResponseEntity<?> signingUrl(@PathVariable Long id, @RequestBody SigningUrlRequest request) {
        if (isBlank(request.signerEmail()) || isBlank(request.signerName())) {
            return ResponseEntity.badRequest().body(Map.of("error", "'signer_email' and 'signer_name' are required"));
        }

        var found = contractService.findById(id);
        if (found.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        var contract = found.get();
        if (!contract.isAwaitingSignature()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                "error", "Contract is not awaiting signature",
                "status", contract.status().token()));
        }

        var envelopeId = contract.envelopeId().get();
        return signatureGateway.signingUrl(envelopeId, request.signerEmail(), request.signerName(), request.returnUrl())
            .fold(
                error -> PipelineErrorResponses.toResponse(error.withContractId(id)),
                url -> ResponseEntity.ok(signingBody(new SigningResult("Signing URL created", envelopeId, id, url)))
            );
    }

    /**
     * Pull the envelope status from the provider and reconcile it.
     */
    @PostMapping("/{id}/sync")
    public ResponseEntity<?> sync(@PathVariable Long id) {
        var found = contractService.findById(id);
        if (found.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        if (found.get().envelopeId().isEmpty()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "Contract has not been submitted"));
        }
        return envelopeStatusSync.sync(found.get()).fold(
            PipelineErrorResponses::toResponse,
            result -> ResponseEntity.ok(resultBody(result))
        );
    }

    private static Map<String, Object> signingBody(SigningResult result) {
        var body = new LinkedHashMap<String, Object>();
        body.put("message", result.message());
        body.put("envelope_id", result.envelopeId());
        body.put("contract_id", result.contractId());
        body.put("signing_url", result.signingUrl());
        return body;
    }

    static Map<String, Object> resultBody(SigningEventResult result) {
        var body = new LinkedHashMap<String, Object>();
        body.put("outcome", result.outcome().name());
        body.put("details", result.detail());
        result.outcome().errorCode().ifPresent(code -> body.put("code", code.name()));
        result.contractId().ifPresent(contractId -> body.put("contract_id", contractId));
        result.status().ifPresent(status -> body.put("status", status.token()));
        return body;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
