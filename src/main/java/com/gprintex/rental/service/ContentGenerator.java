package com.gprintex.rental.service;

import com.gprintex.rental.client.ContentGenerationClient;
import com.gprintex.rental.domain.AggregatedContext;
import com.gprintex.rental.domain.ContractPipelineException;
import com.gprintex.rental.domain.ContractTerms;
import com.gprintex.rental.domain.PipelineErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns aggregated records and contract terms into contract markup.
 * One generation call per invocation, no retry.
 */
@Service
public class ContentGenerator {

    private static final Logger log = LoggerFactory.getLogger(ContentGenerator.class);

    private final ContractPromptBuilder promptBuilder;
    private final ContentGenerationClient client;

    public ContentGenerator(ContractPromptBuilder promptBuilder, ContentGenerationClient client) {
        this.promptBuilder = promptBuilder;
        this.client = client;
    }

    /**
     * @throws ContractPipelineException with GENERATION_FAILED on provider failure or empty output
     */
    public String generate(ContractTerms terms, AggregatedContext context) {
        var prompt = promptBuilder.build(terms, context);
        log.info("Generating contract text for owner {} and client {}", terms.ownerName(), terms.clientName());

        String text;
        try {
            text = client.generate(prompt);
        } catch (ContractPipelineException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ContractPipelineException(PipelineErrorCode.GENERATION_FAILED, "Generation failed: " + e.getMessage(), e);
        }

        if (text == null || text.isBlank()) {
            throw new ContractPipelineException(PipelineErrorCode.GENERATION_FAILED, "Generation returned empty text");
        }
        log.info("Generated contract text ({} chars)", text.length());
        return text;
    }
}
