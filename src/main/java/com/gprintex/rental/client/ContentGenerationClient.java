package com.gprintex.rental.client;

/**
 * Single request/response call to a generative text service.
 */
public interface ContentGenerationClient {

    /**
     * Send the prompt and return the generated text.
     *
     * @throws com.gprintex.rental.domain.ContractPipelineException with GENERATION_FAILED
     *         when the call fails or produces no text
     */
    String generate(String prompt);
}
