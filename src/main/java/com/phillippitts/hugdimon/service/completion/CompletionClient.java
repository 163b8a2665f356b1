package com.phillippitts.hugdimon.service.completion;

import com.phillippitts.hugdimon.exception.ExternalServiceException;

/**
 * Text generation collaborator.
 */
public interface CompletionClient {

    /**
     * Generates a response for an assembled prompt.
     *
     * @throws ExternalServiceException with kind TIMEOUT, RATE_LIMITED, AUTH_ERROR or UNAVAILABLE
     */
    String complete(String prompt, CompletionParams params);
}
