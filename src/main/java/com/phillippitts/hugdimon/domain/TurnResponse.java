package com.phillippitts.hugdimon.domain;

import java.util.Objects;

/**
 * Response to one user turn. Always produced, even when the turn degrades.
 *
 * @param conversationId conversation the turn belongs to
 * @param response       text shown to the user
 * @param language       language code of the conversation
 * @param sentiment      sentiment score of the user message in [-1, 1]
 * @param outcome        how the response was produced
 * @param untranslated   true when a needed translation was skipped because the translator failed
 * @param proverb        proverb attached to generated replies, null otherwise
 */
public record TurnResponse(
        String conversationId,
        String response,
        String language,
        double sentiment,
        TurnOutcome outcome,
        boolean untranslated,
        ProverbReply proverb
) {

    public TurnResponse {
        Objects.requireNonNull(conversationId, "conversationId must not be null");
        Objects.requireNonNull(response, "response must not be null");
        Objects.requireNonNull(language, "language must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
    }

    public TurnResponse(String conversationId, String response, String language, double sentiment,
                        TurnOutcome outcome, boolean untranslated) {
        this(conversationId, response, language, sentiment, outcome, untranslated, null);
    }
}
