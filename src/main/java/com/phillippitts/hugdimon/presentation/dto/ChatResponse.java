package com.phillippitts.hugdimon.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.phillippitts.hugdimon.domain.ProverbReply;
import com.phillippitts.hugdimon.domain.TurnResponse;

/**
 * Body returned by the chat endpoints. {@code proverb} is omitted when the reply carries none.
 */
public record ChatResponse(
        @JsonProperty("conversation_id") String conversationId,
        @JsonProperty("response") String response,
        @JsonProperty("language") String language,
        @JsonProperty("sentiment") double sentiment,
        @JsonProperty("outcome") String outcome,
        @JsonProperty("proverb") @JsonInclude(JsonInclude.Include.NON_NULL) Proverb proverb
) {

    public static ChatResponse from(TurnResponse turn) {
        ProverbReply p = turn.proverb();
        return new ChatResponse(turn.conversationId(), turn.response(), turn.language(),
                turn.sentiment(), turn.outcome().name(),
                p == null ? null : new Proverb(p.text(), p.translation(), p.label()));
    }

    public record Proverb(
            @JsonProperty("text") String text,
            @JsonProperty("translation") String translation,
            @JsonProperty("label") String label
    ) {}
}
