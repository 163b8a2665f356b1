package com.phillippitts.hugdimon.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record RagFeedbackResponse(
        @JsonProperty("status") String status,
        @JsonProperty("message") String message,
        @JsonProperty("timestamp") Instant timestamp
) {

    public static RagFeedbackResponse recorded(Instant at) {
        return new RagFeedbackResponse("success", "Feedback recorded successfully", at);
    }
}
