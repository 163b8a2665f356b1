package com.phillippitts.hugdimon.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /chat}. Only {@code message} is required; blank messages are rejected by
 * the service layer.
 */
public record ChatRequest(
        @JsonProperty("conversation_id") String conversationId,
        @JsonProperty("message") String message,
        @JsonProperty("detected_language") String detectedLanguage
) {}
