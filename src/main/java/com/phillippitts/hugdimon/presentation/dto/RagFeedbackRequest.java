package com.phillippitts.hugdimon.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body of {@code POST /feedback/rag}. {@code query_id} and {@code is_helpful} are required.
 */
public record RagFeedbackRequest(
        @JsonProperty("query_id") String queryId,
        @JsonProperty("is_helpful") Boolean helpful,
        @JsonProperty("result_ids") List<String> resultIds
) {}
