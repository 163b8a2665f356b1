package com.phillippitts.hugdimon.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phillippitts.hugdimon.service.retrieval.GuideAnswer;

import java.util.List;
import java.util.Locale;

/**
 * Body returned by {@code POST /guide}. {@code query_id} and {@code result_ids} are echoed back
 * in {@code POST /feedback/rag}.
 */
public record GuideResponse(
        @JsonProperty("query_id") String queryId,
        @JsonProperty("response") String response,
        @JsonProperty("source") String source,
        @JsonProperty("result_ids") List<String> resultIds
) {

    public static GuideResponse from(GuideAnswer answer) {
        return new GuideResponse(answer.queryId(), answer.response(), answer.source().name().toLowerCase(Locale.ROOT),
                answer.resultIds());
    }
}
