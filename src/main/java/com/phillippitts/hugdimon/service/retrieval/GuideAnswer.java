package com.phillippitts.hugdimon.service.retrieval;

import java.util.List;
import java.util.Objects;

/**
 * Answer to a guide question.
 *
 * @param queryId   id the client quotes when sending feedback
 * @param response  text shown to the user
 * @param source    whether the text lists catalog places or was generated
 * @param resultIds ids of the listed places, rank order; empty for generated answers
 */
public record GuideAnswer(String queryId, String response, Source source, List<String> resultIds) {

    public enum Source {
        PLACES,
        COMPLETION
    }

    public GuideAnswer {
        Objects.requireNonNull(queryId, "queryId must not be null");
        Objects.requireNonNull(response, "response must not be null");
        Objects.requireNonNull(source, "source must not be null");
        resultIds = resultIds == null ? List.of() : List.copyOf(resultIds);
    }
}
