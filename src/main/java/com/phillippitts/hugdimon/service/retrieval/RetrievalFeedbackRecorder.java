package com.phillippitts.hugdimon.service.retrieval;

import com.phillippitts.hugdimon.service.metrics.ConversationMetricsPublisher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Records whether a guide answer helped. Verdicts are logged and counted; nothing is stored.
 */
@Component
public class RetrievalFeedbackRecorder {

    private static final Logger LOG = LogManager.getLogger(RetrievalFeedbackRecorder.class);

    private final ConversationMetricsPublisher metrics;

    public RetrievalFeedbackRecorder(ConversationMetricsPublisher metrics) {
        this.metrics = metrics;
    }

    public void record(String queryId, boolean helpful, List<String> resultIds) {
        LOG.info("Retrieval feedback: queryId={}, helpful={}, results={}", queryId, helpful,
                resultIds == null ? List.of() : resultIds);
        metrics.recordRetrievalFeedback(helpful);
    }
}
