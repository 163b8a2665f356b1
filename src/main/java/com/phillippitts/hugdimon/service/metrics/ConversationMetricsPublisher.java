package com.phillippitts.hugdimon.service.metrics;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Null-safe front for {@link ConversationMetrics}.
 *
 * <p>Collaborators take a publisher rather than the metrics bean so they run without a
 * {@code MeterRegistry} in unit tests, using {@link #NOOP}.
 */
@Component
public final class ConversationMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(ConversationMetricsPublisher.class);

    /** No-op instance for tests and wiring without metrics. */
    public static final ConversationMetricsPublisher NOOP = new ConversationMetricsPublisher(null);

    private final ConversationMetrics metrics;

    /**
     * @param metrics metrics service (nullable for test mode)
     */
    public ConversationMetricsPublisher(ConversationMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("ConversationMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordTurn(String outcome, String language, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordTurnLatency(outcome, language, durationNanos);
        metrics.incrementTurns(outcome);
    }

    public void recordCompletionRetry() {
        if (metrics == null) {
            return;
        }
        metrics.incrementCompletionRetries();
    }

    public void recordBusy() {
        if (metrics == null) {
            return;
        }
        metrics.incrementBusy();
    }

    public void recordRetrievalFeedback(boolean helpful) {
        if (metrics == null) {
            return;
        }
        metrics.incrementRetrievalFeedback(helpful);
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
