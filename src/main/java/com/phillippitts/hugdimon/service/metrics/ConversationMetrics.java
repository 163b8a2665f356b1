package com.phillippitts.hugdimon.service.metrics;

import com.phillippitts.hugdimon.service.session.SessionStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for conversation turns.
 *
 * <p>Provides:
 * <ul>
 *   <li>turn latency per outcome and language</li>
 *   <li>turn counts per outcome</li>
 *   <li>completion retries</li>
 *   <li>turns rejected because the conversation was busy</li>
 *   <li>retrieval feedback per verdict</li>
 *   <li>live conversations (gauge)</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class ConversationMetrics {

    private static final String METRIC_PREFIX = "hugdimon.conversation";

    private final MeterRegistry registry;

    public ConversationMetrics(MeterRegistry registry, SessionStore sessionStore) {
        this.registry = registry;
        Gauge.builder(METRIC_PREFIX + ".sessions.active", sessionStore, SessionStore::size)
                .description("Conversations currently held in memory")
                .register(registry);
    }

    public void recordTurnLatency(String outcome, String language, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".turn.latency")
                .description("Time taken to process one turn")
                .tag("outcome", outcome)
                .tag("language", language)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementTurns(String outcome) {
        Counter.builder(METRIC_PREFIX + ".turns")
                .description("Number of processed turns by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementCompletionRetries() {
        Counter.builder(METRIC_PREFIX + ".completion.retries")
                .description("Completion attempts beyond the first")
                .register(registry)
                .increment();
    }

    public void incrementRetrievalFeedback(boolean helpful) {
        Counter.builder(METRIC_PREFIX + ".retrieval.feedback")
                .description("User verdicts on guide answers")
                .tag("helpful", Boolean.toString(helpful))
                .register(registry)
                .increment();
    }

    public void incrementBusy() {
        Counter.builder(METRIC_PREFIX + ".busy")
                .description("Turns rejected because the conversation lock was not granted in time")
                .register(registry)
                .increment();
    }
}
