package com.phillippitts.hugdimon.service.events;

import com.phillippitts.hugdimon.domain.TurnOutcome;
import com.phillippitts.hugdimon.service.metrics.ConversationMetricsPublisher;
import com.phillippitts.hugdimon.service.orchestration.event.TurnCompletedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Feeds turn metrics and reports degraded turns. Warnings are throttled per outcome to avoid log
 * spam while the completion service is down.
 */
@Component
class TurnEventsListener {
    private static final Logger LOG = LogManager.getLogger(TurnEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final ConversationMetricsPublisher metricsPublisher;
    private final Clock clock;

    TurnEventsListener(ConversationMetricsPublisher metricsPublisher, Clock clock) {
        this.metricsPublisher = metricsPublisher;
        this.clock = clock;
    }

    @EventListener
    void onTurnCompleted(TurnCompletedEvent e) {
        metricsPublisher.recordTurn(e.outcome().name(), e.language(), e.durationNanos());
        if (e.outcome() == TurnOutcome.DEGRADED && shouldLog("degraded")) {
            LOG.warn("Turns are being answered with canned replies (conversation={}). "
                    + "Check hugdimon.completion.* and the completion service status.", e.conversationId());
        } else if (e.outcome() == TurnOutcome.APOLOGY && shouldLog("apology")) {
            LOG.warn("Turn aborted with an apology (conversation={}). See earlier log lines for the stage.",
                    e.conversationId());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
