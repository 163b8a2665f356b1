package com.phillippitts.hugdimon.service.health;

import com.phillippitts.hugdimon.config.properties.CompletionProperties;
import com.phillippitts.hugdimon.domain.TurnOutcome;
import com.phillippitts.hugdimon.service.orchestration.event.TurnCompletedEvent;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Health indicator for the completion service, judged from recent turns.
 *
 * <ul>
 *   <li>UP: API key configured and recent turns generated normally</li>
 *   <li>DEGRADED: no API key, or the last {@value #DEGRADED_STREAK} turns fell back to canned replies</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class CompletionHealthIndicator implements HealthIndicator {

    static final int DEGRADED_STREAK = 3;

    private final CompletionProperties properties;
    private final AtomicInteger consecutiveDegraded = new AtomicInteger();

    public CompletionHealthIndicator(CompletionProperties properties) {
        this.properties = properties;
    }

    @EventListener
    public void onTurnCompleted(TurnCompletedEvent event) {
        if (event.outcome() == TurnOutcome.DEGRADED) {
            consecutiveDegraded.incrementAndGet();
        } else if (event.outcome() == TurnOutcome.GENERATED) {
            consecutiveDegraded.set(0);
        }
    }

    @Override
    public Health health() {
        boolean keyConfigured = properties.getApiKey() != null && !properties.getApiKey().isBlank();
        int streak = consecutiveDegraded.get();

        Health.Builder builder = new Health.Builder();
        if (!keyConfigured) {
            builder.status("DEGRADED").withDetail("status", "No API key configured");
        } else if (streak >= DEGRADED_STREAK) {
            builder.status("DEGRADED").withDetail("status", "Recent turns fell back to canned replies");
        } else {
            builder.up().withDetail("status", "Completion service operational");
        }
        return builder
                .withDetail("model", properties.getModel())
                .withDetail("consecutiveDegradedTurns", streak)
                .build();
    }
}
