package com.phillippitts.hugdimon.service.health;

import com.phillippitts.hugdimon.config.properties.CompletionProperties;
import com.phillippitts.hugdimon.domain.TurnOutcome;
import com.phillippitts.hugdimon.service.orchestration.event.TurnCompletedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class CompletionHealthIndicatorTest {

    private CompletionProperties properties;
    private CompletionHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        properties = new CompletionProperties();
        properties.setApiKey("sk-test");
        indicator = new CompletionHealthIndicator(properties);
    }

    private static TurnCompletedEvent turn(TurnOutcome outcome) {
        return new TurnCompletedEvent("c1", outcome, "en", null, 1L, Instant.EPOCH);
    }

    @Test
    void shouldReportUpWithKeyAndHealthyTurns() {
        indicator.onTurnCompleted(turn(TurnOutcome.GENERATED));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("model", "gpt-4o-mini");
    }

    @Test
    void shouldReportDegradedWithoutKey() {
        properties.setApiKey("");

        assertThat(indicator.health().getStatus()).isEqualTo(new Status("DEGRADED"));
        assertThat(indicator.health().getDetails()).containsEntry("status", "No API key configured");
    }

    @Test
    void shouldReportDegradedAfterStreakOfCannedReplies() {
        for (int i = 0; i < CompletionHealthIndicator.DEGRADED_STREAK; i++) {
            indicator.onTurnCompleted(turn(TurnOutcome.DEGRADED));
        }

        assertThat(indicator.health().getStatus()).isEqualTo(new Status("DEGRADED"));
        assertThat(indicator.health().getDetails()).containsEntry("consecutiveDegradedTurns", 3);

        indicator.onTurnCompleted(turn(TurnOutcome.GENERATED));
        assertThat(indicator.health().getStatus()).isEqualTo(Status.UP);
    }

    @Test
    void apologyTurnsDoNotAffectStreak() {
        indicator.onTurnCompleted(turn(TurnOutcome.DEGRADED));
        indicator.onTurnCompleted(turn(TurnOutcome.APOLOGY));

        assertThat(indicator.health().getDetails()).containsEntry("consecutiveDegradedTurns", 1);
    }
}
