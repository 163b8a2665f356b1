package com.phillippitts.hugdimon.service.orchestration.event;

import com.phillippitts.hugdimon.domain.TurnOutcome;

import java.time.Instant;

/**
 * Emitted after every handled turn, including degraded and apology turns.
 *
 * @param conversationId conversation the turn belongs to
 * @param outcome        how the response was produced
 * @param language       conversation language after the turn
 * @param stepId         dialog step after the turn, or null in free-form mode
 * @param durationNanos  wall time spent in the coordinator
 * @param timestamp      when the turn completed
 */
public record TurnCompletedEvent(
        String conversationId,
        TurnOutcome outcome,
        String language,
        String stepId,
        long durationNanos,
        Instant timestamp
) {}
