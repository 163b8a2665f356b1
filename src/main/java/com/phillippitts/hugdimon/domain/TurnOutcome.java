package com.phillippitts.hugdimon.domain;

/** How a turn was answered. */
public enum TurnOutcome {
    /** The completion model produced the response. */
    GENERATED,
    /** Completion failed after retries; a canned scripted response was used. */
    DEGRADED,
    /** The turn failed fast; nothing was committed to the session. */
    APOLOGY
}
