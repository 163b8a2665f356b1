package com.phillippitts.hugdimon.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry of a conversation history.
 *
 * @param speaker   who said it
 * @param text      what was said (may be empty, never null)
 * @param timestamp when the turn was recorded
 */
public record Turn(Speaker speaker, String text, Instant timestamp) {

    public Turn {
        Objects.requireNonNull(speaker, "speaker must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public static Turn user(String text, Instant at) {
        return new Turn(Speaker.USER, text, at);
    }

    public static Turn assistant(String text, Instant at) {
        return new Turn(Speaker.ASSISTANT, text, at);
    }
}
