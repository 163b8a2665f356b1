package com.phillippitts.hugdimon.exception;

import java.time.Duration;

/**
 * Thrown when another turn for the same conversation holds the session lock
 * longer than the configured wait timeout.
 */
public class SessionBusyException extends HugDimonException {

    private final String conversationId;
    private final Duration waited;

    public SessionBusyException(String conversationId, Duration waited) {
        super("Conversation " + conversationId + " is busy (waited " + waited.toMillis() + " ms)");
        this.conversationId = conversationId;
        this.waited = waited;
    }

    public String getConversationId() {
        return conversationId;
    }

    public Duration getWaited() {
        return waited;
    }
}
