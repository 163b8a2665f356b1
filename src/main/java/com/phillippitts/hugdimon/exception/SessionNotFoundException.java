package com.phillippitts.hugdimon.exception;

/**
 * Thrown when a conversation id is not present in the session store
 * and implicit creation is not allowed (or the session was swept).
 */
public class SessionNotFoundException extends HugDimonException {

    private final String conversationId;

    public SessionNotFoundException(String conversationId) {
        super("Conversation not found: " + conversationId);
        this.conversationId = conversationId;
    }

    public String getConversationId() {
        return conversationId;
    }
}
