package com.phillippitts.hugdimon.domain;

/**
 * One inbound user turn.
 *
 * @param conversationId existing conversation id, or null to start a new conversation
 * @param message        the user's message
 * @param languageHint   language already detected upstream (e.g. by transcription), nullable
 */
public record TurnRequest(String conversationId, String message, String languageHint) {

    public static TurnRequest of(String conversationId, String message) {
        return new TurnRequest(conversationId, message, null);
    }
}
