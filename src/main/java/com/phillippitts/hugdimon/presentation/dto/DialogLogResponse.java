package com.phillippitts.hugdimon.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phillippitts.hugdimon.domain.Turn;

import java.util.List;
import java.util.Locale;

/**
 * Body of {@code GET /chat/{id}/history}.
 */
public record DialogLogResponse(
        @JsonProperty("conversation_id") String conversationId,
        @JsonProperty("turns") List<Entry> turns
) {

    public record Entry(String speaker, String text, String timestamp) {

        static Entry from(Turn turn) {
            return new Entry(turn.speaker().name().toLowerCase(Locale.ROOT), turn.text(),
                    turn.timestamp().toString());
        }
    }

    public static DialogLogResponse of(String conversationId, List<Turn> history) {
        return new DialogLogResponse(conversationId, history.stream().map(Entry::from).toList());
    }
}
