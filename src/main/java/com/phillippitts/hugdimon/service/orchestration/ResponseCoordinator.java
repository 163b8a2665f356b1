package com.phillippitts.hugdimon.service.orchestration;

import com.phillippitts.hugdimon.domain.SessionState;
import com.phillippitts.hugdimon.domain.Turn;
import com.phillippitts.hugdimon.domain.TurnRequest;
import com.phillippitts.hugdimon.domain.TurnResponse;

import java.util.List;

/**
 * Entry point for conversation turns.
 *
 * <p>Implementations always answer a valid turn: collaborator failures degrade the response
 * instead of escaping. Only boundary errors reach the caller.
 *
 * @since 1.0
 */
public interface ResponseCoordinator {

    /**
     * Handles one text turn.
     *
     * @throws com.phillippitts.hugdimon.exception.InvalidTurnException if the message is blank
     * @throws com.phillippitts.hugdimon.exception.SessionNotFoundException if the id is unknown
     *         and implicit creation is disabled
     * @throws com.phillippitts.hugdimon.exception.SessionBusyException if the conversation lock
     *         was not granted in time
     */
    TurnResponse handleTurn(TurnRequest request);

    /**
     * Transcribes {@code audio} and handles the transcript as a text turn, using the transcript
     * language as a hint.
     *
     * @throws com.phillippitts.hugdimon.exception.ExternalServiceException if no transcription
     *         service is configured or transcription fails
     */
    TurnResponse handleVoiceTurn(String conversationId, byte[] audio);

    /** @return whether {@link #handleVoiceTurn} has a transcription service behind it */
    boolean isVoiceEnabled();

    /** @return the full conversation history, oldest first */
    List<Turn> dialogLog(String conversationId);

    /** Restarts the conversation at the dialog entry step. */
    SessionState reset(String conversationId);
}
