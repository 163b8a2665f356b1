package com.phillippitts.hugdimon.service.session;

import com.phillippitts.hugdimon.domain.SessionState;
import com.phillippitts.hugdimon.exception.SessionBusyException;
import com.phillippitts.hugdimon.exception.SessionNotFoundException;

import java.time.Instant;
import java.util.Optional;
import java.util.function.Function;

/**
 * Keyed registry of conversation state with per-conversation serialization and idle expiry.
 *
 * <p>Turns for different conversations proceed in parallel. Turns for the same conversation
 * are applied one at a time, in the order in which they were granted the conversation's lock.
 */
public interface SessionStore {

    /**
     * Returns a snapshot of the conversation, creating it when needed.
     *
     * <p>A {@code null} or blank id creates a new conversation under a generated id. An unknown
     * id is created under that id when implicit creation is enabled, otherwise rejected.
     *
     * @param conversationId client-supplied id, may be null
     * @return snapshot copy of the current state
     * @throws SessionNotFoundException if the id is unknown and implicit creation is disabled
     */
    SessionState getOrCreate(String conversationId);

    /**
     * Runs {@code fn} with exclusive access to the conversation.
     *
     * <p>{@code fn} receives a working copy. The copy becomes the committed state only when
     * {@code fn} returns normally; any exception leaves the committed state untouched. The lock
     * is released on every path.
     *
     * @throws SessionNotFoundException if the id is unknown or was expired while waiting
     * @throws SessionBusyException if the lock was not granted within the configured timeout
     */
    <T> T withLock(String conversationId, Function<SessionState, T> fn);

    /**
     * {@link #withLock} for a conversation the caller has just obtained from
     * {@link #getOrCreate}. If the sweep removed it in between, it is created again once under
     * the same id, provided the id was generated ({@code requestedId} blank) or implicit
     * creation is enabled.
     *
     * @param requestedId    id the client asked for, may be null
     * @param conversationId id returned by {@link #getOrCreate}
     * @throws SessionNotFoundException if the conversation is gone and may not be recreated
     * @throws SessionBusyException if the lock was not granted within the configured timeout
     */
    <T> T withLockForTurn(String requestedId, String conversationId, Function<SessionState, T> fn);

    /**
     * Removes conversations idle for longer than the configured TTL. Conversations with a turn
     * in flight are skipped.
     *
     * @return number of removed conversations
     */
    int sweep(Instant now);

    /** Read-only snapshot of the committed state, if the conversation exists. */
    Optional<SessionState> find(String conversationId);

    /**
     * Puts the conversation back at the dialog entry step with no slots and no history.
     *
     * @return snapshot of the reset state
     */
    SessionState reset(String conversationId);

    /** @return number of live conversations */
    int size();
}
