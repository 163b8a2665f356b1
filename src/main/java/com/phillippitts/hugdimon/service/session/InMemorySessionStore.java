package com.phillippitts.hugdimon.service.session;

import com.phillippitts.hugdimon.config.properties.SessionProperties;
import com.phillippitts.hugdimon.domain.SessionState;
import com.phillippitts.hugdimon.exception.SessionBusyException;
import com.phillippitts.hugdimon.exception.SessionNotFoundException;
import com.phillippitts.hugdimon.exception.TurnCancelledException;
import com.phillippitts.hugdimon.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Process-local {@link SessionStore} backed by a {@link ConcurrentHashMap}.
 *
 * <p>Each conversation owns a fair {@link ReentrantLock}, so waiting turns are granted the
 * lock in arrival order. A locked scope operates on a deep copy of the committed state and
 * swaps the copy in only on normal completion.
 *
 * <p>Expired entries are tombstoned under their lock before removal. A turn that was queued on
 * the lock of a removed entry observes the tombstone and fails with
 * {@link SessionNotFoundException} instead of resurrecting the conversation.
 */
public class InMemorySessionStore implements SessionStore {

    private static final Logger LOG = LogManager.getLogger(InMemorySessionStore.class);

    private final Map<String, Entry> sessions = new ConcurrentHashMap<>();
    private final SessionProperties properties;
    private final Clock clock;
    private final String entryStepId;
    private final String defaultLanguage;

    public InMemorySessionStore(SessionProperties properties,
                                Clock clock,
                                String entryStepId,
                                String defaultLanguage) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.entryStepId = Objects.requireNonNull(entryStepId, "entryStepId");
        this.defaultLanguage = Objects.requireNonNull(defaultLanguage, "defaultLanguage");
    }

    @Override
    public SessionState getOrCreate(String conversationId) {
        if (conversationId == null || conversationId.isBlank()) {
            String generated = UUID.randomUUID().toString();
            Entry created = new Entry(newState(generated));
            sessions.put(generated, created);
            LOG.info("Created conversation {}", generated);
            return created.state.copy();
        }
        Entry existing = sessions.get(conversationId);
        if (existing != null && !existing.removed) {
            return existing.state.copy();
        }
        if (!properties.isAllowImplicitCreate()) {
            throw new SessionNotFoundException(conversationId);
        }
        Entry entry = sessions.compute(conversationId, (id, current) ->
                current == null || current.removed ? new Entry(newState(id)) : current);
        return entry.state.copy();
    }

    @Override
    public <T> T withLock(String conversationId, Function<SessionState, T> fn) {
        Objects.requireNonNull(fn, "fn");
        Entry entry = sessions.get(conversationId);
        if (entry == null) {
            throw new SessionNotFoundException(conversationId);
        }
        Duration timeout = properties.getLockTimeout();
        boolean acquired;
        try {
            acquired = entry.lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TurnCancelledException("Interrupted while waiting for conversation " + conversationId, e);
        }
        if (!acquired) {
            throw new SessionBusyException(conversationId, timeout);
        }
        try {
            if (entry.removed) {
                throw new SessionNotFoundException(conversationId);
            }
            SessionState working = entry.state.copy();
            T result = fn.apply(working);
            entry.state = working;
            return result;
        } finally {
            entry.lock.unlock();
        }
    }

    @Override
    public <T> T withLockForTurn(String requestedId, String conversationId, Function<SessionState, T> fn) {
        try {
            return withLock(conversationId, fn);
        } catch (SessionNotFoundException e) {
            Entry current = sessions.get(conversationId);
            boolean gone = current == null || current.removed;
            boolean generated = requestedId == null || requestedId.isBlank();
            if (!gone || (!generated && !properties.isAllowImplicitCreate())) {
                throw e;
            }
            sessions.compute(conversationId, (id, existing) ->
                    existing == null || existing.removed ? new Entry(newState(id)) : existing);
            LOG.info("Conversation {} expired before its turn was applied; recreated", conversationId);
            return withLock(conversationId, fn);
        }
    }

    @Override
    public int sweep(Instant now) {
        Duration ttl = properties.getTtl();
        int removed = 0;
        for (Map.Entry<String, Entry> e : sessions.entrySet()) {
            Entry entry = e.getValue();
            if (!TimeUtils.idleLongerThan(entry.state.getLastActive(), now, ttl)) {
                continue;
            }
            // A held lock means a turn is in flight; it will refresh lastActive.
            if (!entry.lock.tryLock()) {
                continue;
            }
            try {
                if (!entry.removed && TimeUtils.idleLongerThan(entry.state.getLastActive(), now, ttl)) {
                    entry.removed = true;
                    sessions.remove(e.getKey(), entry);
                    removed++;
                }
            } finally {
                entry.lock.unlock();
            }
        }
        if (removed > 0) {
            LOG.info("Session sweep removed {} idle conversation(s); {} remaining", removed, sessions.size());
        }
        return removed;
    }

    @Override
    public Optional<SessionState> find(String conversationId) {
        if (conversationId == null) {
            return Optional.empty();
        }
        Entry entry = sessions.get(conversationId);
        if (entry == null || entry.removed) {
            return Optional.empty();
        }
        return Optional.of(entry.state.copy());
    }

    @Override
    public SessionState reset(String conversationId) {
        return withLock(conversationId, state -> {
            state.resetTo(entryStepId, clock.instant());
            LOG.info("Conversation {} reset to step {}", conversationId, entryStepId);
            return state.copy();
        });
    }

    @Override
    public int size() {
        return sessions.size();
    }

    private SessionState newState(String conversationId) {
        return new SessionState(conversationId, entryStepId, defaultLanguage, clock.instant());
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock(true);
        private volatile SessionState state;
        private volatile boolean removed;

        private Entry(SessionState state) {
            this.state = state;
        }
    }
}
