package com.phillippitts.hugdimon.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Mutable per-conversation state.
 *
 * <p>Instances handed out by the session store are working copies: mutations only become
 * visible to other turns once the store commits them at the end of a locked scope.
 * {@link #copy()} produces an independent deep copy.
 *
 * <p>History is append-only. Prompt assembly windows it but never truncates it.
 *
 * <p><b>Thread Safety:</b> Not thread-safe. The store guarantees a single writer per
 * conversation id.
 */
public final class SessionState {

    private final String conversationId;
    private final Instant createdAt;
    private String currentStepId;
    private final Map<String, String> slots;
    private final List<Turn> history;
    private String language;
    private Instant lastActive;
    private final List<Double> sentimentTrail;
    private boolean freeform;

    public SessionState(String conversationId, String entryStepId, String language, Instant now) {
        this(conversationId, now, entryStepId, new LinkedHashMap<>(), new ArrayList<>(), language, now,
                new ArrayList<>(), false);
    }

    private SessionState(String conversationId,
                         Instant createdAt,
                         String currentStepId,
                         Map<String, String> slots,
                         List<Turn> history,
                         String language,
                         Instant lastActive,
                         List<Double> sentimentTrail,
                         boolean freeform) {
        this.conversationId = Objects.requireNonNull(conversationId, "conversationId");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.currentStepId = Objects.requireNonNull(currentStepId, "currentStepId");
        this.slots = slots;
        this.history = history;
        this.language = Objects.requireNonNull(language, "language");
        this.lastActive = Objects.requireNonNull(lastActive, "lastActive");
        this.sentimentTrail = sentimentTrail;
        this.freeform = freeform;
    }

    /** @return an independent deep copy of this state */
    public SessionState copy() {
        return new SessionState(conversationId, createdAt, currentStepId, new LinkedHashMap<>(slots),
                new ArrayList<>(history), language, lastActive, new ArrayList<>(sentimentTrail), freeform);
    }

    public String getConversationId() {
        return conversationId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public String getCurrentStepId() {
        return currentStepId;
    }

    public void setCurrentStepId(String currentStepId) {
        this.currentStepId = Objects.requireNonNull(currentStepId, "currentStepId");
    }

    /** @return read-only view of the collected slots */
    public Map<String, String> getSlots() {
        return Collections.unmodifiableMap(slots);
    }

    public void putSlot(String name, String value) {
        slots.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
    }

    public void removeSlot(String name) {
        slots.remove(name);
    }

    public void clearSlots() {
        slots.clear();
    }

    /** @return read-only view of the full history, oldest first */
    public List<Turn> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public void appendTurn(Turn turn) {
        history.add(Objects.requireNonNull(turn, "turn"));
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = Objects.requireNonNull(language, "language");
    }

    public Instant getLastActive() {
        return lastActive;
    }

    public void touch(Instant now) {
        this.lastActive = Objects.requireNonNull(now, "now");
    }

    public List<Double> getSentimentTrail() {
        return Collections.unmodifiableList(sentimentTrail);
    }

    public void recordSentiment(double score) {
        sentimentTrail.add(score);
    }

    /** @return true once the scripted flow handed off to unscripted generation */
    public boolean isFreeform() {
        return freeform;
    }

    public void setFreeform(boolean freeform) {
        this.freeform = freeform;
    }

    /**
     * Resets the conversation to the given entry step, dropping slots, history and sentiment.
     * The conversation id, creation time and language are kept.
     */
    public void resetTo(String entryStepId, Instant now) {
        this.currentStepId = Objects.requireNonNull(entryStepId, "entryStepId");
        slots.clear();
        history.clear();
        sentimentTrail.clear();
        freeform = false;
        lastActive = now;
    }

    @Override
    public String toString() {
        return "SessionState{conversationId=" + conversationId
                + ", step=" + currentStepId
                + ", slots=" + slots.keySet()
                + ", turns=" + history.size()
                + ", language=" + language
                + ", freeform=" + freeform + '}';
    }
}
