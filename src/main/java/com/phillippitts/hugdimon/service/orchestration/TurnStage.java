package com.phillippitts.hugdimon.service.orchestration;

/**
 * Pipeline position of the turn being processed. Published to the Log4j2 {@code ThreadContext}
 * under {@link DefaultResponseCoordinator#TURN_STAGE} so log lines and failure reports show how
 * far a turn got.
 */
public enum TurnStage {
    RECEIVED,
    LANGUAGE_DETECTED,
    DIALOG_ADVANCED,
    CONTEXT_RETRIEVED,
    PROMPT_ASSEMBLED,
    GENERATED,
    TRANSLATED,
    COMMITTED
}
