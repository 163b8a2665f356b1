package com.phillippitts.hugdimon.service.dialog;

/** Side signals emitted by {@link DialogEngine#advance}. */
public enum DialogAction {
    /** No transition matched and the step has no fallback; re-ask. */
    CLARIFY,
    /** No transition matched; the step's fallback was entered. */
    FALLBACK,
    /** The flow reached a terminal step; later turns are unscripted. */
    HANDOFF_TO_FREEFORM
}
