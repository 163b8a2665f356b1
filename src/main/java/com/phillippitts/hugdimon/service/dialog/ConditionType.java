package com.phillippitts.hugdimon.service.dialog;

/** Kinds of transition guard a dialog step can declare. */
public enum ConditionType {
    /** All listed slots hold a value after this turn's extraction. */
    SLOTS_FILLED,
    /** The named intent was recognised in this turn's input. */
    INTENT,
    /** Matches unconditionally. */
    ALWAYS
}
