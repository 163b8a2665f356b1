package com.phillippitts.hugdimon.domain;

/** Who produced a turn in the conversation history. */
public enum Speaker {
    USER,
    ASSISTANT
}
