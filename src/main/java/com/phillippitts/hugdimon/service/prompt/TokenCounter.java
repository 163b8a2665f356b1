package com.phillippitts.hugdimon.service.prompt;

/** Counts model tokens in a piece of text. */
@FunctionalInterface
public interface TokenCounter {

    int count(String text);
}
