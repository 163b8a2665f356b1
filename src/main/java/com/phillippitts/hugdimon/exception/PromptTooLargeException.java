package com.phillippitts.hugdimon.exception;

/**
 * Thrown when the mandatory prompt sections (persona, step prompt, user message)
 * alone exceed the token budget. Not retried.
 */
public class PromptTooLargeException extends HugDimonException {

    private final int requiredTokens;
    private final int budgetTokens;

    public PromptTooLargeException(int requiredTokens, int budgetTokens) {
        super("Prompt requires " + requiredTokens + " tokens but budget is " + budgetTokens);
        this.requiredTokens = requiredTokens;
        this.budgetTokens = budgetTokens;
    }

    public int getRequiredTokens() {
        return requiredTokens;
    }

    public int getBudgetTokens() {
        return budgetTokens;
    }
}
