package com.phillippitts.hugdimon.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for prompt assembly.
 */
@Validated
@ConfigurationProperties(prefix = "hugdimon.prompt")
public class PromptProperties {

    /** Token budget for the whole assembled prompt. */
    @Positive
    private final int maxTokens;

    /** Number of most recent history turns considered for the prompt. */
    @Min(0)
    private final int historyWindow;

    @ConstructorBinding
    public PromptProperties(Integer maxTokens, Integer historyWindow) {
        this.maxTokens = maxTokens == null ? 3000 : maxTokens;
        this.historyWindow = historyWindow == null ? 10 : historyWindow;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public int getHistoryWindow() {
        return historyWindow;
    }
}
