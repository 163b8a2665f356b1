package com.phillippitts.hugdimon.service.completion;

import com.phillippitts.hugdimon.config.properties.CompletionProperties;

/**
 * Per-call generation settings.
 */
public record CompletionParams(String model, int maxOutputTokens, double temperature) {

    public static CompletionParams from(CompletionProperties properties) {
        return new CompletionParams(properties.getModel(), properties.getMaxOutputTokens(), properties.getTemperature());
    }
}
