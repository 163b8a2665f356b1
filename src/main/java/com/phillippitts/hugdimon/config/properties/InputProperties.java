package com.phillippitts.hugdimon.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Limits applied to inbound chat messages before they reach the turn pipeline.
 */
@Validated
@ConfigurationProperties(prefix = "hugdimon.input")
public class InputProperties {

    /** Messages longer than this are truncated. */
    @Positive
    private int maxLength = 500;

    public int getMaxLength() {
        return maxLength;
    }

    public void setMaxLength(int maxLength) {
        this.maxLength = maxLength;
    }
}
