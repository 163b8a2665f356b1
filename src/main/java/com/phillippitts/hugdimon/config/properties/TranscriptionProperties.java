package com.phillippitts.hugdimon.config.properties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration for the optional speech-to-text service feeding voice turns.
 */
@Validated
@ConfigurationProperties(prefix = "hugdimon.transcription")
public class TranscriptionProperties {

    /** Base URL of the transcription service; blank disables voice turns. */
    private String baseUrl = "";

    @NotNull
    private Duration timeout = Duration.ofSeconds(15);

    /** Upper bound for uploaded audio (memory guard). */
    @Positive
    private int maxAudioBytes = 10 * 1024 * 1024;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public int getMaxAudioBytes() {
        return maxAudioBytes;
    }

    public void setMaxAudioBytes(int maxAudioBytes) {
        this.maxAudioBytes = maxAudioBytes;
    }
}
