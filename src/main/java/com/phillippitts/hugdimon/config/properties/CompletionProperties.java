package com.phillippitts.hugdimon.config.properties;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration for the completion model client and the retry policy around it.
 */
@Validated
@ConfigurationProperties(prefix = "hugdimon.completion")
public class CompletionProperties {

    /** Base URL of an OpenAI-compatible API. */
    @NotBlank
    private String baseUrl = "https://api.openai.com/v1";

    /** API key; blank disables authentication headers. */
    private String apiKey = "";

    @NotBlank
    private String model = "gpt-4o-mini";

    @Positive(message = "Max output tokens must be positive")
    private int maxOutputTokens = 300;

    @DecimalMin("0.0")
    private double temperature = 0.7;

    /** Per-attempt timeout for one completion call. */
    @NotNull
    private Duration timeout = Duration.ofSeconds(10);

    /** Total attempts (first call included) for timeouts and rate limits. */
    @Min(1)
    private int maxAttempts = 3;

    @NotNull
    private Duration initialBackoff = Duration.ofMillis(500);

    @DecimalMin("1.0")
    private double backoffMultiplier = 2.0;

    @NotNull
    private Duration maxBackoff = Duration.ofSeconds(4);

    /** Canned text used when generation fails while no scripted step applies. */
    @NotBlank
    private String degradedMessage = "I'm taking a cat nap. Please try again later.";

    /** Text returned when a turn fails before generation and nothing is committed. */
    @NotBlank
    private String apologyMessage = "I'm sorry, I cannot respond at this moment. Please try again.";

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public int getMaxOutputTokens() {
        return maxOutputTokens;
    }

    public void setMaxOutputTokens(int maxOutputTokens) {
        this.maxOutputTokens = maxOutputTokens;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public void setInitialBackoff(Duration initialBackoff) {
        this.initialBackoff = initialBackoff;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
        this.maxBackoff = maxBackoff;
    }

    /**
     * Longest time one generation can take: every attempt timing out plus the backoff waits
     * between attempts.
     */
    public Duration worstCaseDuration() {
        int attempts = Math.max(1, maxAttempts);
        Duration total = timeout.multipliedBy(attempts);
        double backoff = initialBackoff.toMillis();
        for (int i = 1; i < attempts; i++) {
            total = total.plusMillis((long) Math.min(backoff, maxBackoff.toMillis()));
            backoff *= backoffMultiplier;
        }
        return total;
    }

    public String getDegradedMessage() {
        return degradedMessage;
    }

    public void setDegradedMessage(String degradedMessage) {
        this.degradedMessage = degradedMessage;
    }

    public String getApologyMessage() {
        return apologyMessage;
    }

    public void setApologyMessage(String apologyMessage) {
        this.apologyMessage = apologyMessage;
    }
}
