package com.phillippitts.hugdimon.config.properties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration for the optional remote translator. Translation is disabled when no base URL is set.
 */
@Validated
@ConfigurationProperties(prefix = "hugdimon.translation")
public class TranslationProperties {

    /** Base URL of a LibreTranslate-compatible service; blank disables translation. */
    private String baseUrl = "";

    private String apiKey = "";

    @NotNull
    private Duration timeout = Duration.ofSeconds(5);

    @Positive
    private int cacheSize = 500;

    @NotNull
    private Duration cacheTtl = Duration.ofDays(1);

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

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public int getCacheSize() {
        return cacheSize;
    }

    public void setCacheSize(int cacheSize) {
        this.cacheSize = cacheSize;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public void setCacheTtl(Duration cacheTtl) {
        this.cacheTtl = cacheTtl;
    }
}
