package com.phillippitts.hugdimon.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for the Catalan proverb ("refrany") attached to generated replies.
 */
@Validated
@ConfigurationProperties(prefix = "hugdimon.proverb")
public class ProverbProperties {

    private boolean enabled = true;

    @NotBlank
    private String catalogLocation = "classpath:proverbs/proverbs.json";

    /** Number of most recent picks that are not repeated while alternatives remain. */
    @Min(0)
    private int recentWindow = 50;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getCatalogLocation() {
        return catalogLocation;
    }

    public void setCatalogLocation(String catalogLocation) {
        this.catalogLocation = catalogLocation;
    }

    public int getRecentWindow() {
        return recentWindow;
    }

    public void setRecentWindow(int recentWindow) {
        this.recentWindow = recentWindow;
    }
}
