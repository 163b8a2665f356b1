package com.phillippitts.hugdimon.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Language handling: supported codes, default and pivot language.
 */
@Validated
@ConfigurationProperties(prefix = "hugdimon.language")
public class LanguageProperties {

    @NotEmpty
    private List<String> supported = new ArrayList<>(List.of("en", "es", "fr", "de", "ca", "ru"));

    /** Used when detection fails or returns an unsupported code. */
    @NotBlank
    private String defaultLanguage = "en";

    /** Language that inbound text is translated into for slot extraction and retrieval. */
    @NotBlank
    private String pivot = "en";

    public List<String> getSupported() {
        return supported;
    }

    public void setSupported(List<String> supported) {
        this.supported = supported;
    }

    public String getDefaultLanguage() {
        return defaultLanguage;
    }

    public void setDefaultLanguage(String defaultLanguage) {
        this.defaultLanguage = defaultLanguage;
    }

    public String getPivot() {
        return pivot;
    }

    public void setPivot(String pivot) {
        this.pivot = pivot;
    }

    public boolean isSupported(String code) {
        return code != null && supported.contains(code);
    }
}
