package com.phillippitts.hugdimon.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the scripted dialog.
 */
@Validated
@ConfigurationProperties(prefix = "hugdimon.dialog")
public class DialogProperties {

    /** Resource location of the dialog script. */
    @NotBlank
    private final String scriptLocation;

    @ConstructorBinding
    public DialogProperties(String scriptLocation) {
        this.scriptLocation = scriptLocation == null ? "classpath:dialog/restaurant_booking.json" : scriptLocation;
    }

    public String getScriptLocation() {
        return scriptLocation;
    }
}
