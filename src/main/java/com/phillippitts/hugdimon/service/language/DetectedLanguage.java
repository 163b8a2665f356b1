package com.phillippitts.hugdimon.service.language;

import java.util.Objects;

/**
 * Language detection result.
 *
 * @param code       ISO 639-1 code, or {@link #UNDETERMINED}
 * @param confidence in [0, 1]; 0 when the code was carried over or defaulted
 */
public record DetectedLanguage(String code, double confidence) {

    public static final String UNDETERMINED = "und";

    public DetectedLanguage {
        Objects.requireNonNull(code, "code must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1]: " + confidence);
        }
    }

    public static DetectedLanguage undetermined() {
        return new DetectedLanguage(UNDETERMINED, 0.0);
    }

    public boolean isUndetermined() {
        return UNDETERMINED.equals(code);
    }
}
