package com.phillippitts.hugdimon.service.language;

/**
 * @param text       translated text, or the input when translation did not happen
 * @param translated false when the input was passed through unchanged
 */
public record TranslationResult(String text, boolean translated) {

    public static TranslationResult unchanged(String text) {
        return new TranslationResult(text, false);
    }
}
