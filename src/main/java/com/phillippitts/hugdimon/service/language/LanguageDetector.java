package com.phillippitts.hugdimon.service.language;

/**
 * Guesses the language of a text. May return {@link DetectedLanguage#undetermined()} and may
 * return codes outside the supported set; {@link LanguagePipeline} normalises both.
 */
public interface LanguageDetector {

    DetectedLanguage detect(String text);
}
