package com.phillippitts.hugdimon.service.transcription;

/**
 * Speech-to-text result.
 *
 * @param text     transcribed text
 * @param language language code reported by the service, or null
 */
public record Transcript(String text, String language) {
}
