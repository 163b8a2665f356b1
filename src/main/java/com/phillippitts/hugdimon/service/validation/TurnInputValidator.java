package com.phillippitts.hugdimon.service.validation;

import com.phillippitts.hugdimon.config.properties.InputProperties;
import com.phillippitts.hugdimon.config.properties.TranscriptionProperties;
import com.phillippitts.hugdimon.exception.InvalidTurnException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Boundary checks for inbound turns.
 *
 * <p>Text: rejects null or blank messages, strips control characters (line breaks become
 * spaces) and truncates to {@code hugdimon.input.max-length}. Audio: rejects empty payloads and
 * payloads above {@code hugdimon.transcription.max-audio-bytes}.
 */
@Component
public class TurnInputValidator {

    private static final Logger LOG = LogManager.getLogger(TurnInputValidator.class);

    private final InputProperties inputProperties;
    private final TranscriptionProperties transcriptionProperties;

    public TurnInputValidator(InputProperties inputProperties, TranscriptionProperties transcriptionProperties) {
        this.inputProperties = inputProperties;
        this.transcriptionProperties = transcriptionProperties;
    }

    /**
     * @return the sanitized message
     * @throws InvalidTurnException if the message is null or blank after sanitizing
     */
    public String sanitizeMessage(String message) {
        if (message == null) {
            throw new InvalidTurnException("message", "must not be null");
        }
        StringBuilder sb = new StringBuilder(message.length());
        message.codePoints().forEach(cp -> {
            if (cp == '\n' || cp == '\r' || cp == '\t') {
                sb.append(' ');
            } else if (!Character.isISOControl(cp)) {
                sb.appendCodePoint(cp);
            }
        });
        String sanitized = sb.toString().strip();
        if (sanitized.isEmpty()) {
            throw new InvalidTurnException("message", "must not be blank");
        }
        int max = inputProperties.getMaxLength();
        if (sanitized.length() > max) {
            LOG.warn("Input truncated from {} to {} characters", sanitized.length(), max);
            int end = Character.isHighSurrogate(sanitized.charAt(max - 1)) ? max - 1 : max;
            sanitized = sanitized.substring(0, end);
        }
        return sanitized;
    }

    /**
     * @throws InvalidTurnException if the audio is empty or larger than the configured limit
     */
    public void validateAudio(byte[] audio) {
        if (audio == null || audio.length == 0) {
            throw new InvalidTurnException("audio", "must not be empty");
        }
        int max = transcriptionProperties.getMaxAudioBytes();
        if (audio.length > max) {
            throw new InvalidTurnException("audio", "payload too large: " + audio.length + " bytes, max " + max);
        }
    }
}
