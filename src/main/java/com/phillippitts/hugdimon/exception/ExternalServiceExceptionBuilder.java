package com.phillippitts.hugdimon.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing {@link ExternalServiceException} with contextual details.
 *
 * <p>Used by the HTTP adapters for the completion, translation and transcription services so
 * that every failure carries the same shape of message.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw ExternalServiceExceptionBuilder.create("Completion request rejected")
 *         .service("openai")
 *         .kind(ExternalServiceException.Kind.RATE_LIMITED)
 *         .httpStatus(429)
 *         .durationMs(840)
 *         .metadata("model", "gpt-4o-mini")
 *         .build();
 * </pre>
 */
public final class ExternalServiceExceptionBuilder {

    private final String message;
    private String serviceName;
    private ExternalServiceException.Kind kind = ExternalServiceException.Kind.UNAVAILABLE;
    private Throwable cause;
    private Integer httpStatus;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ExternalServiceExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static ExternalServiceExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ExternalServiceExceptionBuilder(message);
    }

    public ExternalServiceExceptionBuilder service(String serviceName) {
        this.serviceName = serviceName;
        return this;
    }

    public ExternalServiceExceptionBuilder kind(ExternalServiceException.Kind kind) {
        if (kind != null) {
            this.kind = kind;
        }
        return this;
    }

    public ExternalServiceExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Sets the HTTP status returned by the remote service.
     *
     * @param httpStatus status code
     * @return this builder for chaining
     */
    public ExternalServiceExceptionBuilder httpStatus(int httpStatus) {
        this.httpStatus = httpStatus;
        return this;
    }

    public ExternalServiceExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message.
     *
     * @param key metadata key
     * @param value metadata value, ignored when null
     * @return this builder for chaining
     */
    public ExternalServiceExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (httpStatus={code}, durationMs={ms}, {key1}={val1}, ...)
     * </pre>
     *
     * @return constructed exception
     */
    public ExternalServiceException build() {
        String service = serviceName != null ? serviceName : "unknown";
        return new ExternalServiceException(kind, service, buildDetailedMessage(), cause);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = httpStatus != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (httpStatus != null) {
            sb.append("httpStatus=").append(httpStatus);
            first = false;
        }

        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }

        return sb.append(')').toString();
    }
}
