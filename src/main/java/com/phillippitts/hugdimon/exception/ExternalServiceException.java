package com.phillippitts.hugdimon.exception;

/**
 * Thrown when an external collaborator (completion model, translator, transcription service)
 * fails. The {@link Kind} drives retry and degradation decisions in the orchestrator.
 */
public class ExternalServiceException extends HugDimonException {

    /** Failure categories reported by external collaborators. */
    public enum Kind {
        TIMEOUT(true),
        RATE_LIMITED(true),
        UNAVAILABLE(false),
        AUTH_ERROR(false);

        private final boolean transientFailure;

        Kind(boolean transientFailure) {
            this.transientFailure = transientFailure;
        }

        /** @return true if a retry with backoff may succeed */
        public boolean isTransient() {
            return transientFailure;
        }
    }

    private final Kind kind;
    private final String serviceName;

    public ExternalServiceException(Kind kind, String message) {
        this(kind, "unknown", message, null);
    }

    public ExternalServiceException(Kind kind, String serviceName, String message) {
        this(kind, serviceName, message, null);
    }

    public ExternalServiceException(Kind kind, String serviceName, String message, Throwable cause) {
        super(message + " (service: " + serviceName + ", kind: " + kind + ")", cause);
        this.kind = kind;
        this.serviceName = serviceName;
    }

    public Kind getKind() {
        return kind;
    }

    public String getServiceName() {
        return serviceName;
    }
}
