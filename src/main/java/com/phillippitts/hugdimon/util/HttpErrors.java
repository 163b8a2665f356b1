package com.phillippitts.hugdimon.util;

import com.phillippitts.hugdimon.exception.ExternalServiceException.Kind;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;

/** Maps HTTP client failures onto {@link Kind}. */
public final class HttpErrors {

    private HttpErrors() {
    }

    public static Kind kindOf(int status) {
        if (status == 429) {
            return Kind.RATE_LIMITED;
        }
        if (status == 401 || status == 403) {
            return Kind.AUTH_ERROR;
        }
        if (status == 408 || status == 504) {
            return Kind.TIMEOUT;
        }
        return Kind.UNAVAILABLE;
    }

    /** Timeouts anywhere in the cause chain map to {@link Kind#TIMEOUT}, anything else is unavailable. */
    public static Kind kindOf(Throwable ioFailure) {
        for (Throwable t = ioFailure; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException) {
                return Kind.TIMEOUT;
            }
        }
        return Kind.UNAVAILABLE;
    }
}
