package com.chatgateway;

/**
 * Uniform failure taxonomy surfaced to callers regardless of where the failure happened.
 */
public enum ErrorKind {
    BUSY(429, false),
    TIMEOUT(504, false),
    CANCELLED(499, false),
    NOT_AUTHORIZED(403, false),
    MODEL_UNKNOWN(404, false),
    INSUFFICIENT_ACCESS_LEVEL(403, false),
    INSUFFICIENT_CREDIT(402, false),
    PAYLOAD_TOO_LARGE(413, false),
    AUTH_ERROR(502, false),
    RATE_LIMITED(429, true),
    UPSTREAM_UNAVAILABLE(502, true),
    INVALID_RESPONSE(502, false),
    INVALID_REQUEST(400, false),
    NOT_FOUND(404, false),
    INTERNAL(500, false);

    private final int httpStatus;
    private final boolean retryable;

    ErrorKind(int httpStatus, boolean retryable) {
        this.httpStatus = httpStatus;
        this.retryable = retryable;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    /**
     * Only upstream kinds are ever retried, and only before any output was produced.
     */
    public boolean isRetryable() {
        return retryable;
    }

    public String code() {
        return name().toLowerCase();
    }
}
