package com.example.streampanel.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Error codes surfaced to clients, each bound to the HTTP status it is reported with.
 */
public enum ErrorCode {

    BAD_REQUEST(HttpStatus.BAD_REQUEST),

    AUTH_MISSING_TOKEN(HttpStatus.UNAUTHORIZED),
    AUTH_TOKEN_INVALID(HttpStatus.UNAUTHORIZED),
    AUTH_TOKEN_EXPIRED(HttpStatus.UNAUTHORIZED),
    AUTH_SESSION_INVALID(HttpStatus.UNAUTHORIZED),
    AUTH_INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED),
    AUTH_ACCOUNT_EXPIRED(HttpStatus.UNAUTHORIZED),
    AUTH_ACCOUNT_SUSPENDED(HttpStatus.UNAUTHORIZED),
    ACCESS_DENIED(HttpStatus.FORBIDDEN),

    LICENSE_INVALID(HttpStatus.UNAUTHORIZED),
    LICENSE_NOT_FOUND(HttpStatus.NOT_FOUND),
    LICENSE_QUOTA_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS),
    QUOTA_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS),

    STREAM_CHANNEL_NOT_FOUND(HttpStatus.NOT_FOUND),
    STREAM_SESSION_NOT_FOUND(HttpStatus.NOT_FOUND),
    STREAM_SESSION_CLOSED(HttpStatus.CONFLICT),
    STREAM_ALREADY_RELAYING(HttpStatus.CONFLICT),
    UPSTREAM_UNAVAILABLE(HttpStatus.BAD_GATEWAY),
    UPSTREAM_INTERRUPTED(HttpStatus.BAD_GATEWAY),

    USAGE_LEDGER_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
