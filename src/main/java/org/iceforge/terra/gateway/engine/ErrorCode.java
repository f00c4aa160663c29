package org.iceforge.terra.gateway.engine;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stable error codes a programmatic caller can branch on (retry vs. rephrase vs. abandon).
 */
public enum ErrorCode {
    VALIDATION_ERROR("validation_error", 400),
    NOT_FOUND("not_found", 404),
    EXECUTION_ERROR("execution_error", 500),
    UNAVAILABLE("unavailable", 503),
    TIMEOUT("timeout", 504);

    private final String code;
    private final int httpStatus;

    ErrorCode(String code, int httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
