package org.iceforge.terra.gateway.web;

import org.iceforge.terra.gateway.engine.ErrorCode;
import org.iceforge.terra.gateway.engine.QueryException;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public class ErrorResponse {
    private final Instant timestamp = Instant.now();
    private final ErrorCode error;
    private final String detail;
    private String hint;
    private Map<String, Object> context;
    private List<String> suggestions;
    private Long retryAfter;
    private String requestId;

    public ErrorResponse(ErrorCode error, String detail) {
        this.error = error;
        this.detail = detail;
    }

    public static ErrorResponse of(QueryException e, String requestId) {
        ErrorResponse r = new ErrorResponse(e.getCode(), e.getDetail());
        r.hint = e.getHint();
        r.context = e.getContext().isEmpty() ? null : e.getContext();
        r.suggestions = e.getSuggestions().isEmpty() ? null : e.getSuggestions();
        r.retryAfter = e.getRetryAfterSeconds();
        r.requestId = requestId;
        return r;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public ErrorCode getError() {
        return error;
    }

    public String getDetail() {
        return detail;
    }

    public String getHint() {
        return hint;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public List<String> getSuggestions() {
        return suggestions;
    }

    public Long getRetryAfter() {
        return retryAfter;
    }

    public String getRequestId() {
        return requestId;
    }
}
