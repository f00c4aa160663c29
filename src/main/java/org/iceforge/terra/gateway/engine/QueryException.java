package org.iceforge.terra.gateway.engine;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structured failure raised anywhere on the query path. Rendered 1:1 into an error response.
 */
public class QueryException extends RuntimeException {

    private final ErrorCode code;
    private final String hint;
    private final Map<String, Object> context;
    private final List<String> suggestions;
    private final Long retryAfterSeconds;

    private QueryException(Builder b) {
        super(b.detail, b.cause);
        this.code = b.code;
        this.hint = b.hint;
        this.context = b.context.isEmpty() ? Map.of() : Map.copyOf(b.context);
        this.suggestions = b.suggestions == null ? List.of() : List.copyOf(b.suggestions);
        this.retryAfterSeconds = b.retryAfterSeconds;
    }

    public static QueryException validation(String detail) {
        return builder(ErrorCode.VALIDATION_ERROR, detail).build();
    }

    public static QueryException notFound(String detail) {
        return builder(ErrorCode.NOT_FOUND, detail).build();
    }

    public static Builder builder(ErrorCode code, String detail) {
        return new Builder(code, detail);
    }

    public ErrorCode getCode() {
        return code;
    }

    public String getDetail() {
        return getMessage();
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

    public Long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    public static final class Builder {
        private final ErrorCode code;
        private final String detail;
        private String hint;
        private final Map<String, Object> context = new LinkedHashMap<>();
        private List<String> suggestions;
        private Long retryAfterSeconds;
        private Throwable cause;

        private Builder(ErrorCode code, String detail) {
            this.code = Objects.requireNonNull(code);
            this.detail = Objects.requireNonNull(detail);
        }

        public Builder hint(String hint) {
            this.hint = hint;
            return this;
        }

        public Builder context(String key, Object value) {
            if (value != null) {
                context.put(key, value);
            }
            return this;
        }

        public Builder suggestions(List<String> suggestions) {
            this.suggestions = suggestions;
            return this;
        }

        public Builder retryAfterSeconds(long seconds) {
            this.retryAfterSeconds = seconds;
            return this;
        }

        public Builder cause(Throwable cause) {
            this.cause = cause;
            return this;
        }

        public QueryException build() {
            return new QueryException(this);
        }
    }
}
