package org.iceforge.terra.gateway.web;

import org.iceforge.terra.gateway.engine.ErrorCode;
import org.iceforge.terra.gateway.engine.QueryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(QueryException.class)
    public ResponseEntity<ErrorResponse> queryFailed(QueryException e, ServerWebExchange exchange) {
        String requestId = RequestIdFilter.requestId(exchange);
        if (e.getCode() == ErrorCode.EXECUTION_ERROR) {
            log.warn("[{}] {}: {}", requestId, e.getCode().code(), e.getDetail());
        } else {
            log.info("[{}] {}: {}", requestId, e.getCode().code(), e.getDetail());
        }
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(e.getCode().httpStatus())
                .contentType(MediaType.APPLICATION_JSON);
        if (e.getRetryAfterSeconds() != null) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()));
        }
        return builder.body(ErrorResponse.of(e, requestId));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> invalidRequest(WebExchangeBindException e, ServerWebExchange exchange) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (FieldError fe : e.getFieldErrors()) {
            fields.put(fe.getField(), fe.getDefaultMessage());
        }
        QueryException qe = QueryException.builder(ErrorCode.VALIDATION_ERROR, "Request failed validation")
                .context("fields", fields)
                .build();
        return queryFailed(qe, exchange);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> unreadableRequest(ServerWebInputException e, ServerWebExchange exchange) {
        QueryException qe = QueryException.builder(ErrorCode.VALIDATION_ERROR, "Malformed request: " + Objects.toString(e.getReason(), "unreadable body"))
                .hint("Send a JSON object matching the endpoint's request schema (see /tools)")
                .build();
        return queryFailed(qe, exchange);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> rejected(ResponseStatusException e, ServerWebExchange exchange) {
        if (e.getStatusCode().is5xxServerError()) {
            return unexpected(e, exchange);
        }
        ErrorCode code = e.getStatusCode().value() == 404 ? ErrorCode.NOT_FOUND : ErrorCode.VALIDATION_ERROR;
        return queryFailed(QueryException.builder(code, Objects.toString(e.getReason(), e.getStatusCode().toString()))
                .build(), exchange);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> unexpected(Exception e, ServerWebExchange exchange) {
        log.error("[{}] Unhandled error", RequestIdFilter.requestId(exchange), e);
        return queryFailed(QueryException.builder(ErrorCode.EXECUTION_ERROR, "Internal error").cause(e).build(), exchange);
    }
}
