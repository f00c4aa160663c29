package org.iceforge.terra.gateway.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.terra.gateway.engine.ErrorCode;
import org.iceforge.terra.gateway.engine.ErrorTranslator;
import org.iceforge.terra.gateway.engine.QueryException;
import org.iceforge.terra.gateway.web.AskResponse;
import org.iceforge.terra.gateway.web.ErrorResponse;
import org.iceforge.terra.gateway.web.QueryRequest;
import org.iceforge.terra.gateway.web.YoyRequest;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Objects;

/**
 * Runs parsed tool calls through the same services the HTTP endpoints use.
 */
@Component
public class ToolCallDispatcher {

    static final List<String> TOOLS = List.of("query", "metrics.yoy", "list_files", "get_schema");

    private final QueryService queryService;
    private final DatasetCatalog catalog;
    private final ErrorTranslator translator;
    private final ObjectMapper objectMapper;

    public ToolCallDispatcher(QueryService queryService, DatasetCatalog catalog, ErrorTranslator translator,
                              ObjectMapper objectMapper) {
        this.queryService = Objects.requireNonNull(queryService);
        this.catalog = Objects.requireNonNull(catalog);
        this.translator = Objects.requireNonNull(translator);
        this.objectMapper = Objects.requireNonNull(objectMapper);
    }

    /**
     * Never errors: a failing call is reported as an error result.
     */
    public Mono<AskResponse.ToolResult> dispatch(ToolCall call, String requestId) {
        return Mono.defer(() -> invoke(call))
                .map(data -> AskResponse.ToolResult.success(call.tool(), data))
                .onErrorResume(e -> Mono.just(AskResponse.ToolResult.failure(call.tool(),
                        ErrorResponse.of(translator.translate(e, null), requestId))));
    }

    private Mono<Object> invoke(ToolCall call) {
        switch (call.tool()) {
            case "query":
                return queryService.query(args(call, QueryRequest.class)).cast(Object.class);
            case "metrics.yoy":
            case "yoy":
                return queryService.yoy(args(call, YoyRequest.class)).cast(Object.class);
            case "list_files":
                return Mono.<Object>fromCallable(catalog::all)
                        .subscribeOn(Schedulers.boundedElastic());
            case "get_schema": {
                Object fileId = call.args().get("file_id");
                if (!(fileId instanceof String id) || id.isBlank()) {
                    return Mono.error(QueryException.validation("get_schema requires a string 'file_id'"));
                }
                return Mono.<Object>fromCallable(() -> catalog.require(id))
                        .subscribeOn(Schedulers.boundedElastic());
            }
            default:
                return Mono.error(QueryException.builder(ErrorCode.VALIDATION_ERROR, "Unknown tool '" + call.tool() + "'")
                        .context("allowed_tools", TOOLS)
                        .build());
        }
    }

    private <T> T args(ToolCall call, Class<T> type) {
        try {
            return objectMapper.convertValue(call.args(), type);
        } catch (IllegalArgumentException e) {
            throw QueryException.builder(ErrorCode.VALIDATION_ERROR, "Invalid arguments for tool '" + call.tool() + "'")
                    .hint(e.getMessage())
                    .cause(e)
                    .build();
        }
    }
}
