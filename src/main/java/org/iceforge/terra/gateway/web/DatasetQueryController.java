package org.iceforge.terra.gateway.web;

import jakarta.validation.Valid;
import org.iceforge.terra.gateway.service.QueryService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.Objects;

@RestController
public class DatasetQueryController {

    private final QueryService service;

    public DatasetQueryController(QueryService service) {
        this.service = Objects.requireNonNull(service);
    }

    /**
     * Validates the DSL request, pushes it down as one parameterized statement and returns the rows.
     */
    @PostMapping("/query")
    public Mono<QueryResponse> query(@Valid @RequestBody QueryRequest req) {
        return service.query(req);
    }

    @PostMapping("/metrics/yoy")
    public Mono<YoyResponse> yoy(@Valid @RequestBody YoyRequest req) {
        return service.yoy(req);
    }

    @PostMapping("/batch/query")
    public Mono<BatchQueryResponse> batch(@Valid @RequestBody BatchQueryRequest req, ServerWebExchange exchange) {
        return service.batch(req.getQueries(), RequestIdFilter.requestId(exchange));
    }
}
