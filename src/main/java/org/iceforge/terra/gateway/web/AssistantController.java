package org.iceforge.terra.gateway.web;

import jakarta.validation.Valid;
import org.iceforge.terra.gateway.service.AssistantService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.Objects;

@RestController
public class AssistantController {

    private final AssistantService assistant;

    public AssistantController(AssistantService assistant) {
        this.assistant = Objects.requireNonNull(assistant);
    }

    /**
     * Asks the model for tool calls, runs them, and returns both.
     */
    @PostMapping("/ask")
    public Mono<AskResponse> ask(@Valid @RequestBody AskRequest req, ServerWebExchange exchange) {
        return assistant.ask(req.getQuestion(), RequestIdFilter.requestId(exchange));
    }
}
