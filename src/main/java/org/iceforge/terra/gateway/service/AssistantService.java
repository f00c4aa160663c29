package org.iceforge.terra.gateway.service;

import org.iceforge.terra.gateway.config.TerraProperties;
import org.iceforge.terra.gateway.web.AskResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Question in, tool calls and their results out. Answer wording is left to the caller.
 */
@Service
public class AssistantService {

    private static final Logger log = LoggerFactory.getLogger(AssistantService.class);

    private final ChatCompletionClient chatClient;
    private final ToolCallParser parser;
    private final ToolCallDispatcher dispatcher;
    private final ResourceLoader resourceLoader;
    private final TerraProperties props;

    private volatile String systemPrompt;

    public AssistantService(ChatCompletionClient chatClient, ToolCallParser parser, ToolCallDispatcher dispatcher,
                            ResourceLoader resourceLoader, TerraProperties props) {
        this.chatClient = Objects.requireNonNull(chatClient);
        this.parser = Objects.requireNonNull(parser);
        this.dispatcher = Objects.requireNonNull(dispatcher);
        this.resourceLoader = Objects.requireNonNull(resourceLoader);
        this.props = Objects.requireNonNull(props);
    }

    public Mono<AskResponse> ask(String question, String requestId) {
        return Mono.fromCallable(this::systemPrompt)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(prompt -> chatClient.complete(prompt, question))
                .map(parser::parse)
                .flatMap(calls -> {
                    log.info("Model requested {} tool call(s): {}", calls.size(),
                            calls.stream().map(ToolCall::tool).toList());
                    return Flux.fromIterable(calls)
                            .concatMap(call -> dispatcher.dispatch(call, requestId))
                            .collectList()
                            .map(results -> new AskResponse(calls, results));
                });
    }

    String systemPrompt() {
        String local = systemPrompt;
        if (local != null) return local;

        synchronized (this) {
            if (systemPrompt != null) return systemPrompt;
            String location = props.getLlm().getSystemPrompt();
            try (InputStream in = resourceLoader.getResource(location).getInputStream()) {
                systemPrompt = new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
                return systemPrompt;
            } catch (IOException e) {
                throw new IllegalStateException("Failed to load assistant system prompt: " + location, e);
            }
        }
    }
}
