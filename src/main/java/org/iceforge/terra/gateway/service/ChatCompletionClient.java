package org.iceforge.terra.gateway.service;

import com.fasterxml.jackson.databind.JsonNode;
import org.iceforge.terra.gateway.config.TerraProperties;
import org.iceforge.terra.gateway.engine.ErrorCode;
import org.iceforge.terra.gateway.engine.QueryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Blocking client for an OpenAI-compatible chat completion endpoint. Concurrent calls are
 * capped by a semaphore; a caller that cannot get a permit in time gets {@code unavailable}.
 */
@Component
public class ChatCompletionClient {

    private static final Logger log = LoggerFactory.getLogger(ChatCompletionClient.class);

    private final WebClient webClient;
    private final TerraProperties props;
    private final Semaphore permits;

    public ChatCompletionClient(WebClient llmWebClient, TerraProperties props) {
        this.webClient = Objects.requireNonNull(llmWebClient);
        this.props = Objects.requireNonNull(props);
        this.permits = new Semaphore(props.getLlm().getMaxConcurrentCalls(), true);
    }

    /**
     * Sends the system prompt and user message and returns the first choice's message content.
     */
    public Mono<String> complete(String systemPrompt, String userMessage) {
        return Mono.fromCallable(() -> completeBlocking(systemPrompt, userMessage))
                .subscribeOn(Schedulers.boundedElastic());
    }

    String completeBlocking(String systemPrompt, String userMessage) throws InterruptedException {
        TerraProperties.Llm llm = props.getLlm();
        if (!permits.tryAcquire(llm.getAcquireTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
            throw QueryException.builder(ErrorCode.UNAVAILABLE, "Too many concurrent assistant calls")
                    .retryAfterSeconds(Math.max(1, llm.getAcquireTimeout().toSeconds()))
                    .context("max_concurrent_calls", llm.getMaxConcurrentCalls())
                    .build();
        }
        try {
            JsonNode response = webClient.post()
                    .uri(llm.getCompletionsPath())
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(BodyInserters.fromValue(payload(llm, systemPrompt, userMessage)))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(llm.getRequestTimeout())
                    .block();
            JsonNode content = response == null ? null : response.path("choices").path(0).path("message").path("content");
            if (content == null || !content.isTextual()) {
                throw QueryException.builder(ErrorCode.EXECUTION_ERROR, "Chat completion response had no message content")
                        .build();
            }
            return content.asText();
        } catch (QueryException e) {
            throw e;
        } catch (RuntimeException e) {
            throw translate(Exceptions.unwrap(e), llm);
        } finally {
            permits.release();
        }
    }

    private static Map<String, Object> payload(TerraProperties.Llm llm, String systemPrompt, String userMessage) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", llm.getModel());
        body.put("messages", List.of(
                Map.of("role", "system", "content", systemPrompt),
                Map.of("role", "user", "content", userMessage)));
        body.put("temperature", llm.getTemperature());
        return body;
    }

    private static QueryException translate(Throwable t, TerraProperties.Llm llm) {
        if (t instanceof TimeoutException) {
            return QueryException.builder(ErrorCode.TIMEOUT,
                            "Chat completion did not answer within " + llm.getRequestTimeout().toSeconds() + "s")
                    .cause(t)
                    .build();
        }
        if (t instanceof WebClientResponseException w) {
            log.error("Chat completion API returned {}", w.getStatusCode().value());
            return QueryException.builder(ErrorCode.UNAVAILABLE, "Chat completion API returned HTTP " + w.getStatusCode().value())
                    .retryAfterSeconds(5)
                    .cause(t)
                    .build();
        }
        if (t instanceof WebClientRequestException) {
            log.error("Chat completion API unreachable: {}", t.getMessage());
            return QueryException.builder(ErrorCode.UNAVAILABLE, "Chat completion API is unreachable")
                    .retryAfterSeconds(5)
                    .cause(t)
                    .build();
        }
        log.error("Chat completion call failed", t);
        return QueryException.builder(ErrorCode.EXECUTION_ERROR, "Chat completion call failed")
                .cause(t)
                .build();
    }

    int availablePermits() {
        return permits.availablePermits();
    }
}
