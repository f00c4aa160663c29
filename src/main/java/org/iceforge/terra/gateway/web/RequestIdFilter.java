package org.iceforge.terra.gateway.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Assigns each request an id (or keeps a well-formed incoming {@code X-Request-Id}), echoes it
 * in the response and logs request start and end.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter implements WebFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestIdFilter.class);

    public static final String HEADER = "X-Request-Id";
    public static final String ATTRIBUTE = RequestIdFilter.class.getName() + ".requestId";

    private static final Pattern ACCEPTED_ID = Pattern.compile("^[A-Za-z0-9._-]{1,128}$");

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String incoming = exchange.getRequest().getHeaders().getFirst(HEADER);
        String requestId = incoming != null && ACCEPTED_ID.matcher(incoming).matches()
                ? incoming : UUID.randomUUID().toString();
        exchange.getAttributes().put(ATTRIBUTE, requestId);
        exchange.getResponse().getHeaders().set(HEADER, requestId);

        String method = exchange.getRequest().getMethod().name();
        String path = exchange.getRequest().getPath().value();
        long start = System.nanoTime();
        log.info("[{}] {} {} started", requestId, method, path);
        return chain.filter(exchange)
                .doFinally(signal -> log.info("[{}] {} {} completed with {} in {} ms", requestId, method, path,
                        exchange.getResponse().getStatusCode(), (System.nanoTime() - start) / 1_000_000));
    }

    public static String requestId(ServerWebExchange exchange) {
        return exchange.getAttribute(ATTRIBUTE);
    }
}
