package org.iceforge.terra.gateway.web;

import org.iceforge.terra.gateway.config.TerraProperties;
import org.iceforge.terra.gateway.resilience.CircuitBreaker;
import org.iceforge.terra.gateway.resilience.ResultCache;
import org.iceforge.terra.gateway.service.DatasetCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@RestController
public class OpsController {

    private static final Logger log = LoggerFactory.getLogger(OpsController.class);

    private final DatasetCatalog catalog;
    private final ResultCache<List<Map<String, Object>>> cache;
    private final CircuitBreaker breaker;
    private final TerraProperties props;

    public OpsController(DatasetCatalog catalog, ResultCache<List<Map<String, Object>>> cache,
                         CircuitBreaker breaker, TerraProperties props) {
        this.catalog = Objects.requireNonNull(catalog);
        this.cache = Objects.requireNonNull(cache);
        this.breaker = Objects.requireNonNull(breaker);
        this.props = Objects.requireNonNull(props);
    }

    @GetMapping("/health")
    public Mono<Map<String, Object>> health() {
        return Mono.fromCallable(() -> {
            CircuitBreaker.Snapshot b = breaker.snapshot();
            Map<String, Object> breakerInfo = new LinkedHashMap<>();
            breakerInfo.put("state", b.state());
            breakerInfo.put("failure_count", b.failureCount());

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "ok");
            body.put("version", props.getVersion());
            body.put("datasets", catalog.size());
            body.put("cache", cache.stats());
            body.put("breaker", breakerInfo);
            return body;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/cache/stats")
    public ResultCache.Stats cacheStats() {
        return cache.stats();
    }

    @DeleteMapping("/cache/clear")
    public Map<String, Object> clearCache() {
        int cleared = cache.clear();
        log.info("Result cache cleared ({} entries)", cleared);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "cleared");
        body.put("entries_cleared", cleared);
        return body;
    }
}
