package org.iceforge.terra.gateway.web;

import com.fasterxml.jackson.databind.JsonNode;
import org.iceforge.terra.gateway.engine.ErrorCode;
import org.iceforge.terra.gateway.engine.QueryException;
import org.iceforge.terra.gateway.entity.EntityResolver;
import org.iceforge.terra.gateway.entity.GeoLevel;
import org.iceforge.terra.gateway.entity.Resolution;
import org.iceforge.terra.gateway.model.DatasetDescriptor;
import org.iceforge.terra.gateway.service.CoverageIndexProvider;
import org.iceforge.terra.gateway.service.DatasetCatalog;
import org.iceforge.terra.gateway.service.ToolSchemas;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only metadata: datasets, tool schemas, place-name coverage and resolution.
 */
@RestController
public class CatalogController {

    private final DatasetCatalog catalog;
    private final ToolSchemas toolSchemas;
    private final CoverageIndexProvider coverage;
    private final EntityResolver resolver;

    public CatalogController(DatasetCatalog catalog, ToolSchemas toolSchemas, CoverageIndexProvider coverage,
                             EntityResolver resolver) {
        this.catalog = Objects.requireNonNull(catalog);
        this.toolSchemas = Objects.requireNonNull(toolSchemas);
        this.coverage = Objects.requireNonNull(coverage);
        this.resolver = Objects.requireNonNull(resolver);
    }

    @GetMapping("/list_files")
    public Mono<List<DatasetDescriptor>> listFiles() {
        return Mono.fromCallable(catalog::all)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/get_schema/{fileId}")
    public Mono<DatasetDescriptor> getSchema(@PathVariable String fileId) {
        return Mono.fromCallable(() -> catalog.require(fileId))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/tools")
    public Mono<JsonNode> tools() {
        return Mono.fromCallable(toolSchemas::load)
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Builds the index on first call, which queries every dataset.
     */
    @GetMapping("/coverage")
    public Mono<Map<String, List<String>>> coverage() {
        return Mono.fromCallable(() -> coverage.coverage().asMap())
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/resolve")
    public Mono<Resolution> resolve(@RequestParam String name, @RequestParam(required = false) String level) {
        return Mono.fromCallable(() -> resolver.resolve(name, level(level)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private static GeoLevel level(String level) {
        if (level == null || level.isBlank()) {
            return null;
        }
        GeoLevel parsed = GeoLevel.fromKey(level);
        if (parsed == null) {
            throw QueryException.builder(ErrorCode.VALIDATION_ERROR, "Unknown level '" + level + "'")
                    .context("allowed", List.of("country", "admin1", "city"))
                    .build();
        }
        return parsed;
    }
}
