package org.iceforge.terra.gateway.service;

import org.iceforge.terra.gateway.config.TerraProperties;
import org.iceforge.terra.gateway.engine.ErrorCode;
import org.iceforge.terra.gateway.engine.ErrorTranslator;
import org.iceforge.terra.gateway.engine.QueryEngine;
import org.iceforge.terra.gateway.engine.QueryException;
import org.iceforge.terra.gateway.entity.EntityResolver;
import org.iceforge.terra.gateway.entity.GeoLevel;
import org.iceforge.terra.gateway.entity.Resolution;
import org.iceforge.terra.gateway.model.DatasetDescriptor;
import org.iceforge.terra.gateway.resilience.CacheKeys;
import org.iceforge.terra.gateway.resilience.CircuitBreaker;
import org.iceforge.terra.gateway.resilience.ResultCache;
import org.iceforge.terra.gateway.sql.ComplexityGuard;
import org.iceforge.terra.gateway.sql.Condition;
import org.iceforge.terra.gateway.sql.Filter;
import org.iceforge.terra.gateway.sql.FilterParser;
import org.iceforge.terra.gateway.sql.Identifier;
import org.iceforge.terra.gateway.sql.IdentifierValidator;
import org.iceforge.terra.gateway.sql.OrderSpec;
import org.iceforge.terra.gateway.sql.ParsedQuery;
import org.iceforge.terra.gateway.sql.PushdownSqlCompiler;
import org.iceforge.terra.gateway.sql.YoySqlCompiler;
import org.iceforge.terra.gateway.web.BatchQueryRequest;
import org.iceforge.terra.gateway.web.BatchQueryResponse;
import org.iceforge.terra.gateway.web.ErrorResponse;
import org.iceforge.terra.gateway.web.QueryRequest;
import org.iceforge.terra.gateway.web.QueryResponse;
import org.iceforge.terra.gateway.web.ResponseMeta;
import org.iceforge.terra.gateway.web.YoyRequest;
import org.iceforge.terra.gateway.web.YoyResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Validates, compiles and runs query DSL requests against the engine.
 *
 * <p>Requests are prepared on the bounded elastic pool, since place resolution may build the
 * coverage index over JDBC and the manifest may load on first use. The engine call runs behind
 * the circuit breaker and the execution timeout. Successful results are cached by statement
 * text and parameters.
 */
@Service
public class QueryService {

    private static final Logger log = LoggerFactory.getLogger(QueryService.class);

    static final String QUERY_OPERATION = "query";
    static final String YOY_OPERATION = "metrics.yoy";
    static final List<String> DIRECTIONS = List.of("drop", "rise");

    private final DatasetCatalog catalog;
    private final ComplexityGuard guard;
    private final FilterParser filterParser;
    private final EntityResolver resolver;
    private final QueryEngine engine;
    private final ResultCache<List<Map<String, Object>>> cache;
    private final CircuitBreaker breaker;
    private final ErrorTranslator translator;
    private final TerraProperties props;

    public QueryService(DatasetCatalog catalog, ComplexityGuard guard, FilterParser filterParser,
                        EntityResolver resolver, QueryEngine engine, ResultCache<List<Map<String, Object>>> cache,
                        CircuitBreaker breaker, ErrorTranslator translator, TerraProperties props) {
        this.catalog = Objects.requireNonNull(catalog);
        this.guard = Objects.requireNonNull(guard);
        this.filterParser = Objects.requireNonNull(filterParser);
        this.resolver = Objects.requireNonNull(resolver);
        this.engine = Objects.requireNonNull(engine);
        this.cache = Objects.requireNonNull(cache);
        this.breaker = Objects.requireNonNull(breaker);
        this.translator = Objects.requireNonNull(translator);
        this.props = Objects.requireNonNull(props);
    }

    public Mono<QueryResponse> query(QueryRequest req) {
        return Mono.defer(() -> {
            DatasetDescriptor d = describe(req.getFileId());
            TerraProperties.Query limits = props.getQuery();

            ComplexityGuard.Result check = guard.check(req.getSelect(), req.getWhere(), req.getGroupBy(),
                    req.getOrderBy(), req.getAggregations(), req.getHaving());
            if (!check.ok()) {
                throw QueryException.builder(ErrorCode.VALIDATION_ERROR, check.message())
                        .context("violations", check.violations())
                        .context("limits", check.limits())
                        .build();
            }

            int limit = clamp(req.getLimit() == null ? limits.getDefaultLimit() : req.getLimit(), 1, limits.getMaxLimit());
            int offset = req.getOffset() == null ? 0 : req.getOffset();
            if (offset < 0) {
                throw QueryException.validation("offset must be >= 0, got " + offset);
            }

            List<Identifier> select = columns(req.getSelect());
            List<Identifier> groupBy = columns(req.getGroupBy());
            List<Condition> where = resolvePlaces(filterParser.parse(req.getWhere(), "where"));
            List<Condition> having = filterParser.parse(req.getHaving(), "having");
            Map<String, String> aggregations = aggregations(req.getAggregations(), select, groupBy);
            List<OrderSpec> orderBy = OrderSpec.parse(req.getOrderBy());

            ParsedQuery parsed = new ParsedQuery(table(d), select, where, groupBy, aggregations, having,
                    orderBy, limit, offset);
            PushdownSqlCompiler.CompiledQuery compiled = PushdownSqlCompiler.compile(parsed);
            List<String> warnings = temporalWarnings(d, where);

            return run(QUERY_OPERATION, d, compiled)
                    .map(rows -> new QueryResponse(rows, rows.size(), ResponseMeta.of(d, warnings)));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    public Mono<YoyResponse> yoy(YoyRequest req) {
        return Mono.defer(() -> {
            DatasetDescriptor d = describe(req.getFileId());

            String direction = req.getDirection() == null ? "drop" : req.getDirection().toLowerCase(Locale.ROOT);
            if (!DIRECTIONS.contains(direction)) {
                throw QueryException.builder(ErrorCode.VALIDATION_ERROR,
                                "direction must be 'drop' or 'rise', got '" + req.getDirection() + "'")
                        .context("allowed", DIRECTIONS)
                        .build();
            }

            ComplexityGuard.Result check = guard.check(List.of(req.getKeyCol(), req.getValueCol()), req.getWhere(),
                    List.of(), null, null, null);
            if (!check.ok()) {
                throw QueryException.builder(ErrorCode.VALIDATION_ERROR, check.message())
                        .context("violations", check.violations())
                        .context("limits", check.limits())
                        .build();
            }

            int topN = clamp(req.getTopN(), 1, props.getQuery().getMaxLimit());
            List<Condition> where = resolvePlaces(filterParser.parse(req.getWhere(), "where"));
            PushdownSqlCompiler.CompiledQuery compiled = YoySqlCompiler.compile(table(d),
                    Identifier.column(req.getKeyCol()), Identifier.column(req.getValueCol()),
                    req.getBaseYear(), req.getCompareYear(), where, topN, "drop".equals(direction));

            List<String> warnings = new ArrayList<>();
            coverageWarning(d, req.getBaseYear(), warnings);
            coverageWarning(d, req.getCompareYear(), warnings);

            return run(YOY_OPERATION, d, compiled)
                    .map(rows -> new YoyResponse(rows, rows.size(), req.getBaseYear(), req.getCompareYear(),
                            ResponseMeta.of(d, warnings)));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Runs the queries in order. A failing item becomes an error entry; the batch itself only
     * fails on a malformed envelope.
     */
    public Mono<BatchQueryResponse> batch(List<QueryRequest> queries, String requestId) {
        if (queries == null || queries.isEmpty()) {
            return Mono.error(QueryException.validation("queries must not be empty"));
        }
        if (queries.size() > BatchQueryRequest.MAX_QUERIES) {
            return Mono.error(QueryException.builder(ErrorCode.VALIDATION_ERROR,
                            "Too many queries in batch (max " + BatchQueryRequest.MAX_QUERIES + ")")
                    .context("max_queries", BatchQueryRequest.MAX_QUERIES)
                    .build());
        }
        return Flux.fromIterable(queries)
                .concatMap(q -> query(q)
                        .map(BatchQueryResponse.Item::success)
                        .onErrorResume(e -> Mono.just(BatchQueryResponse.Item.failure(
                                ErrorResponse.of(translator.translate(e, null), requestId)))))
                .collectList()
                .map(BatchQueryResponse::new);
    }

    private DatasetDescriptor describe(String fileId) {
        if (fileId == null || fileId.isBlank()) {
            throw QueryException.validation("file_id is required");
        }
        if (!IdentifierValidator.validateFileId(fileId).ok()) {
            throw QueryException.validation("Invalid file_id '" + fileId + "'");
        }
        return catalog.require(fileId);
    }

    private Mono<List<Map<String, Object>>> run(String operation, DatasetDescriptor d,
                                                PushdownSqlCompiler.CompiledQuery compiled) {
        boolean caching = props.getCache().isEnabled();
        Map<String, Object> keyArgs = new LinkedHashMap<>();
        keyArgs.put("file_id", d.getFileId());
        keyArgs.put("sql", compiled.sql());
        keyArgs.put("params", compiled.params());
        String key = CacheKeys.of(operation, keyArgs);

        if (caching) {
            List<Map<String, Object>> hit = cache.get(key);
            if (hit != null) {
                return Mono.just(hit);
            }
        }

        Mono<List<Map<String, Object>>> call = Mono
                .fromCallable(() -> engine.execute(compiled.sql(), compiled.params()))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> translator.translate(e, d));

        return breaker.protect(call, props.getQuery().getExecutionTimeout())
                .onErrorMap(e -> translator.translate(e, d))
                .map(List::copyOf)
                .doOnNext(rows -> {
                    if (caching) {
                        cache.put(key, rows);
                    }
                    log.debug("{} on {} returned {} rows", operation, d.getFileId(), rows.size());
                });
    }

    /**
     * Replaces place names in scalar and {@code in} filters on geographic columns with their
     * stored spelling.
     */
    List<Condition> resolvePlaces(List<Condition> conditions) {
        List<Condition> out = new ArrayList<>(conditions.size());
        for (Condition c : conditions) {
            GeoLevel level = GeoLevel.forColumn(c.column().name());
            if (level == null) {
                out.add(c);
                continue;
            }
            Filter f = c.filter();
            if (f instanceof Filter.Scalar s && s.value() instanceof String name) {
                out.add(new Condition(c.column(), new Filter.Scalar(resolvePlace(c.column(), level, name))));
            } else if (f instanceof Filter.InSet in) {
                List<Object> values = new ArrayList<>(in.values().size());
                for (Object v : in.values()) {
                    values.add(v instanceof String name ? resolvePlace(c.column(), level, name) : v);
                }
                out.add(new Condition(c.column(), new Filter.InSet(values)));
            } else {
                out.add(c);
            }
        }
        return out;
    }

    private String resolvePlace(Identifier column, GeoLevel level, String name) {
        Resolution r = resolver.resolve(name, level);
        if (r.matched()) {
            if (!r.canonicalName().equals(name)) {
                log.debug("Resolved {} '{}' to '{}'", level.key(), name, r.canonicalName());
            }
            return r.canonicalName();
        }
        if (r.suggestions().isEmpty()) {
            return name;
        }
        String described = r.suggestions().stream()
                .map(s -> s.name() + " (" + s.level().key() + ")")
                .collect(Collectors.joining(", "));
        throw QueryException.builder(ErrorCode.NOT_FOUND, "No " + level.key() + " named '" + name + "' in the data")
                .hint("Did you mean: " + described + "?")
                .context("column", column.name())
                .context("value", name)
                .context("level", level.key())
                .suggestions(r.suggestionNames())
                .build();
    }

    private Map<String, String> aggregations(Map<String, String> requested, List<Identifier> select,
                                             List<Identifier> groupBy) {
        if (requested != null && !requested.isEmpty()) {
            return requested;
        }
        Map<String, String> defaults = new LinkedHashMap<>();
        if (!groupBy.isEmpty()) {
            List<String> measures = props.getQuery().getDefaultMeasures();
            for (Identifier s : select) {
                if (measures.contains(s.name()) && !groupBy.contains(s)) {
                    defaults.put(s.name(), "sum");
                }
            }
        }
        return defaults;
    }

    List<String> temporalWarnings(DatasetDescriptor d, List<Condition> where) {
        List<String> warnings = new ArrayList<>();
        for (Condition c : where) {
            if (!c.column().equals(YoySqlCompiler.YEAR)) {
                continue;
            }
            Filter f = c.filter();
            if (f instanceof Filter.Scalar s) {
                coverageWarning(d, year(s.value()), warnings);
            } else if (f instanceof Filter.InSet in) {
                for (Object v : in.values()) {
                    coverageWarning(d, year(v), warnings);
                }
            } else if (f instanceof Filter.Between b) {
                Integer lo = year(b.low());
                Integer hi = year(b.high());
                d.getSemantics().coverageYears().ifPresent(range -> {
                    if (lo != null && hi != null && (lo < range[0] || hi > range[1])) {
                        warnings.add("Year range " + lo + "-" + hi + " extends beyond dataset coverage ("
                                + range[0] + "-" + range[1] + ")");
                    }
                });
            }
        }
        return warnings;
    }

    private static void coverageWarning(DatasetDescriptor d, Integer year, List<String> warnings) {
        if (year == null) {
            return;
        }
        d.getSemantics().coverageYears().ifPresent(range -> {
            if (year < range[0] || year > range[1]) {
                warnings.add("Year " + year + " outside dataset coverage (" + range[0] + "-" + range[1] + ")");
            }
        });
    }

    private static Integer year(Object value) {
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Identifier table(DatasetDescriptor d) {
        String name = d.tableName();
        if (name == null) {
            throw QueryException.builder(ErrorCode.EXECUTION_ERROR,
                            "Dataset '" + d.getFileId() + "' has no table in the manifest")
                    .context("file_id", d.getFileId())
                    .build();
        }
        return Identifier.table(name);
    }

    private static List<Identifier> columns(List<String> names) {
        List<Identifier> out = new ArrayList<>();
        if (names != null) {
            for (String n : names) {
                out.add(Identifier.column(n));
            }
        }
        return out;
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(value, max));
    }
}
