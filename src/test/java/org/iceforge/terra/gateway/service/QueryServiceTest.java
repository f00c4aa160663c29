package org.iceforge.terra.gateway.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.iceforge.terra.gateway.config.TerraProperties;
import org.iceforge.terra.gateway.engine.ErrorCode;
import org.iceforge.terra.gateway.engine.ErrorTranslator;
import org.iceforge.terra.gateway.engine.QueryEngine;
import org.iceforge.terra.gateway.engine.QueryException;
import org.iceforge.terra.gateway.entity.AliasTable;
import org.iceforge.terra.gateway.entity.CoverageIndex;
import org.iceforge.terra.gateway.entity.EntityResolver;
import org.iceforge.terra.gateway.entity.GeoLevel;
import org.iceforge.terra.gateway.entity.SequenceRatioScorer;
import org.iceforge.terra.gateway.resilience.CircuitBreaker;
import org.iceforge.terra.gateway.resilience.ResultCache;
import org.iceforge.terra.gateway.sql.ComplexityGuard;
import org.iceforge.terra.gateway.sql.FilterParser;
import org.iceforge.terra.gateway.web.BatchQueryResponse;
import org.iceforge.terra.gateway.web.QueryRequest;
import org.iceforge.terra.gateway.web.QueryResponse;
import org.iceforge.terra.gateway.web.YoyRequest;
import org.iceforge.terra.gateway.web.YoyResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.jdbc.BadSqlGrammarException;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryServiceTest {

    StubEngine engine;
    ResultCache<List<Map<String, Object>>> cache;
    CircuitBreaker breaker;
    QueryService service;
    List<String> coverageThreads;

    @BeforeEach
    void setup() {
        TerraProperties props = new TerraProperties();
        props.setManifest("classpath:manifest-test.yml");
        props.setFileIdAliases(Map.of("transport_country_year", "transport-country-year"));

        ObjectMapper yaml = new ObjectMapper(new YAMLFactory())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        SequenceRatioScorer scorer = new SequenceRatioScorer();
        DatasetCatalog catalog = new DatasetCatalog(yaml, new DefaultResourceLoader(), props, scorer);

        CoverageIndex index = CoverageIndex.builder()
                .add(GeoLevel.COUNTRY, "United States of America", "Germany", "France")
                .add(GeoLevel.ADMIN1, "California", "Texas")
                .build();
        AliasTable aliases = new AliasTable(Map.of("country", Map.of("USA", "United States of America")));
        coverageThreads = new CopyOnWriteArrayList<>();
        EntityResolver resolver = new EntityResolver(aliases, () -> {
            coverageThreads.add(Thread.currentThread().getName());
            return index;
        }, scorer, 0.75, 5);

        engine = new StubEngine();
        cache = new ResultCache<>(100, Duration.ofMinutes(5), Clock.systemUTC());
        breaker = new CircuitBreaker(2, Duration.ofSeconds(60), Clock.systemUTC(), e -> !(e instanceof QueryException qe
                && (qe.getCode() == ErrorCode.VALIDATION_ERROR || qe.getCode() == ErrorCode.NOT_FOUND)));

        service = new QueryService(catalog, ComplexityGuard.defaults(), new FilterParser(), resolver, engine,
                cache, breaker, new ErrorTranslator(scorer), props);
    }

    @Test
    void compilesResolvedFiltersIntoParameters() {
        QueryRequest req = request("transport-country-year");
        req.setSelect(List.of("country_name", "emissions_tonnes"));
        req.setWhere(Map.of("country_name", "USA"));

        QueryResponse resp = service.query(req).block();

        assertThat(engine.calls).isEqualTo(1);
        assertThat(engine.lastSql).isEqualTo("SELECT \"country_name\", \"emissions_tonnes\" FROM \"transport_country_year\""
                + " WHERE \"country_name\" = ? LIMIT 20");
        assertThat(engine.lastParams).containsExactly("United States of America");
        assertThat(resp.rowCount()).isEqualTo(1);
        assertThat(resp.meta().tableId()).isEqualTo("transport-country-year");
    }

    @Test
    void placeResolutionRunsOffTheSubscribingThread() {
        QueryRequest req = request("transport-country-year");
        req.setWhere(Map.of("country_name", "Germany"));

        service.query(req).block();

        assertThat(coverageThreads).isNotEmpty()
                .allSatisfy(name -> assertThat(name).startsWith("boundedElastic"));
        assertThat(engine.lastParams).containsExactly("Germany");
    }

    @Test
    void identicalRequestsAreServedFromCache() {
        QueryRequest req = request("transport-country-year");
        req.setWhere(Map.of("year", 2020));

        QueryResponse first = service.query(req).block();
        QueryResponse second = service.query(req).block();

        assertThat(engine.calls).isEqualTo(1);
        assertThat(second.rows()).isEqualTo(first.rows());
        assertThat(cache.stats().hits()).isEqualTo(1);
    }

    @Test
    void legacyFileIdIsAccepted() {
        service.query(request("transport_country_year")).block();

        assertThat(engine.lastSql).contains("FROM \"transport_country_year\"");
    }

    @Test
    void unknownFileIdSuggestsCloseIds() {
        assertThatThrownBy(() -> service.query(request("transport-contry-year")).block())
                .isInstanceOfSatisfying(QueryException.class, e -> {
                    assertThat(e.getCode()).isEqualTo(ErrorCode.NOT_FOUND);
                    assertThat(e.getSuggestions()).first().isEqualTo("transport-country-year");
                });
        assertThat(engine.calls).isZero();
    }

    @Test
    void blankOrUnsafeFileIdIsValidationError() {
        assertThatThrownBy(() -> service.query(request(" ")).block())
                .isInstanceOfSatisfying(QueryException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.VALIDATION_ERROR));
        assertThatThrownBy(() -> service.query(request("../secrets")).block())
                .isInstanceOfSatisfying(QueryException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.VALIDATION_ERROR));
    }

    @Test
    void guardViolationsAreReportedWithLimits() {
        QueryRequest req = request("transport-country-year");
        req.setSelect(List.of("country_name", "drop"));

        assertThatThrownBy(() -> service.query(req).block())
                .isInstanceOfSatisfying(QueryException.class, e -> {
                    assertThat(e.getCode()).isEqualTo(ErrorCode.VALIDATION_ERROR);
                    assertThat(e.getContext()).containsKeys("violations", "limits");
                });
    }

    @Test
    void misspelledPlaceIsNotFoundWithSuggestions() {
        QueryRequest req = request("transport-admin1-year");
        req.setWhere(Map.of("admin1_name", "Calfornia"));

        assertThatThrownBy(() -> service.query(req).block())
                .isInstanceOfSatisfying(QueryException.class, e -> {
                    assertThat(e.getCode()).isEqualTo(ErrorCode.NOT_FOUND);
                    assertThat(e.getDetail()).isEqualTo("No admin1 named 'Calfornia' in the data");
                    assertThat(e.getSuggestions()).containsExactly("California");
                    assertThat(e.getHint()).isEqualTo("Did you mean: California (admin1)?");
                });
        assertThat(breaker.failureCount()).isZero();
    }

    @Test
    void groupByWithoutAggregationsSumsDefaultMeasures() {
        QueryRequest req = request("transport-country-year");
        req.setSelect(List.of("country_name", "emissions_tonnes"));
        req.setGroupBy(List.of("country_name"));

        service.query(req).block();

        assertThat(engine.lastSql).isEqualTo("SELECT \"country_name\", SUM(\"emissions_tonnes\") AS \"emissions_tonnes_sum\""
                + " FROM \"transport_country_year\" GROUP BY \"country_name\" LIMIT 20");
    }

    @Test
    void limitIsClampedAndNegativeOffsetRejected() {
        QueryRequest req = request("transport-country-year");
        req.setLimit(5000);
        service.query(req).block();
        assertThat(engine.lastSql).endsWith("LIMIT 1000");

        req.setLimit(0);
        service.query(req).block();
        assertThat(engine.lastSql).endsWith("LIMIT 1");

        req.setOffset(-1);
        assertThatThrownBy(() -> service.query(req).block()).hasMessageContaining("offset");
    }

    @Test
    void yearOutsideCoverageAddsWarning() {
        QueryRequest req = request("transport-country-year");
        req.setWhere(Map.of("year", Map.of("between", List.of(1990, 2020))));

        QueryResponse resp = service.query(req).block();

        assertThat(resp.meta().warnings()).containsExactly("Year range 1990-2020 extends beyond dataset coverage (2000-2023)");
    }

    @Test
    void missingColumnIsTranslatedAndDoesNotTripBreaker() {
        engine.failure = new BadSqlGrammarException("query", "SELECT",
                new SQLException("Column \"emisions_tonnes\" not found"));
        QueryRequest req = request("transport-country-year");
        req.setSelect(List.of("emisions_tonnes"));

        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> service.query(req).block())
                    .isInstanceOfSatisfying(QueryException.class, e -> {
                        assertThat(e.getCode()).isEqualTo(ErrorCode.NOT_FOUND);
                        assertThat(e.getSuggestions()).contains("emissions_tonnes");
                    });
        }
        assertThat(breaker.state()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(engine.calls).isEqualTo(3);
    }

    @Test
    void engineOutageOpensBreakerAndShortCircuits() {
        engine.failure = new IllegalStateException("connection refused");
        QueryRequest req = request("transport-country-year");

        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> service.query(req).block())
                    .isInstanceOfSatisfying(QueryException.class,
                            e -> assertThat(e.getCode()).isEqualTo(ErrorCode.EXECUTION_ERROR));
        }
        assertThatThrownBy(() -> service.query(req).block())
                .isInstanceOfSatisfying(QueryException.class, e -> {
                    assertThat(e.getCode()).isEqualTo(ErrorCode.UNAVAILABLE);
                    assertThat(e.getRetryAfterSeconds()).isPositive();
                });
        assertThat(engine.calls).isEqualTo(2);
    }

    @Test
    void yoyRejectsUnknownDirection() {
        YoyRequest req = new YoyRequest();
        req.setFileId("transport-admin1-year");
        req.setDirection("sideways");

        assertThatThrownBy(() -> service.yoy(req).block())
                .isInstanceOfSatisfying(QueryException.class,
                        e -> assertThat(e.getContext()).containsEntry("allowed", List.of("drop", "rise")));
    }

    @Test
    void yoyBindsFiltersThenYears() {
        YoyRequest req = new YoyRequest();
        req.setFileId("transport-admin1-year");
        req.setWhere(Map.of("country_name", "USA"));
        req.setTopN(3);

        YoyResponse resp = service.yoy(req).block();

        assertThat(engine.lastParams).containsExactly("United States of America", 2019, 2020, 2019, 2020);
        assertThat(engine.lastSql).endsWith("ORDER BY \"delta\" DESC LIMIT 3");
        assertThat(resp.baseYear()).isEqualTo(2019);
        assertThat(resp.compareYear()).isEqualTo(2020);
    }

    @Test
    void batchKeepsGoingPastFailedItems() {
        BatchQueryResponse resp = service.batch(List.of(request("transport-country-year"), request("nope-country-year"),
                request("transport-admin1-year")), "req-1").block();

        assertThat(resp.results()).extracting(BatchQueryResponse.Item::status)
                .containsExactly("success", "error", "success");
        assertThat(resp.results().get(1).error().getError()).isEqualTo(ErrorCode.NOT_FOUND);
        assertThat(resp.results().get(1).error().getRequestId()).isEqualTo("req-1");
    }

    @Test
    void batchRejectsEmptyAndOversizedInput() {
        List<QueryRequest> many = new ArrayList<>();
        for (int i = 0; i < 21; i++) {
            many.add(request("transport-country-year"));
        }

        assertThatThrownBy(() -> service.batch(List.of(), "r").block()).hasMessageContaining("must not be empty");
        assertThatThrownBy(() -> service.batch(many, "r").block()).hasMessageContaining("max 20");
    }

    private static QueryRequest request(String fileId) {
        QueryRequest req = new QueryRequest();
        req.setFileId(fileId);
        return req;
    }

    static class StubEngine implements QueryEngine {
        int calls;
        String lastSql;
        List<Object> lastParams;
        RuntimeException failure;

        @Override
        public List<Map<String, Object>> execute(String sql, List<Object> params) {
            calls++;
            lastSql = sql;
            lastParams = params;
            if (failure != null) {
                throw failure;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("country_name", "United States of America");
            row.put("emissions_tonnes", 900.0);
            return List.of(row);
        }
    }
}
