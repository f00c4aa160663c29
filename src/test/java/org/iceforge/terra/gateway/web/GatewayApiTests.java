package org.iceforge.terra.gateway.web;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.matchesPattern;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class GatewayApiTests {

    @LocalServerPort
    int port;

    WebTestClient client;

    @BeforeEach
    void setup() {
        client = WebTestClient.bindToServer()
                .baseUrl("http://localhost:" + port)
                .responseTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Test
    void aggregatesPerCountry() {
        post("/query", """
                {
                  "file_id": "transport-country-year",
                  "group_by": ["country_name"],
                  "aggregations": {"emissions_tonnes": "sum"},
                  "order_by": "emissions_tonnes DESC"
                }
                """)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.row_count").isEqualTo(4)
                .jsonPath("$.rows[0].country_name").isEqualTo("United States of America")
                .jsonPath("$.rows[0].emissions_tonnes_sum").isEqualTo(1900.0)
                .jsonPath("$.rows[3].country_name").isEqualTo("Republic of Korea")
                .jsonPath("$.meta.units").value(hasItem("tonnes CO2"))
                .jsonPath("$.meta.table_id").isEqualTo("transport-country-year")
                .jsonPath("$.meta.warnings").doesNotExist();
    }

    @Test
    void resolvesPlaceAliasesInFilters() {
        post("/query", """
                {
                  "file_id": "transport-country-year",
                  "select": ["country_name", "year", "emissions_tonnes"],
                  "where": {"country_name": "USA", "year": {"gte": 2020}}
                }
                """)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.row_count").isEqualTo(1)
                .jsonPath("$.rows[0].country_name").isEqualTo("United States of America")
                .jsonPath("$.rows[0].emissions_tonnes").isEqualTo(900.0);
    }

    @Test
    void yearOutsideCoverageIsWarnedNotRejected() {
        post("/query", """
                {"file_id": "synthetic-admin1-year", "where": {"year": 2030}}
                """)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.row_count").isEqualTo(0)
                .jsonPath("$.meta.warnings[0]").isEqualTo("Year 2030 outside dataset coverage (2019-2020)");
    }

    @Test
    void yearOverYearRanksLargestDropFirst() {
        post("/metrics/yoy", """
                {
                  "file_id": "synthetic-admin1-year",
                  "key_col": "entity",
                  "value_col": "emissions_tonnes",
                  "base_year": 2019,
                  "compare_year": 2020,
                  "top_n": 2,
                  "direction": "drop"
                }
                """)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.row_count").isEqualTo(2)
                .jsonPath("$.base_year").isEqualTo(2019)
                .jsonPath("$.compare_year").isEqualTo(2020)
                .jsonPath("$.rows[0].key").isEqualTo("A")
                .jsonPath("$.rows[0].base").isEqualTo(100.0)
                .jsonPath("$.rows[0].compare").isEqualTo(80.0)
                .jsonPath("$.rows[0].delta").isEqualTo(20.0)
                .jsonPath("$.rows[0].pct").value(v -> assertThat(((Number) v).doubleValue()).isCloseTo(20.0, within(1e-6)))
                .jsonPath("$.rows[1].key").isEqualTo("B")
                .jsonPath("$.rows[1].pct").value(v -> assertThat(((Number) v).doubleValue()).isCloseTo(-20.0, within(1e-6)));
    }

    @Test
    void yearOverYearRiseReversesOrder() {
        post("/metrics/yoy", """
                {"file_id": "synthetic-admin1-year", "key_col": "entity", "top_n": 1, "direction": "rise"}
                """)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.row_count").isEqualTo(1)
                .jsonPath("$.rows[0].key").isEqualTo("B");
    }

    @Test
    void misspelledColumnIsNotFoundWithSuggestions() {
        post("/query", """
                {"file_id": "transport-country-year", "select": ["emisions_tonnes"]}
                """)
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("not_found")
                .jsonPath("$.detail").isEqualTo("Column 'emisions_tonnes' not found")
                .jsonPath("$.suggestions").value(hasItem("emissions_tonnes"))
                .jsonPath("$.context.file_id").isEqualTo("transport-country-year");
    }

    @Test
    void misspelledPlaceIsNotFoundWithSuggestions() {
        post("/query", """
                {"file_id": "transport-admin1-year", "where": {"admin1_name": "Calfornia"}}
                """)
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.suggestions[0]").isEqualTo("California")
                .jsonPath("$.context.level").isEqualTo("admin1");
    }

    @Test
    void unknownDatasetSuggestsCloseIds() {
        post("/query", """
                {"file_id": "transport-contry-year"}
                """)
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("not_found")
                .jsonPath("$.suggestions[0]").isEqualTo("transport-country-year");
    }

    @Test
    void missingTableIsNotFound() {
        post("/query", """
                {"file_id": "broken-country-year"}
                """)
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.detail").value(matchesPattern("(?i)Table 'missing_table' not found"));
    }

    @Test
    void invalidRequestsAreValidationErrors() {
        post("/query", """
                {"select": ["country_name"]}
                """)
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("validation_error")
                .jsonPath("$.context.fields.fileId").exists();

        post("/query", """
                {"file_id": "transport-country-year", "aggregations": {"emissions_tonnes": "median"}}
                """)
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.detail").value(matchesPattern("Invalid aggregation function: median.*"))
                .jsonPath("$.context.allowed_functions").value(hasItem("sum"));

        post("/query", """
                {"file_id": "transport-country-year", "where": {"country_name": "x'; DROP TABLE t; --"}}
                """)
                .expectStatus().isBadRequest();

        post("/query", "{not json")
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("validation_error");
    }

    @Test
    void batchReportsEachItem() {
        post("/batch/query", """
                {"queries": [
                  {"file_id": "transport-city-year", "select": ["city_name"], "where": {"city_name": "Paris"}},
                  {"file_id": "no-such-year"}
                ]}
                """)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.results[0].status").isEqualTo("success")
                .jsonPath("$.results[0].data.rows[0].city_name").isEqualTo("Paris")
                .jsonPath("$.results[1].status").isEqualTo("error")
                .jsonPath("$.results[1].error.error").isEqualTo("not_found");
    }

    @Test
    void catalogEndpoints() {
        client.get().uri("/list_files").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$").value(hasSize(5))
                .jsonPath("$[0].file_id").isEqualTo("transport-country-year")
                .jsonPath("$[0].columns[0].name").isEqualTo("country_name");

        client.get().uri("/get_schema/transport_country_year").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.file_id").isEqualTo("transport-country-year")
                .jsonPath("$.semantics.temporal_coverage").isEqualTo("2000-2023");

        client.get().uri("/get_schema/nothing-here").exchange()
                .expectStatus().isNotFound();

        client.get().uri("/tools").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.tools[0].name").isEqualTo("query");
    }

    @Test
    void coverageAndResolve() {
        client.get().uri("/coverage").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.country").value(hasItems("Germany", "United States of America"))
                .jsonPath("$.admin1").value(hasItem("Bavaria"))
                .jsonPath("$.city").value(hasItem("Paris"));

        client.get().uri(b -> b.path("/resolve").queryParam("name", "USA").build()).exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.canonical_name").isEqualTo("United States of America")
                .jsonPath("$.level").isEqualTo("country")
                .jsonPath("$.matched").isEqualTo(true);

        client.get().uri(b -> b.path("/resolve").queryParam("name", "Berlin").queryParam("level", "planet").build())
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void cacheStatsAndClear() {
        String body = """
                {"file_id": "transport-city-year", "select": ["city_name"], "order_by": "city_name", "limit": 2}
                """;
        post("/query", body).expectStatus().isOk();
        post("/query", body).expectStatus().isOk();

        client.get().uri("/cache/stats").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.hits").value(v -> assertThat(((Number) v).longValue()).isPositive())
                .jsonPath("$.capacity").isEqualTo(1000)
                .jsonPath("$.ttl_seconds").isEqualTo(300);

        client.delete().uri("/cache/clear").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("cleared")
                .jsonPath("$.entries_cleared").value(v -> assertThat(((Number) v).intValue()).isPositive());
    }

    @Test
    void healthReportsComponents() {
        client.get().uri("/health").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("ok")
                .jsonPath("$.version").isEqualTo("0.3.0")
                .jsonPath("$.datasets").isEqualTo(5)
                .jsonPath("$.cache.capacity").isEqualTo(1000)
                .jsonPath("$.breaker.state").exists();
    }

    @Test
    void requestIdIsEchoedOrGenerated() {
        client.get().uri("/health").header(RequestIdFilter.HEADER, "abc-123").exchange()
                .expectHeader().valueEquals(RequestIdFilter.HEADER, "abc-123");

        client.get().uri("/health").header(RequestIdFilter.HEADER, "bad id with spaces").exchange()
                .expectHeader().value(RequestIdFilter.HEADER, matchesPattern("[0-9a-f-]{36}"));

        post("/query", """
                {"file_id": "nope-country-year"}
                """)
                .expectHeader().exists(RequestIdFilter.HEADER)
                .expectBody()
                .jsonPath("$.request_id").exists();
    }

    @Test
    void havingFiltersAggregatedGroups() {
        post("/query", """
                {
                  "file_id": "transport-country-year",
                  "group_by": ["country_name"],
                  "aggregations": {"emissions_tonnes": "sum"},
                  "having": {"emissions_tonnes": {"gt": 400}},
                  "order_by": "emissions_tonnes DESC"
                }
                """)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.row_count").isEqualTo(3)
                .jsonPath("$.rows[0].emissions_tonnes_sum").isEqualTo(1900.0)
                .jsonPath("$.rows[2].country_name").isEqualTo("France");
    }

    @Test
    void emptyListFilterIsRejectedInBothSpellings() {
        post("/query", """
                {"file_id": "transport-country-year", "where": {"year": []}}
                """)
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("validation_error");

        post("/query", """
                {"file_id": "transport-country-year", "where": {"year": {"in": []}}}
                """)
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("validation_error");
    }

    @Test
    void containsTreatsWildcardsLiterally() {
        post("/query", """
                {"file_id": "transport-city-year", "select": ["city_name"], "where": {"city_name": {"contains": "_"}}}
                """)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.row_count").isEqualTo(0);

        post("/query", """
                {"file_id": "transport-city-year", "select": ["city_name"], "where": {"city_name": {"contains": "Los"}}}
                """)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.row_count").isEqualTo(2);
    }

    @Test
    void nullYearOverYearColumnsFallBackToDefaults() {
        post("/metrics/yoy", """
                {"file_id": "transport-admin1-year", "key_col": null, "value_col": null, "top_n": 1}
                """)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.rows[0].key").isEqualTo("California")
                .jsonPath("$.rows[0].delta").isEqualTo(100.0);
    }

    private WebTestClient.ResponseSpec post(String path, String json) {
        return client.post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(json)
                .exchange();
    }
}
