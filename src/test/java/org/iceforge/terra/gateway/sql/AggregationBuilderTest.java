package org.iceforge.terra.gateway.sql;

import org.iceforge.terra.gateway.engine.QueryException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AggregationBuilderTest {

    @Test
    void groupColumnsComeFirstThenAggregates() {
        Map<String, String> aggs = new LinkedHashMap<>();
        aggs.put("emissions_tonnes", "sum");
        aggs.put("city_name", "distinct");

        AggregationBuilder.Aggregation agg = AggregationBuilder.build(aggs,
                List.of(Identifier.column("year"), Identifier.column("emissions_tonnes")),
                List.of(Identifier.column("country_name")));

        assertThat(agg.selectExpressions()).containsExactly(
                "\"country_name\"",
                "\"year\"",
                "SUM(\"emissions_tonnes\") AS \"emissions_tonnes_sum\"",
                "COUNT(DISTINCT \"city_name\") AS \"city_name_distinct_count\"");
        assertThat(agg.outputColumns()).containsExactly(
                "country_name", "year", "emissions_tonnes_sum", "city_name_distinct_count");
        assertThat(agg.hasAggregates()).isTrue();
    }

    @Test
    void synonymsMapToTheSameFunction() {
        assertThat(AggregateFunction.fromName("mean")).isEqualTo(AggregateFunction.AVG);
        assertThat(AggregateFunction.fromName(" STD ")).isEqualTo(AggregateFunction.STDDEV);
        assertThat(AggregateFunction.STDDEV.render(Identifier.column("x"))).isEqualTo("STDDEV_SAMP(\"x\")");
        assertThat(AggregateFunction.VARIANCE.alias(Identifier.column("x")).name()).isEqualTo("x_variance");
    }

    @Test
    void remapPointsAggregatedColumnsAtTheirAlias() {
        AggregationBuilder.Aggregation agg = AggregationBuilder.build(Map.of("emissions_tonnes", "avg"),
                List.of(), List.of(Identifier.column("country_name")));

        assertThat(agg.remap(Identifier.column("emissions_tonnes")).name()).isEqualTo("emissions_tonnes_avg");
        assertThat(agg.remap(Identifier.column("country_name")).name()).isEqualTo("country_name");
        assertThat(agg.isAlias(Identifier.column("emissions_tonnes_avg"))).isTrue();
    }

    @Test
    void unknownFunctionListsAllowedNames() {
        assertThatThrownBy(() -> AggregationBuilder.build(Map.of("emissions_tonnes", "median"), List.of(), List.of()))
                .isInstanceOfSatisfying(QueryException.class, e -> {
                    assertThat(e.getDetail()).startsWith("Invalid aggregation function: median");
                    assertThat(e.getContext().get("allowed_functions")).isEqualTo(AggregateFunction.allowedNames());
                });
        assertThat(AggregateFunction.allowedNames()).containsExactly(
                "avg", "count", "distinct", "max", "mean", "min", "std", "stddev", "sum", "variance");
    }

    @Test
    void noAggregationsMeansPlainColumns() {
        AggregationBuilder.Aggregation agg = AggregationBuilder.build(null, List.of(Identifier.column("year")), List.of());

        assertThat(agg.hasAggregates()).isFalse();
        assertThat(agg.selectExpressions()).containsExactly("\"year\"");
    }
}
