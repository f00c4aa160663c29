package org.iceforge.terra.gateway.sql;

import org.iceforge.terra.gateway.engine.ErrorCode;
import org.iceforge.terra.gateway.engine.QueryException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilterParserTest {

    final FilterParser parser = new FilterParser();

    @Test
    void parsesEveryFilterShape() {
        Map<String, Object> where = new LinkedHashMap<>();
        where.put("country_name", "Germany");
        where.put("year", Map.of("between", List.of(2019, 2021)));
        where.put("month", List.of(1, 2));
        where.put("emissions_tonnes", Map.of("gte", 100));
        where.put("city_name", Map.of("contains", "San"));

        List<Condition> conditions = parser.parse(where, "where");

        assertThat(conditions).extracting(c -> c.column().name())
                .containsExactly("country_name", "year", "month", "emissions_tonnes", "city_name");
        assertThat(conditions.get(0).filter()).isEqualTo(new Filter.Scalar("Germany"));
        assertThat(conditions.get(1).filter()).isEqualTo(new Filter.Between(2019, 2021));
        assertThat(conditions.get(2).filter()).isEqualTo(new Filter.InSet(List.of(1, 2)));
        assertThat(conditions.get(3).filter()).isEqualTo(new Filter.Compare(Filter.Op.GTE, 100));
        assertThat(conditions.get(4).filter()).isEqualTo(new Filter.Contains("San"));
    }

    @Test
    void multipleOperatorsOnOneColumnBecomeSeparateConditions() {
        Map<String, Object> ops = new LinkedHashMap<>();
        ops.put("gt", 10);
        ops.put("lt", 20);

        List<Condition> conditions = parser.parse(Map.of("emissions_tonnes", ops), "having");

        assertThat(conditions).hasSize(2);
        assertThat(conditions.get(1).filter()).isEqualTo(new Filter.Compare(Filter.Op.LT, 20));
    }

    @Test
    void unknownOperatorListsAllowedOnes() {
        assertThatThrownBy(() -> parser.parse(Map.of("year", Map.of("like", "20%")), "where"))
                .isInstanceOfSatisfying(QueryException.class, e -> {
                    assertThat(e.getCode()).isEqualTo(ErrorCode.VALIDATION_ERROR);
                    assertThat(e.getDetail()).contains("like");
                    assertThat(e.getContext()).containsKey("allowed_operators");
                });
    }

    @Test
    void betweenNeedsExactlyTwoBounds() {
        assertThatThrownBy(() -> parser.parse(Map.of("year", Map.of("between", List.of(2019))), "where"))
                .isInstanceOf(QueryException.class)
                .hasMessageContaining("between");
    }

    @Test
    void emptyInListIsRejected() {
        assertThatThrownBy(() -> parser.parse(Map.of("year", Map.of("in", List.of())), "where"))
                .isInstanceOf(QueryException.class)
                .hasMessageContaining("must not be empty");
    }

    @Test
    void emptyBareListIsRejectedLikeEmptyIn() {
        assertThatThrownBy(() -> parser.parse(Map.of("year", List.of()), "where"))
                .isInstanceOfSatisfying(QueryException.class, e -> {
                    assertThat(e.getCode()).isEqualTo(ErrorCode.VALIDATION_ERROR);
                    assertThat(e.getDetail()).contains("must not be empty");
                });
    }

    @Test
    void nestedObjectsAsValuesAreRejected() {
        assertThatThrownBy(() -> parser.parse(Map.of("year", Map.of("gte", Map.of("x", 1))), "where"))
                .isInstanceOf(QueryException.class)
                .hasMessageContaining("expected a string, number or boolean");
    }

    @Test
    void dangerousValueIsRejected() {
        assertThatThrownBy(() -> parser.parse(Map.of("country_name", "x' OR '1'='1"), "where"))
                .isInstanceOf(QueryException.class)
                .hasMessageContaining("dangerous");
    }

    @Test
    void nullFiltersParseToNothing() {
        assertThat(parser.parse(null, "where")).isEmpty();
    }
}
