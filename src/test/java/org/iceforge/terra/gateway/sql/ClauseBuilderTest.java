package org.iceforge.terra.gateway.sql;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ClauseBuilderTest {

    @Test
    void emptyConditionsRenderNothing() {
        assertThat(ClauseBuilder.where(List.of()).isEmpty()).isTrue();
        assertThat(ClauseBuilder.having(null)).isEqualTo(SqlFragment.EMPTY);
    }

    @Test
    void rendersEachShapeWithOnePlaceholderPerValue() {
        List<Condition> conditions = List.of(
                new Condition(Identifier.column("country_name"), new Filter.Scalar("Germany")),
                new Condition(Identifier.column("month"), new Filter.InSet(List.of(1, 2, 3))),
                new Condition(Identifier.column("year"), new Filter.Between(2019, 2021)),
                new Condition(Identifier.column("emissions_tonnes"), new Filter.Compare(Filter.Op.LT, 5.5)),
                new Condition(Identifier.column("city_name"), new Filter.Contains("San")));

        SqlFragment where = ClauseBuilder.where(conditions);

        assertThat(where.sql()).isEqualTo("WHERE \"country_name\" = ?"
                + " AND \"month\" IN (?, ?, ?)"
                + " AND \"year\" BETWEEN ? AND ?"
                + " AND \"emissions_tonnes\" < ?"
                + " AND CAST(\"city_name\" AS VARCHAR) LIKE ? ESCAPE '\\'");
        assertThat(where.params()).containsExactly("Germany", 1, 2, 3, 2019, 2021, 5.5, "%San%");
        assertThat(where.sql().chars().filter(c -> c == '?').count()).isEqualTo(where.params().size());
    }

    @Test
    void containsEscapesLikeWildcards() {
        SqlFragment where = ClauseBuilder.where(List.of(
                new Condition(Identifier.column("city_name"), new Filter.Contains("50%_off"))));

        assertThat(where.sql()).endsWith("LIKE ? ESCAPE '\\'");
        assertThat(where.params()).containsExactly("%50\\%\\_off%");
    }

    @Test
    void valuesNeverAppearInStatementText() {
        SqlFragment having = ClauseBuilder.having(List.of(
                new Condition(Identifier.column("emissions_tonnes_sum"), new Filter.Compare(Filter.Op.GTE, 1000))));

        assertThat(having.sql()).isEqualTo("HAVING \"emissions_tonnes_sum\" >= ?");
        assertThat(having.sql()).doesNotContain("1000");
    }
}
