package org.iceforge.terra.gateway.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.terra.gateway.engine.ErrorCode;
import org.iceforge.terra.gateway.engine.QueryException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolCallParserTest {

    final ToolCallParser parser = new ToolCallParser(new ObjectMapper());

    @Test
    void parsesBareObject() {
        List<ToolCall> calls = parser.parse("{\"tool\":\"query\",\"args\":{\"file_id\":\"transport-country-year\",\"limit\":5}}");

        assertThat(calls).hasSize(1);
        assertThat(calls.get(0).tool()).isEqualTo("query");
        assertThat(calls.get(0).args()).containsEntry("file_id", "transport-country-year").containsEntry("limit", 5);
    }

    @Test
    void parsesFencedArray() {
        String text = """
                Sure, here you go:
                ```json
                [{"tool": "list_files"}, {"tool": "get_schema", "args": {"file_id": "transport-city-year"}}]
                ```
                """;

        List<ToolCall> calls = parser.parse(text);

        assertThat(calls).extracting(ToolCall::tool).containsExactly("list_files", "get_schema");
        assertThat(calls.get(0).args()).isEmpty();
    }

    @Test
    void extractsObjectFromSurroundingProse() {
        List<ToolCall> calls = parser.parse("I will call {\"tool\":\"metrics.yoy\",\"args\":{\"base_year\":2019}} now.");

        assertThat(calls.get(0).tool()).isEqualTo("metrics.yoy");
        assertThat(calls.get(0).args()).isEqualTo(Map.of("base_year", 2019));
    }

    @Test
    void rejectsNonJsonWithRawContext() {
        assertThatThrownBy(() -> parser.parse("I don't know."))
                .isInstanceOfSatisfying(QueryException.class, e -> {
                    assertThat(e.getCode()).isEqualTo(ErrorCode.VALIDATION_ERROR);
                    assertThat(e.getContext()).containsEntry("raw", "I don't know.");
                    assertThat(e.getHint()).contains("\"tool\"");
                });
    }

    @Test
    void rejectsMissingToolOrNonObjectArgs() {
        assertThatThrownBy(() -> parser.parse("{\"args\":{}}"))
                .hasMessageContaining("'tool' field");
        assertThatThrownBy(() -> parser.parse("{\"tool\":\"query\",\"args\":[1,2]}"))
                .hasMessageContaining("'args' must be an object");
        assertThatThrownBy(() -> parser.parse("[]"))
                .isInstanceOf(QueryException.class);
        assertThatThrownBy(() -> parser.parse("   "))
                .hasMessage("Model returned an empty response");
    }

    @Test
    void longRawTextIsTruncatedInError() {
        String noise = "x".repeat(3000);

        assertThatThrownBy(() -> parser.parse(noise))
                .isInstanceOfSatisfying(QueryException.class,
                        e -> assertThat((String) e.getContext().get("raw")).hasSize(2003));
    }
}
