package com.helix.guardrails.parser;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JSON Response Parser Tests")
class JsonResponseParserTest {

    private final JsonResponseParser parser = new JsonResponseParser(new ObjectMapper());

    @Test
    @DisplayName("Plain JSON object parses directly")
    void parse_PlainJson_ShouldReturnMap() {
        Map<String, Object> result = parser.parse("{\"alignment_score\": 0.8, \"violations\": []}");

        assertThat(result).containsEntry("alignment_score", 0.8);
        assertThat(result.get("violations")).isEqualTo(List.of());
        assertThat(JsonResponseParser.isError(result)).isFalse();
    }

    @Test
    @DisplayName("Markdown fences are stripped")
    void parse_FencedJson_ShouldStripFences() {
        String text = "```json\n{\"summary\": \"ok\"}\n```";

        assertThat(parser.parse(text)).containsEntry("summary", "ok");
    }

    @Test
    @DisplayName("JSON embedded in prose is found by brace matching")
    void parse_JsonInProse_ShouldExtractFirstBlock() {
        String text = "Sure! Here is the analysis:\n{\"risks\": [{\"severity\": \"high\"}]}\nLet me know if you need more.";

        Map<String, Object> result = parser.parse(text);

        assertThat(result).containsKey("risks");
        assertThat(JsonResponseParser.isError(result)).isFalse();
    }

    @Test
    @DisplayName("A leading JSON object followed by prose parses to that object")
    void parse_JsonThenTrailingProse_ShouldReturnObject() {
        Map<String, Object> result = parser.parse("{\"k\":1} trailing prose");

        assertThat(result).containsExactly(Map.entry("k", 1));
        assertThat(JsonResponseParser.isError(result)).isFalse();
    }

    @Test
    @DisplayName("Unparseable text yields the error map with a raw excerpt")
    void parse_Garbage_ShouldReturnErrorMap() {
        String text = "I cannot answer that. ".repeat(50);

        Map<String, Object> result = parser.parse(text);

        assertThat(JsonResponseParser.isError(result)).isTrue();
        assertThat(result).containsEntry(JsonResponseParser.ERROR_KEY, "Failed to parse response");
        assertThat((String) result.get(JsonResponseParser.RAW_KEY)).hasSize(500);
    }

    @Test
    @DisplayName("A JSON array is not an object and counts as a failure")
    void tryParse_Array_ShouldBeEmpty() {
        assertThat(parser.tryParse("[1, 2, 3]")).isEmpty();
    }

    @Test
    @DisplayName("Null and blank input never throw")
    void tryParse_NullOrBlank_ShouldBeEmpty() {
        assertThat(parser.tryParse(null)).isEmpty();
        assertThat(parser.tryParse("   ")).isEmpty();
        assertThat(JsonResponseParser.isError(parser.parse(null))).isTrue();
    }

    @Test
    @DisplayName("Unbalanced braces fail gracefully")
    void tryParse_Unbalanced_ShouldBeEmpty() {
        assertThat(parser.tryParse("result: {\"a\": {\"b\": 1}")).isEmpty();
    }

    @Test
    @DisplayName("Brace block matching honours nesting")
    void firstBraceBlock_Nested_ShouldMatchOuterBraces() {
        assertThat(JsonResponseParser.firstBraceBlock("x {\"a\": {\"b\": 1}} y {\"c\": 2}"))
                .isEqualTo("{\"a\": {\"b\": 1}}");
        assertThat(JsonResponseParser.firstBraceBlock("no braces here")).isNull();
    }
}
