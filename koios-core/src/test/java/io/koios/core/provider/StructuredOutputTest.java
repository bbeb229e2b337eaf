package io.koios.core.provider;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

class StructuredOutputTest {

    @Test
    void shouldParsePlainObject() {
        ObjectNode node = StructuredOutput.parse("{\"choice\": \"generate\"}");

        assertThat(node.path("choice").asText()).isEqualTo("generate");
        assertThat(StructuredOutput.isError(node)).isFalse();
    }

    @Test
    void shouldStripFencesAndSurroundingProse() {
        ObjectNode fenced = StructuredOutput.parse("```json\n{\"query\": \"weather in Oslo\"}\n```");
        ObjectNode chatty = StructuredOutput.parse("Sure! Here it is: {\"choice\": \"web_search\"} Hope that helps.");

        assertThat(fenced.path("query").asText()).isEqualTo("weather in Oslo");
        assertThat(chatty.path("choice").asText()).isEqualTo("web_search");
    }

    @Test
    void shouldReturnErrorPayloadForMalformedOutput() {
        ObjectNode missing = StructuredOutput.parse("I think you should search the web.");
        ObjectNode broken = StructuredOutput.parse("{\"choice\": }");
        ObjectNode array = StructuredOutput.parse("[1, 2]");

        assertThat(StructuredOutput.isError(missing)).isTrue();
        assertThat(missing.path("raw").asText()).isEqualTo("I think you should search the web.");
        assertThat(StructuredOutput.isError(broken)).isTrue();
        assertThat(StructuredOutput.isError(array)).isTrue();
        assertThat(StructuredOutput.isError(StructuredOutput.parse(null))).isTrue();
    }

    @Test
    void shouldReportParserMessageForBrokenJson() {
        ObjectNode broken = StructuredOutput.parse("Sure: {\"route\": \"web_search\",}");

        assertThat(broken.path("error").asText()).startsWith("invalid JSON: ");
        assertThat(broken.path("raw").asText()).isEqualTo("Sure: {\"route\": \"web_search\",}");
    }
}
