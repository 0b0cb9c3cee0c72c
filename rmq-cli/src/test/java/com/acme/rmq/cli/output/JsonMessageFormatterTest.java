package com.acme.rmq.cli.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JsonMessageFormatterTest {

    private final JsonMessageFormatter formatter = new JsonMessageFormatter();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testFormat_jsonBodyIsEmbedded() throws Exception {
        String json = formatter.format(TestMessages.plain(1, "{\"orderId\": 42}"));

        JsonNode node = mapper.readTree(json);
        assertThat(node.get("deliveryTag").asLong()).isEqualTo(1);
        assertThat(node.get("redelivered").asBoolean()).isFalse();
        assertThat(node.get("body").isObject()).isTrue();
        assertThat(node.get("body").get("orderId").asInt()).isEqualTo(42);
        assertThat(node.has("properties")).isFalse();
    }

    @Test
    void testFormat_textBodyIsString() throws Exception {
        JsonNode node = mapper.readTree(formatter.format(TestMessages.plain(2, "plain text")));

        assertThat(node.get("body").isTextual()).isTrue();
        assertThat(node.get("body").asText()).isEqualTo("plain text");
    }

    @Test
    void testFormat_brokenJsonBodyIsString() throws Exception {
        JsonNode node = mapper.readTree(formatter.format(TestMessages.plain(3, "{not json}")));

        assertThat(node.get("body").asText()).isEqualTo("{not json}");
    }

    @Test
    void testFormat_isSingleLine() {
        String json = formatter.format(TestMessages.plain(4, "[1,\n2]"));

        assertThat(json).doesNotContain("\n");
    }

    @Test
    void testFormat_includesPresentProperties() throws Exception {
        JsonNode node = mapper.readTree(formatter.format(
                TestMessages.withProperties(5, "x", Map.of("tenant", "acme"))));

        JsonNode properties = node.get("properties");
        assertThat(properties.get("messageId").asText()).isEqualTo("m-5");
        assertThat(properties.get("deliveryMode").asInt()).isEqualTo(2);
        assertThat(properties.get("timestamp").asLong()).isEqualTo(1_700_000_000L);
        assertThat(properties.get("headers").get("tenant").asText()).isEqualTo("acme");
        assertThat(properties.has("appId")).isFalse();
    }
}
