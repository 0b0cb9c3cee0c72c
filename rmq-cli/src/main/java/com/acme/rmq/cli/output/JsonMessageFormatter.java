package com.acme.rmq.cli.output;

import com.acme.rmq.retrieval.model.DeliveredMessage;
import com.acme.rmq.retrieval.model.MessageProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One compact JSON object per message. A body that is itself a JSON object or array is embedded
 * as JSON; any other body is written as a string.
 */
public class JsonMessageFormatter implements MessageFormatter {
    private final ObjectMapper mapper;

    public JsonMessageFormatter() {
        this(CliJson.mapper());
    }

    JsonMessageFormatter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public String format(DeliveredMessage message) {
        ObjectNode node = mapper.createObjectNode();
        node.put("deliveryTag", message.deliveryTag());
        node.put("redelivered", message.redelivered());
        node.put("exchange", message.exchange());
        node.put("routingKey", message.routingKey());
        node.set("body", bodyNode(message.bodyAsString()));
        ObjectNode properties = propertiesNode(message.properties());
        if (properties != null) {
            node.set("properties", properties);
        }
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to format message #" + message.deliveryTag() + " as JSON", e);
        }
    }

    private JsonNode bodyNode(String body) {
        String trimmed = body.trim();
        boolean looksLikeJson = (trimmed.startsWith("{") && trimmed.endsWith("}"))
                || (trimmed.startsWith("[") && trimmed.endsWith("]"));
        if (looksLikeJson) {
            try {
                return mapper.readTree(trimmed);
            } catch (JsonProcessingException e) {
                // not JSON after all, fall back to text
                return mapper.getNodeFactory().textNode(body);
            }
        }
        return mapper.getNodeFactory().textNode(body);
    }

    private ObjectNode propertiesNode(MessageProperties props) {
        if (!props.hasAnyProperty()) {
            return null;
        }
        ObjectNode node = mapper.createObjectNode();
        putIfPresent(node, "type", props.type());
        putIfPresent(node, "messageId", props.messageId());
        putIfPresent(node, "appId", props.appId());
        putIfPresent(node, "clusterId", props.clusterId());
        putIfPresent(node, "contentType", props.contentType());
        putIfPresent(node, "contentEncoding", props.contentEncoding());
        putIfPresent(node, "correlationId", props.correlationId());
        putIfPresent(node, "deliveryMode", props.deliveryMode());
        putIfPresent(node, "expiration", props.expiration());
        putIfPresent(node, "priority", props.priority());
        putIfPresent(node, "replyTo", props.replyTo());
        putIfPresent(node, "userId", props.userId());
        putIfPresent(node, "timestamp", props.timestamp());
        if (props.headers() != null) {
            node.set("headers", mapper.valueToTree(props.headers()));
        }
        return node;
    }

    private void putIfPresent(ObjectNode node, String name, Object value) {
        if (value != null) {
            node.set(name, mapper.valueToTree(value));
        }
    }
}
