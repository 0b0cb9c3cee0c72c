package com.acme.rmq.cli.output;

import com.acme.rmq.retrieval.model.DeliveredMessage;
import com.acme.rmq.retrieval.model.MessageProperties;

import java.util.List;
import java.util.Map;

/**
 * Human readable {@code Key: value} block. Properties are listed only when set; the body follows
 * the {@code Body:} line verbatim.
 */
public class PlainMessageFormatter implements MessageFormatter {

    @Override
    public String format(DeliveredMessage message) {
        StringBuilder sb = new StringBuilder();
        sb.append("DeliveryTag: ").append(message.deliveryTag()).append('\n');
        sb.append("Redelivered: ").append(message.redelivered()).append('\n');
        if (!message.exchange().isEmpty()) {
            sb.append("Exchange: ").append(message.exchange()).append('\n');
        }
        if (!message.routingKey().isEmpty()) {
            sb.append("RoutingKey: ").append(message.routingKey()).append('\n');
        }
        appendProperties(sb, message.properties());
        sb.append("Body:\n").append(message.bodyAsString());
        return sb.toString();
    }

    private static void appendProperties(StringBuilder sb, MessageProperties props) {
        if (!props.hasAnyProperty()) {
            return;
        }
        appendIfPresent(sb, "Type", props.type());
        appendIfPresent(sb, "MessageId", props.messageId());
        appendIfPresent(sb, "AppId", props.appId());
        appendIfPresent(sb, "ClusterId", props.clusterId());
        appendIfPresent(sb, "ContentType", props.contentType());
        appendIfPresent(sb, "ContentEncoding", props.contentEncoding());
        appendIfPresent(sb, "CorrelationId", props.correlationId());
        appendIfPresent(sb, "DeliveryMode", props.deliveryMode());
        appendIfPresent(sb, "Expiration", props.expiration());
        appendIfPresent(sb, "Priority", props.priority());
        appendIfPresent(sb, "ReplyTo", props.replyTo());
        appendIfPresent(sb, "UserId", props.userId());
        appendIfPresent(sb, "Timestamp", props.timestamp());
        if (props.headers() != null) {
            sb.append("Headers:\n");
            props.headers().forEach((key, value) -> appendEntry(sb, key, value, 1));
        }
    }

    private static void appendIfPresent(StringBuilder sb, String name, Object value) {
        if (value != null) {
            sb.append(name).append(": ").append(value).append('\n');
        }
    }

    private static void appendEntry(StringBuilder sb, String key, Object value, int level) {
        String indent = "  ".repeat(level);
        if (value instanceof Map<?, ?> map) {
            sb.append(indent).append(key).append(":\n");
            map.forEach((k, v) -> appendEntry(sb, String.valueOf(k), v, level + 1));
        } else if (value instanceof List<?> list) {
            sb.append(indent).append(key).append(":\n");
            for (Object item : list) {
                sb.append(indent).append("  - ").append(formatScalar(item)).append('\n');
            }
        } else {
            sb.append(indent).append(key).append(": ").append(formatScalar(value)).append('\n');
        }
    }

    private static String formatScalar(Object value) {
        if (value instanceof String text && text.startsWith("<binary data: ")) {
            return text.replace("<binary data: ", "byte[").replace(" bytes>", "]");
        }
        return String.valueOf(value);
    }
}
