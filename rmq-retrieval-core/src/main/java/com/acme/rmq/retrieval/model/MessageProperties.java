package com.acme.rmq.retrieval.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * AMQP basic properties of a delivered message. Absent properties are {@code null}; headers are
 * already converted to plain Java values (strings, numbers, booleans, lists and maps) and keep
 * their broker order.
 */
public record MessageProperties(
    String type,
    String messageId,
    String appId,
    String clusterId,
    String contentType,
    String contentEncoding,
    String correlationId,
    Integer deliveryMode,
    String expiration,
    Integer priority,
    String replyTo,
    String userId,
    Long timestamp,
    Map<String, Object> headers) {

  public static final MessageProperties EMPTY =
      new MessageProperties(
          null, null, null, null, null, null, null, null, null, null, null, null, null, null);

  public MessageProperties {
    headers =
        headers == null || headers.isEmpty()
            ? null
            : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
  }

  public boolean hasAnyProperty() {
    return type != null
        || messageId != null
        || appId != null
        || clusterId != null
        || contentType != null
        || contentEncoding != null
        || correlationId != null
        || deliveryMode != null
        || expiration != null
        || priority != null
        || replyTo != null
        || userId != null
        || timestamp != null
        || headers != null;
  }
}
