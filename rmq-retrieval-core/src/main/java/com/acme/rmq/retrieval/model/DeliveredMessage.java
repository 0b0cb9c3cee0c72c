package com.acme.rmq.retrieval.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A message pushed by the broker to the retrieval consumer. The delivery tag identifies this
 * delivery on its channel, not the message content: a redelivered message gets a new tag.
 */
public record DeliveredMessage(
    String exchange,
    String routingKey,
    String queue,
    long deliveryTag,
    boolean redelivered,
    MessageProperties properties,
    byte[] body) {

  public DeliveredMessage {
    exchange = exchange == null ? "" : exchange;
    routingKey = routingKey == null ? "" : routingKey;
    properties = properties == null ? MessageProperties.EMPTY : properties;
    body = body == null ? new byte[0] : body.clone();
  }

  @Override
  public byte[] body() {
    return body.clone();
  }

  public String bodyAsString() {
    return new String(body, StandardCharsets.UTF_8);
  }

  public int bodySizeBytes() {
    return body.length;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DeliveredMessage other)) {
      return false;
    }
    return deliveryTag == other.deliveryTag
        && redelivered == other.redelivered
        && exchange.equals(other.exchange)
        && routingKey.equals(other.routingKey)
        && Objects.equals(queue, other.queue)
        && properties.equals(other.properties)
        && Arrays.equals(body, other.body);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(exchange, routingKey, queue, deliveryTag, redelivered, properties);
    return 31 * result + Arrays.hashCode(body);
  }

  @Override
  public String toString() {
    return "DeliveredMessage[queue="
        + queue
        + ", deliveryTag="
        + deliveryTag
        + ", exchange="
        + exchange
        + ", routingKey="
        + routingKey
        + ", redelivered="
        + redelivered
        + ", bodySize="
        + body.length
        + "]";
  }
}
