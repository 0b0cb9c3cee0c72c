package com.acme.rmq.retrieval.broker;

import com.acme.rmq.retrieval.model.MessageProperties;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.LongString;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Converts AMQP basic properties into {@link MessageProperties} with plain Java header values. */
public final class MessagePropertyExtractor {

  private MessagePropertyExtractor() {}

  public static MessageProperties extract(AMQP.BasicProperties props) {
    if (props == null) {
      return MessageProperties.EMPTY;
    }
    return new MessageProperties(
        props.getType(),
        props.getMessageId(),
        props.getAppId(),
        props.getClusterId(),
        props.getContentType(),
        props.getContentEncoding(),
        props.getCorrelationId(),
        props.getDeliveryMode(),
        props.getExpiration(),
        props.getPriority(),
        props.getReplyTo(),
        props.getUserId(),
        props.getTimestamp() != null ? toEpochSeconds(props.getTimestamp()) : null,
        convertHeaders(props.getHeaders()));
  }

  static Map<String, Object> convertHeaders(Map<String, Object> headers) {
    if (headers == null || headers.isEmpty()) {
      return null;
    }
    Map<String, Object> converted = new LinkedHashMap<>();
    headers.forEach(
        (key, value) -> {
          if (value != null) {
            converted.put(key, convertValue(value));
          }
        });
    return converted.isEmpty() ? null : converted;
  }

  @SuppressWarnings("unchecked")
  static Object convertValue(Object value) {
    if (value == null) {
      return "null";
    }
    if (value instanceof LongString longString) {
      return convertBytes(longString.getBytes());
    }
    if (value instanceof byte[] bytes) {
      return convertBytes(bytes);
    }
    if (value instanceof Date date) {
      return toEpochSeconds(date);
    }
    if (value instanceof List<?> list) {
      List<Object> items = new ArrayList<>(list.size());
      for (Object item : list) {
        items.add(convertValue(item));
      }
      return items;
    }
    if (value instanceof Object[] array) {
      return convertValue(Arrays.asList(array));
    }
    if (value instanceof Map<?, ?> map) {
      Map<String, Object> nested = new LinkedHashMap<>();
      ((Map<Object, Object>) map)
          .forEach((k, v) -> nested.put(String.valueOf(k), convertValue(v)));
      return nested;
    }
    return value;
  }

  private static Object convertBytes(byte[] bytes) {
    String text;
    try {
      text =
          StandardCharsets.UTF_8
              .newDecoder()
              .onMalformedInput(CodingErrorAction.REPORT)
              .onUnmappableCharacter(CodingErrorAction.REPORT)
              .decode(ByteBuffer.wrap(bytes))
              .toString();
    } catch (CharacterCodingException e) {
      return binaryDescription(bytes.length);
    }
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (Character.isISOControl(c) && c != '\r' && c != '\n' && c != '\t') {
        return binaryDescription(bytes.length);
      }
    }
    return text;
  }

  private static String binaryDescription(int length) {
    return "<binary data: " + length + " bytes>";
  }

  private static long toEpochSeconds(Date date) {
    return date.getTime() / 1000L;
  }
}
