package com.acme.retry.rabbitmq;

import com.acme.retry.core.RetryMessage;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.LongString;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Converts between AMQP messages and {@link RetryMessage}. */
public final class Mappers {

  private Mappers() {}

  public static RetryMessage toRetryMessage(AMQP.BasicProperties properties, byte[] body) {
    String contentType = properties != null ? properties.getContentType() : null;
    Map<String, Object> headers =
        properties != null && properties.getHeaders() != null
            ? toHeaders(properties.getHeaders())
            : Map.of();
    return new RetryMessage(body != null ? body : new byte[0], contentType, headers);
  }

  /**
   * The client hands string headers over as {@link LongString}; they are turned into {@link
   * String} here so the rest of the code only deals with plain Java types.
   */
  static Map<String, Object> toHeaders(Map<String, Object> amqpHeaders) {
    Map<String, Object> headers = new LinkedHashMap<>();
    for (Map.Entry<String, Object> e : amqpHeaders.entrySet()) {
      headers.put(e.getKey(), toJavaValue(e.getValue()));
    }
    return headers;
  }

  static Object toJavaValue(Object value) {
    if (value instanceof LongString) {
      return value.toString();
    }
    if (value instanceof List) {
      List<Object> converted = new ArrayList<>();
      for (Object item : (List<?>) value) {
        converted.add(toJavaValue(item));
      }
      return converted;
    }
    if (value instanceof Map) {
      Map<String, Object> converted = new LinkedHashMap<>();
      for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
        converted.put(String.valueOf(e.getKey()), toJavaValue(e.getValue()));
      }
      return converted;
    }
    return value;
  }

  public static AMQP.BasicProperties toProperties(RetryMessage message, String expiration) {
    return new AMQP.BasicProperties.Builder()
        .contentType(message.contentType())
        .headers(new LinkedHashMap<>(message.headers()))
        .expiration(expiration)
        .build();
  }
}
