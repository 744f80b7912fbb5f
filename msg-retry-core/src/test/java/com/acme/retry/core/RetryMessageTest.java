package com.acme.retry.core;

import static org.assertj.core.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RetryMessageTest {

  private static byte[] bytes(String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }

  @Test
  @DisplayName("messages with equal body contents are equal")
  void testEqualityByBodyContents() {
    RetryMessage first = new RetryMessage(bytes("hello"), "text/plain", Map.of("k", 1));
    RetryMessage second = new RetryMessage(bytes("hello"), "text/plain", Map.of("k", 1));

    assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
    assertThat(first).isNotEqualTo(new RetryMessage(bytes("other"), "text/plain", Map.of("k", 1)));
    assertThat(first).isNotEqualTo(new RetryMessage(bytes("hello"), null, Map.of("k", 1)));
  }

  @Test
  @DisplayName("headers are copied on construction and read-only")
  void testHeadersCopied() {
    Map<String, Object> headers = new HashMap<>();
    headers.put(RetryHeaders.RETRY_COUNT, 1);
    RetryMessage message = new RetryMessage(bytes("x"), null, headers);

    headers.put(RetryHeaders.RETRY_COUNT, 9);

    assertThat(message.header(RetryHeaders.RETRY_COUNT)).isEqualTo(1);
    assertThatThrownBy(() -> message.headers().put("other", 2))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  @DisplayName("withHeaders keeps the body and content type")
  void testWithHeaders() {
    byte[] body = bytes("payload");
    RetryMessage message = new RetryMessage(body, "application/json", Map.of());

    RetryMessage copy = message.withHeaders(Map.of(RetryHeaders.RETRY_COUNT, 2));

    assertThat(copy.body()).isSameAs(body);
    assertThat(copy.contentType()).isEqualTo("application/json");
    assertThat(copy.header(RetryHeaders.RETRY_COUNT)).isEqualTo(2);
    assertThat(message.hasHeader(RetryHeaders.RETRY_COUNT)).isFalse();
  }

  @Test
  @DisplayName("toString reports the body length rather than its bytes")
  void testToString() {
    RetryMessage message = new RetryMessage(bytes("abc"), "text/plain", Map.of());

    assertThat(message.toString()).contains("bodyLength=3").contains("text/plain");
  }
}
