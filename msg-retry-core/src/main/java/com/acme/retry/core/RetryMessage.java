package com.acme.retry.core;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Broker-neutral view of a message: raw body, content type and application headers. The header
 * map is copied on construction and exposed read-only. The body array is shared, not copied, and
 * must not be modified once the message is built. Equality compares body contents.
 */
public record RetryMessage(byte[] body, String contentType, Map<String, Object> headers) {

  public RetryMessage {
    Objects.requireNonNull(body, "body");
    headers =
        headers == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
  }

  public Object header(String name) {
    return headers.get(name);
  }

  public boolean hasHeader(String name) {
    return headers.containsKey(name);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RetryMessage)) {
      return false;
    }
    RetryMessage other = (RetryMessage) o;
    return Arrays.equals(body, other.body)
        && Objects.equals(contentType, other.contentType)
        && headers.equals(other.headers);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(contentType, headers) + Arrays.hashCode(body);
  }

  @Override
  public String toString() {
    return "RetryMessage[bodyLength="
        + body.length
        + ", contentType="
        + contentType
        + ", headers="
        + headers
        + "]";
  }

  /** Copy of this message with the same body and content type but different headers. */
  public RetryMessage withHeaders(Map<String, Object> newHeaders) {
    return new RetryMessage(body, contentType, newHeaders);
  }
}
