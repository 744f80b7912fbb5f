package com.acme.retry.core;

import java.util.regex.Pattern;

/**
 * Decoded form of the {@code x-retry-count} header. Producers have written the counter as 32-bit
 * integers, 64-bit integers and decimal strings; every accepted encoding is reduced here to one
 * canonical {@code int}. Anything else is {@link Encoding#UNSUPPORTED}. A message without the header
 * is {@link Encoding#ABSENT}.
 */
public record RetryHeaderValue(Encoding encoding, long rawValue) {

  public enum Encoding {
    ABSENT,
    INT32,
    INT64,
    DECIMAL_STRING,
    UNSUPPORTED;

    public boolean isNumeric() {
      return this == INT32 || this == INT64 || this == DECIMAL_STRING;
    }
  }

  private static final RetryHeaderValue ABSENT = new RetryHeaderValue(Encoding.ABSENT, 0);
  private static final RetryHeaderValue UNSUPPORTED = new RetryHeaderValue(Encoding.UNSUPPORTED, 0);

  // ASCII digits only
  private static final Pattern DECIMAL = Pattern.compile("[+-]?[0-9]+");

  public static RetryHeaderValue absent() {
    return ABSENT;
  }

  /** Decodes a header value that is present on the message (possibly {@code null}). */
  public static RetryHeaderValue decode(Object raw) {
    if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
      return new RetryHeaderValue(Encoding.INT32, ((Number) raw).longValue());
    }
    if (raw instanceof Long) {
      return new RetryHeaderValue(Encoding.INT64, (Long) raw);
    }
    if (raw instanceof String) {
      if (!DECIMAL.matcher((String) raw).matches()) {
        return UNSUPPORTED;
      }
      try {
        return new RetryHeaderValue(Encoding.DECIMAL_STRING, Long.parseLong((String) raw));
      } catch (NumberFormatException e) {
        return UNSUPPORTED;
      }
    }
    return UNSUPPORTED;
  }

  public boolean isNumeric() {
    return encoding.isNumeric();
  }

  /**
   * Completed attempts as a non-negative {@code int}: negative values count as zero and values
   * beyond the 32-bit range saturate at {@link Integer#MAX_VALUE}.
   */
  public int completedAttempts() {
    if (!isNumeric() || rawValue < 0) {
      return 0;
    }
    return (int) Math.min(rawValue, Integer.MAX_VALUE);
  }
}
