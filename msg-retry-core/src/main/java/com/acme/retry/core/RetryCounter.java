package com.acme.retry.core;

/**
 * Reads the attempt number a message is about to be retried under. The first retry of a message
 * that never went through the retry queue is attempt 1.
 *
 * <p>Malformed headers are not an error: they degrade to attempt 1 so that a bad producer cannot
 * block redelivery.
 */
public final class RetryCounter {

  public static final int FIRST_ATTEMPT = 1;

  private RetryCounter() {}

  public static int getRetryCount(RetryMessage message) {
    RetryHeaderValue value =
        message.hasHeader(RetryHeaders.RETRY_COUNT)
            ? RetryHeaderValue.decode(message.header(RetryHeaders.RETRY_COUNT))
            : RetryHeaderValue.absent();
    return nextAttempt(value);
  }

  static int nextAttempt(RetryHeaderValue value) {
    if (!value.isNumeric()) {
      return FIRST_ATTEMPT;
    }
    int completed = value.completedAttempts();
    // saturate instead of overflowing on increment
    if (completed == Integer.MAX_VALUE) {
      return completed;
    }
    return completed + 1;
  }
}
