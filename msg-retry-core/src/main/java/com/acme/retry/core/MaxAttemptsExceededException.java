package com.acme.retry.core;

/**
 * Raised instead of republishing once a message has used up its attempts. The caller decides what
 * happens to the message next (ack and drop, park it in a separate queue, ...).
 */
public class MaxAttemptsExceededException extends RetryException {
  private final int attempt;
  private final int maxAttempts;

  public MaxAttemptsExceededException(int attempt, int maxAttempts) {
    super("Max retry attempts reached (" + maxAttempts + "), attempt " + attempt + " refused");
    this.attempt = attempt;
    this.maxAttempts = maxAttempts;
  }

  public int getAttempt() {
    return attempt;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }
}
