package com.acme.retry.core;

/** Header names used by the retry topology. */
public final class RetryHeaders {

  /** Number of completed attempts, written as a 32-bit integer on every republish. */
  public static final String RETRY_COUNT = "x-retry-count";

  public static final String QUEUE_TYPE = "x-queue-type";
  public static final String QUEUE_TYPE_QUORUM = "quorum";
  public static final String DEAD_LETTER_EXCHANGE = "x-dead-letter-exchange";
  public static final String DEAD_LETTER_ROUTING_KEY = "x-dead-letter-routing-key";

  private RetryHeaders() {}
}
