package com.acme.retry.backoff;

/** Maps an attempt number (starting at 1) to the number of seconds to wait before it runs. */
@FunctionalInterface
public interface BackoffFunction {
  int delaySeconds(int attempt);
}
