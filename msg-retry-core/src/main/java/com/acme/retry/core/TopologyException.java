package com.acme.retry.core;

/**
 * Raised when the broker rejects one of the topology declarations. Declarations are idempotent, so
 * running the initializer again is the way to recover.
 */
public class TopologyException extends RetryException {
  private final TopologyStep step;

  public TopologyException(TopologyStep step, String target, Throwable cause) {
    super("Failed to " + step.description() + " '" + target + "'", cause);
    this.step = step;
  }

  public TopologyStep getStep() {
    return step;
  }
}
