package com.acme.retry.core;

/** The declaration steps performed when the retry topology is initialized, in execution order. */
public enum TopologyStep {
  DECLARE_EXCHANGE("declare main exchange"),
  DECLARE_MAIN_QUEUE("declare main queue"),
  BIND_MAIN_QUEUE("bind main queue"),
  DECLARE_RETRY_QUEUE("declare retry queue"),
  BIND_RETRY_QUEUE("bind retry queue");

  private final String description;

  TopologyStep(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }
}
