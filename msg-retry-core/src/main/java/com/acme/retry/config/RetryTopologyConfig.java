package com.acme.retry.config;

/**
 * Names of the exchange, queues and routing keys that make up the retry topology. Pure POJO with
 * defaults, populated from whatever configuration source the application uses.
 */
public class RetryTopologyConfig {

  private String mainExchange = "main_exchange";
  private String mainQueue = "main_queue";
  private String retryQueue = "retry_queue";
  private String mainRoutingKey = "main_key";
  private String retryRoutingKey = "retry_key";

  public RetryTopologyConfig() {}

  public RetryTopologyConfig(
      String mainExchange,
      String mainQueue,
      String retryQueue,
      String mainRoutingKey,
      String retryRoutingKey) {
    this.mainExchange = mainExchange;
    this.mainQueue = mainQueue;
    this.retryQueue = retryQueue;
    this.mainRoutingKey = mainRoutingKey;
    this.retryRoutingKey = retryRoutingKey;
  }

  public String getMainExchange() {
    return mainExchange;
  }

  public void setMainExchange(String mainExchange) {
    this.mainExchange = mainExchange;
  }

  public String getMainQueue() {
    return mainQueue;
  }

  public void setMainQueue(String mainQueue) {
    this.mainQueue = mainQueue;
  }

  public String getRetryQueue() {
    return retryQueue;
  }

  public void setRetryQueue(String retryQueue) {
    this.retryQueue = retryQueue;
  }

  public String getMainRoutingKey() {
    return mainRoutingKey;
  }

  public void setMainRoutingKey(String mainRoutingKey) {
    this.mainRoutingKey = mainRoutingKey;
  }

  public String getRetryRoutingKey() {
    return retryRoutingKey;
  }

  public void setRetryRoutingKey(String retryRoutingKey) {
    this.retryRoutingKey = retryRoutingKey;
  }

  /** Validates the names; blank values are rejected. */
  public void validate() {
    RetryConfig.requireName(mainExchange, "mainExchange");
    RetryConfig.requireName(mainQueue, "mainQueue");
    RetryConfig.requireName(retryQueue, "retryQueue");
    RetryConfig.requireName(mainRoutingKey, "mainRoutingKey");
    RetryConfig.requireName(retryRoutingKey, "retryRoutingKey");
  }
}
