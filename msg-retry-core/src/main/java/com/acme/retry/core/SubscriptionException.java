package com.acme.retry.core;

public class SubscriptionException extends RetryException {
  public SubscriptionException(String message, Throwable e) {
    super(message, e);
  }
}
