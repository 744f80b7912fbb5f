package com.acme.retry.core;

/** Base type for every failure raised by the retry orchestration. */
public class RetryException extends RuntimeException {
  public RetryException(String message) {
    super(message);
  }

  public RetryException(String message, Throwable e) {
    super(message, e);
  }
}
