package com.acme.retry.core;

public class PublishException extends RetryException {
  public PublishException(String message, Throwable e) {
    super(message, e);
  }
}
