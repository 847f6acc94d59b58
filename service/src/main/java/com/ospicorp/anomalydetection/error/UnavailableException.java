package com.ospicorp.anomalydetection.error;

import org.springframework.http.HttpStatus;

public class UnavailableException extends ApiException {
  private final int retryAfterSeconds;

  public UnavailableException(String message, int retryAfterSeconds, Throwable cause) {
    super(message, cause);
    this.retryAfterSeconds = retryAfterSeconds;
  }

  public int retryAfterSeconds() {
    return retryAfterSeconds;
  }

  @Override
  public HttpStatus status() {
    return HttpStatus.SERVICE_UNAVAILABLE;
  }
}
