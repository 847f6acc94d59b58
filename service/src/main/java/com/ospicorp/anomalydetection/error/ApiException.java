package com.ospicorp.anomalydetection.error;

import org.springframework.http.HttpStatus;

/**
 * Base type for failures that reach the HTTP boundary with a fixed status.
 */
public abstract class ApiException extends RuntimeException {

  protected ApiException(String message) {
    super(message);
  }

  protected ApiException(String message, Throwable cause) {
    super(message, cause);
  }

  public abstract HttpStatus status();
}
