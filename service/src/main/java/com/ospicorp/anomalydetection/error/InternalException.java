package com.ospicorp.anomalydetection.error;

import org.springframework.http.HttpStatus;

public class InternalException extends ApiException {

  public InternalException(String message) {
    super(message);
  }

  public InternalException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public HttpStatus status() {
    return HttpStatus.INTERNAL_SERVER_ERROR;
  }
}
