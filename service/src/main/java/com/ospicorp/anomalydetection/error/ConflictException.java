package com.ospicorp.anomalydetection.error;

import org.springframework.http.HttpStatus;

// Request is well-formed but its semantics are invalid (blank id, negative version).
public class ConflictException extends ApiException {

  public ConflictException(String message) {
    super(message);
  }

  @Override
  public HttpStatus status() {
    return HttpStatus.BAD_REQUEST;
  }
}
