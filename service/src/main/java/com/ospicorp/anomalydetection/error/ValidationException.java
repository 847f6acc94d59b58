package com.ospicorp.anomalydetection.error;

import java.util.List;
import org.springframework.http.HttpStatus;

public class ValidationException extends ApiException {
  private final List<String> errors;

  public ValidationException(List<String> errors) {
    super(errors.isEmpty() ? "Invalid payload." : String.join(" ", errors));
    this.errors = List.copyOf(errors);
  }

  public ValidationException(String message) {
    this(List.of(message));
  }

  public List<String> errors() {
    return errors;
  }

  @Override
  public HttpStatus status() {
    return HttpStatus.UNPROCESSABLE_ENTITY;
  }
}
