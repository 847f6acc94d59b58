package com.ospicorp.anomalydetection.series;

import com.ospicorp.anomalydetection.error.ValidationException;
import java.util.List;

/**
 * Outcome of converting a raw payload into a domain value: either the value or the list of
 * rule violations, never both.
 */
public record ValidationResult<T>(T value, List<String> errors) {

  public ValidationResult {
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  public static <T> ValidationResult<T> valid(T value) {
    return new ValidationResult<>(value, List.of());
  }

  public static <T> ValidationResult<T> invalid(List<String> errors) {
    return new ValidationResult<>(null, errors);
  }

  public static <T> ValidationResult<T> invalid(String error) {
    return new ValidationResult<>(null, List.of(error));
  }

  public boolean isValid() {
    return errors.isEmpty();
  }

  public T orElseThrow() {
    if (!isValid()) {
      throw new ValidationException(errors);
    }
    return value;
  }
}
