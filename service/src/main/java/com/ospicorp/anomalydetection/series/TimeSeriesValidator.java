package com.ospicorp.anomalydetection.series;

import java.util.ArrayList;
import java.util.List;

public final class TimeSeriesValidator {
  static final int ABSOLUTE_MIN_POINTS = 2;

  private TimeSeriesValidator() {
  }

  public static ValidationResult<TimeSeries> forTraining(List<Long> timestamps, List<Double> values,
      int minPoints) {
    if (timestamps == null || values == null) {
      return ValidationResult.invalid("timestamps and values must be provided.");
    }

    List<String> errors = new ArrayList<>();
    for (Long timestamp : timestamps) {
      if (timestamp == null) {
        errors.add("Input list must contain only integer Unix timestamps.");
        break;
      }
      if (timestamp < 0) {
        errors.add("Input list must contain only non-negative Unix timestamps.");
        break;
      }
    }
    for (Double value : values) {
      if (value == null || !Double.isFinite(value)) {
        errors.add("Input list cannot contain None, NaN, or infinite values.");
        break;
      }
    }
    if (timestamps.size() != values.size()) {
      errors.add("timestamps and values must have the same length.");
    }
    if (!errors.isEmpty()) {
      return ValidationResult.invalid(errors);
    }

    int required = Math.max(ABSOLUTE_MIN_POINTS, minPoints);
    if (timestamps.size() < required) {
      return ValidationResult.invalid(
          "Input list must contain at least " + required + " data points.");
    }

    List<DataPoint> points = new ArrayList<>(timestamps.size());
    for (int i = 0; i < timestamps.size(); i++) {
      points.add(new DataPoint(timestamps.get(i), values.get(i)));
    }
    for (int i = 1; i < points.size(); i++) {
      if (points.get(i).timestamp() <= points.get(i - 1).timestamp()) {
        errors.add("TimeSeries timestamps must be strictly increasing.");
        break;
      }
    }
    double first = points.get(0).value();
    if (points.stream().allMatch(p -> p.value() == first)) {
      errors.add("Input list cannot contain constant values only.");
    }

    return errors.isEmpty()
        ? ValidationResult.valid(new TimeSeries(points))
        : ValidationResult.invalid(errors);
  }

  public static ValidationResult<DataPoint> forPrediction(String timestamp, Double value) {
    List<String> errors = new ArrayList<>();
    long parsed = -1;
    if (timestamp == null || timestamp.isBlank()) {
      errors.add("Timestamp must be a non-empty string.");
    } else if (!timestamp.chars().allMatch(c -> c >= '0' && c <= '9')) {
      errors.add("Timestamp must contain only digits.");
    } else {
      try {
        parsed = Long.parseLong(timestamp);
      } catch (NumberFormatException ex) {
        errors.add("timestamp is not a valid Unix timestamp.");
      }
    }
    if (value == null || !Double.isFinite(value)) {
      errors.add("Value cannot be None, NaN, or infinite.");
    }
    return errors.isEmpty()
        ? ValidationResult.valid(new DataPoint(parsed, value))
        : ValidationResult.invalid(errors);
  }
}
