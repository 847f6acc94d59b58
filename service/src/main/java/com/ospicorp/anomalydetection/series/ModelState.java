package com.ospicorp.anomalydetection.series;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serializable model state. Integral numbers are held as {@code Long} and floating point
 * numbers as {@code Double}, so a state read back from JSON equals the one that was written.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record ModelState(String model, Map<String, Object> parameters, Map<String, Object> metrics) {

  public ModelState {
    parameters = parameters == null ? Map.of() : normalize(parameters);
    metrics = metrics == null ? null : normalize(metrics);
  }

  private static Map<String, Object> normalize(Map<String, ?> values) {
    Map<String, Object> copy = new LinkedHashMap<>();
    values.forEach((key, value) -> copy.put(key, normalizeValue(value)));
    return Collections.unmodifiableMap(copy);
  }

  @SuppressWarnings("unchecked")
  private static Object normalizeValue(Object value) {
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof Float f) {
      return f.doubleValue();
    }
    if (value instanceof Map<?, ?> map) {
      return normalize((Map<String, ?>) map);
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      list.forEach(item -> copy.add(normalizeValue(item)));
      return Collections.unmodifiableList(copy);
    }
    return value;
  }
}
