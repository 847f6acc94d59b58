package com.ospicorp.anomalydetection.detection;

import com.ospicorp.anomalydetection.series.DataPoint;
import com.ospicorp.anomalydetection.series.ModelState;
import com.ospicorp.anomalydetection.series.TimeSeries;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Flags a point as anomalous when its value exceeds {@code mean + 3 * stddev} of the training
 * values (population standard deviation).
 */
public class SimpleStatModel implements AnomalyModel {
  public static final String MODEL_NAME = "simple_stat_model";
  static final double DEVIATION_FACTOR = 3.0;

  private Double mean;
  private Double std;

  @Override
  public void fit(TimeSeries data, Consumer<ModelState> callback) {
    if (data == null || data.size() == 0) {
      throw new IllegalArgumentException("Training data must contain at least one point.");
    }
    double sum = 0;
    for (DataPoint point : data.data()) {
      sum += point.value();
    }
    double computedMean = sum / data.size();
    double squares = 0;
    for (DataPoint point : data.data()) {
      double diff = point.value() - computedMean;
      squares += diff * diff;
    }
    this.mean = computedMean;
    this.std = Math.sqrt(squares / data.size());
    if (callback != null) {
      callback.accept(save());
    }
  }

  @Override
  public boolean predict(DataPoint point) {
    if (mean == null || std == null) {
      throw new IllegalStateException("Model must be trained before prediction.");
    }
    return point.value() > mean + DEVIATION_FACTOR * std;
  }

  @Override
  public ModelState save() {
    if (mean == null || std == null) {
      throw new IllegalStateException("Model must be trained before it can be saved.");
    }
    Map<String, Object> parameters = new LinkedHashMap<>();
    parameters.put("mean", mean);
    parameters.put("std", std);
    Map<String, Object> metrics = new LinkedHashMap<>();
    metrics.put("threshold", mean + DEVIATION_FACTOR * std);
    return new ModelState(MODEL_NAME, parameters, metrics);
  }

  @Override
  public void load(ModelState state) {
    if (state == null || !MODEL_NAME.equals(state.model())) {
      throw new IllegalArgumentException("Unsupported model state: "
          + (state == null ? null : state.model()));
    }
    this.mean = number(state.parameters(), "mean");
    this.std = number(state.parameters(), "std");
  }

  private static double number(Map<String, Object> parameters, String key) {
    Object value = parameters.get(key);
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    throw new IllegalArgumentException("Model parameter '" + key + "' is missing or not numeric.");
  }
}
