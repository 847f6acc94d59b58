package com.ospicorp.anomalydetection.detection;

import com.ospicorp.anomalydetection.series.DataPoint;
import com.ospicorp.anomalydetection.series.ModelState;
import com.ospicorp.anomalydetection.series.TimeSeries;
import java.util.function.Consumer;

/**
 * A per-series detector that can be fitted, serialized to a {@link ModelState} and restored.
 */
public interface AnomalyModel {

  void fit(TimeSeries data, Consumer<ModelState> callback);

  boolean predict(DataPoint point);

  ModelState save();

  void load(ModelState state);
}
