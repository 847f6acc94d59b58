package com.ospicorp.anomalydetection.detection;

import com.ospicorp.anomalydetection.series.ModelState;
import com.ospicorp.anomalydetection.series.TimeSeries;

public interface Trainer {

  ModelState train(TimeSeries data);

  /** Rebuilds a ready-to-predict model from a state produced by {@link #train}. */
  AnomalyModel restore(ModelState state);
}
