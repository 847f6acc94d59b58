package com.ospicorp.anomalydetection.series;

import java.util.List;

/**
 * Ordered, already validated sequence of points for one series. Instances are only created
 * through {@link TimeSeriesValidator} or read back from storage, never mutated.
 */
public record TimeSeries(List<DataPoint> data) {

  public TimeSeries {
    data = List.copyOf(data);
  }

  public int size() {
    return data.size();
  }
}
