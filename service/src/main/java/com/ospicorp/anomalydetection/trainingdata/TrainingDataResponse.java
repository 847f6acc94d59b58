package com.ospicorp.anomalydetection.trainingdata;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.anomalydetection.series.DataPoint;
import java.util.List;

public record TrainingDataResponse(
    @JsonProperty("series_id") String seriesId,
    int version,
    @JsonProperty("point_count") int pointCount,
    List<DataPoint> points) {}
