package com.ospicorp.anomalydetection.training;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TrainResponse(
    @JsonProperty("series_id") String seriesId,
    String version,
    @JsonProperty("points_used") int pointsUsed) {}
