package com.ospicorp.anomalydetection.prediction;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PredictResponse(
    boolean anomaly,
    @JsonProperty("model_version") String modelVersion) {}
