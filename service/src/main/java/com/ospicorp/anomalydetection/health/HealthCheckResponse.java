package com.ospicorp.anomalydetection.health;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HealthCheckResponse(
    @JsonProperty("series_trained") long seriesTrained,
    @JsonProperty("inference_latency_ms") LatencyMetrics inferenceLatencyMs,
    @JsonProperty("training_latency_ms") LatencyMetrics trainingLatencyMs) {}
