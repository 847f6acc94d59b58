package com.ospicorp.anomalydetection.series;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

// Value object shared by training data and prediction queries
@JsonPropertyOrder({"timestamp", "value"})
public record DataPoint(long timestamp, double value) {}
