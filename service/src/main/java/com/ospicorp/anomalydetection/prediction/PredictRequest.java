package com.ospicorp.anomalydetection.prediction;

// timestamp stays a string: numeric JSON values are coerced and then checked digit by digit
public record PredictRequest(String timestamp, Double value) {}
