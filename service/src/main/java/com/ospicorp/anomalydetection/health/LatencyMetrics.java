package com.ospicorp.anomalydetection.health;

public record LatencyMetrics(double avg, double p95) {}
