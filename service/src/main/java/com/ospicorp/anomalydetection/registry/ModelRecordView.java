package com.ospicorp.anomalydetection.registry;

import java.time.Instant;

public record ModelRecordView(
    String seriesId,
    int version,
    String modelPath,
    String dataPath,
    Instant createdAt,
    Instant updatedAt) {}
