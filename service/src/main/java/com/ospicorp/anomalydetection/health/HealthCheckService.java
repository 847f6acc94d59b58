package com.ospicorp.anomalydetection.health;

import com.ospicorp.anomalydetection.error.UnavailableException;
import com.ospicorp.anomalydetection.registry.ModelRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
public class HealthCheckService {
  private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

  private final ModelRecordRepository records;
  private final LatencyTracker latencyTracker;

  public HealthCheckService(ModelRecordRepository records, LatencyTracker latencyTracker) {
    this.records = records;
    this.latencyTracker = latencyTracker;
  }

  public HealthCheckResponse check() {
    long seriesTrained;
    try {
      seriesTrained = records.countSeries();
    } catch (DataAccessException ex) {
      log.warn("Health check could not reach the metadata store: {}", ex.getMessage());
      throw new UnavailableException("Metadata store is unavailable.", 5, ex);
    }
    return new HealthCheckResponse(seriesTrained,
        latencyTracker.snapshot(LatencyTracker.Operation.INFERENCE),
        latencyTracker.snapshot(LatencyTracker.Operation.TRAINING));
  }
}
