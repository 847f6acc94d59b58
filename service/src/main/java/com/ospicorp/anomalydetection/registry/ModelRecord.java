package com.ospicorp.anomalydetection.registry;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import org.springframework.transaction.TransactionStatus;

/**
 * Metadata row of one trained version while it is being written. Reads never hand these out;
 * they return {@link ModelRecordView} snapshots instead.
 */
public class ModelRecord {
  private final String seriesId;
  private Integer version;
  private String modelPath;
  private String dataPath;
  private final Instant createdAt;
  private Instant updatedAt;
  private TransactionStatus transaction;

  private ModelRecord(String seriesId, Integer version, String modelPath, String dataPath,
      Instant now) {
    this.seriesId = seriesId;
    this.version = version;
    this.modelPath = modelPath;
    this.dataPath = dataPath;
    this.createdAt = now;
    this.updatedAt = now;
  }

  public static ModelRecord build(String seriesId, Integer version, String modelPath,
      String dataPath) {
    return build(seriesId, version, modelPath, dataPath, Clock.systemUTC());
  }

  // Postgres keeps microseconds; truncating keeps the in-memory copy equal to the stored row.
  public static ModelRecord build(String seriesId, Integer version, String modelPath,
      String dataPath, Clock clock) {
    return new ModelRecord(seriesId, version, modelPath, dataPath,
        clock.instant().truncatedTo(ChronoUnit.MICROS));
  }

  public String getSeriesId() { return seriesId; }
  public Integer getVersion() { return version; }
  public String getModelPath() { return modelPath; }
  public String getDataPath() { return dataPath; }
  public Instant getCreatedAt() { return createdAt; }
  public Instant getUpdatedAt() { return updatedAt; }

  public boolean isAttached() {
    return transaction != null && !transaction.isCompleted();
  }

  public ModelRecordView view() {
    if (version == null) {
      throw new IllegalStateException("Model record for " + seriesId + " has no version yet");
    }
    return new ModelRecordView(seriesId, version, modelPath, dataPath, createdAt, updatedAt);
  }

  void attach(TransactionStatus transaction) {
    this.transaction = transaction;
  }

  void assignVersion(int version) {
    this.version = version;
  }

  void applyPaths(String modelPath, String dataPath, Instant updatedAt) {
    this.modelPath = modelPath;
    this.dataPath = dataPath;
    this.updatedAt = updatedAt;
  }
}
