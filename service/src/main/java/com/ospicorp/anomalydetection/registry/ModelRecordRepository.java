package com.ospicorp.anomalydetection.registry;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.TransactionStatus;

/**
 * Explicit persistence functions for {@code anomaly_detection_models}. Writes must run inside
 * the transaction passed to {@link #save}; reads return immutable views.
 */
@Repository
public class ModelRecordRepository {
  private static final String COLUMNS =
      "series_id, version, model_path, data_path, created_at, updated_at";

  private static final RowMapper<ModelRecordView> VIEW_MAPPER = ModelRecordRepository::mapView;

  private final JdbcTemplate jdbc;
  private final SeriesVersionDao versions;
  private final Clock clock;

  public ModelRecordRepository(JdbcTemplate jdbc, SeriesVersionDao versions, Clock clock) {
    this.jdbc = jdbc;
    this.versions = versions;
    this.clock = clock;
  }

  /**
   * Inserts the record under {@code transaction}, allocating a version first when the record
   * has none, and attaches the transaction to the record.
   *
   * @return the version the row was written with
   */
  public int save(TransactionStatus transaction, ModelRecord record) {
    if (transaction == null || transaction.isCompleted()) {
      throw new UnattachedRecordException("Model record for series '" + record.getSeriesId()
          + "' cannot be saved without an active transaction.");
    }
    if (record.getVersion() == null) {
      record.assignVersion(versions.nextVersion(record.getSeriesId()));
    }
    jdbc.update("INSERT INTO anomaly_detection_models (" + COLUMNS
            + ") VALUES (?, ?, ?, ?, ?, ?)",
        record.getSeriesId(), record.getVersion(), record.getModelPath(), record.getDataPath(),
        Timestamp.from(record.getCreatedAt()), Timestamp.from(record.getUpdatedAt()));
    record.attach(transaction);
    return record.getVersion();
  }

  public void update(ModelRecord record, String modelPath, String dataPath) {
    if (!record.isAttached()) {
      throw new UnattachedRecordException("Model record for series '" + record.getSeriesId()
          + "' version " + record.getVersion() + " is not attached to an active transaction.");
    }
    if (modelPath == null || dataPath == null) {
      throw new IllegalArgumentException("model and data paths are set together");
    }
    if (record.getModelPath() != null || record.getDataPath() != null) {
      throw new IllegalStateException("Model record " + record.getSeriesId() + " v"
          + record.getVersion() + " already has artifact paths");
    }
    Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
    int rows = jdbc.update("""
        UPDATE anomaly_detection_models
        SET model_path = ?, data_path = ?, updated_at = ?
        WHERE series_id = ? AND version = ?
          AND model_path IS NULL AND data_path IS NULL
        """,
        modelPath, dataPath, Timestamp.from(now),
        record.getSeriesId(), record.getVersion());
    if (rows != 1) {
      throw new IllegalStateException("Model record " + record.getSeriesId() + " v"
          + record.getVersion() + " is missing or already has artifact paths");
    }
    record.applyPaths(modelPath, dataPath, now);
  }

  public Optional<ModelRecordView> findLastModel(String seriesId) {
    return jdbc.query("SELECT " + COLUMNS + """
         FROM anomaly_detection_models
        WHERE series_id = ?
        ORDER BY version DESC
        LIMIT 1
        """, VIEW_MAPPER, seriesId).stream().findFirst();
  }

  public Optional<ModelRecordView> findModelVersion(String seriesId, int version) {
    return jdbc.query("SELECT " + COLUMNS
            + " FROM anomaly_detection_models WHERE series_id = ? AND version = ?",
        VIEW_MAPPER, seriesId, version).stream().findFirst();
  }

  public ModelRecordView getLastModel(String seriesId) {
    return findLastModel(seriesId).orElseThrow(() ->
        new NoSuchElementException("No trained model found for series_id '" + seriesId + "'."));
  }

  public ModelRecordView getModelVersion(String seriesId, int version) {
    return findModelVersion(seriesId, version).orElseThrow(() ->
        new NoSuchElementException("Model version '" + version + "' not found for series_id '"
            + seriesId + "'."));
  }

  /** Version 0 means the latest committed version. */
  public ModelRecordView resolve(String seriesId, int version) {
    return version == 0 ? getLastModel(seriesId) : getModelVersion(seriesId, version);
  }

  public List<ModelRecordView> listVersions(String seriesId) {
    return jdbc.query("SELECT " + COLUMNS
            + " FROM anomaly_detection_models WHERE series_id = ? ORDER BY version",
        VIEW_MAPPER, seriesId);
  }

  public long countSeries() {
    Long count = jdbc.queryForObject(
        "SELECT COUNT(DISTINCT series_id) FROM anomaly_detection_models", Long.class);
    return count == null ? 0L : count;
  }

  private static ModelRecordView mapView(ResultSet rs, int rowNum) throws SQLException {
    return new ModelRecordView(
        rs.getString("series_id"),
        rs.getInt("version"),
        rs.getString("model_path"),
        rs.getString("data_path"),
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("updated_at").toInstant());
  }
}
