package com.ospicorp.anomalydetection.storage;

import com.ospicorp.anomalydetection.series.ModelState;
import com.ospicorp.anomalydetection.series.TimeSeries;

/**
 * Writes and reads the two artifact kinds of a trained version. Implementations differ only in
 * how a location is encoded (filesystem path or {@code s3://bucket/key} URI); the returned
 * string is stored verbatim in the model record and handed back to the load methods.
 */
public interface ArtifactStorage {

  String saveState(String seriesId, int version, ModelState state);

  String saveData(String seriesId, int version, TimeSeries payload);

  /**
   * @throws ArtifactNotFoundException if nothing is stored at {@code path}
   */
  ModelState loadState(String path);

  /**
   * @throws ArtifactNotFoundException if nothing is stored at {@code path}
   */
  TimeSeries loadData(String path);

  /** Removes an artifact; returns false when it did not exist. */
  boolean delete(String path);

  static String modelFileName(String seriesId, int version) {
    return seriesId + "_model_v" + version + ".json";
  }

  static String dataFileName(String seriesId, int version) {
    return seriesId + "_data_v" + version + ".json";
  }
}
