package com.ospicorp.anomalydetection.trainingdata;

import com.ospicorp.anomalydetection.error.ApiException;
import com.ospicorp.anomalydetection.error.DataAccessErrors;
import com.ospicorp.anomalydetection.error.InternalException;
import com.ospicorp.anomalydetection.error.NotFoundException;
import com.ospicorp.anomalydetection.registry.ModelRecordLookup;
import com.ospicorp.anomalydetection.registry.ModelRecordRepository;
import com.ospicorp.anomalydetection.registry.ModelRecordView;
import com.ospicorp.anomalydetection.series.SeriesIds;
import com.ospicorp.anomalydetection.series.TimeSeries;
import com.ospicorp.anomalydetection.storage.ArtifactNotFoundException;
import com.ospicorp.anomalydetection.storage.ArtifactStorage;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class TrainingDataService {
  private static final Logger log = LoggerFactory.getLogger(TrainingDataService.class);

  private final ModelRecordLookup lookup;
  private final ModelRecordRepository records;
  private final ArtifactStorage storage;

  public TrainingDataService(ModelRecordLookup lookup, ModelRecordRepository records,
      ArtifactStorage storage) {
    this.lookup = lookup;
    this.records = records;
    this.storage = storage;
  }

  /** Returns the points a version was trained on; version 0 selects the latest. */
  public TrainingDataResponse load(String rawSeriesId, int version) {
    String seriesId = SeriesIds.requireValid(rawSeriesId);
    SeriesIds.requireVersion(version);

    ModelRecordView record = lookup.resolve(seriesId, version);
    if (record.dataPath() == null) {
      log.error("Model record {} v{} has no data path", seriesId, record.version());
      throw new InternalException("Training data path is missing for series_id '" + seriesId
          + "' and version '" + record.version() + "'.");
    }

    try {
      TimeSeries data = storage.loadData(record.dataPath());
      return new TrainingDataResponse(seriesId, record.version(), data.size(), data.data());
    } catch (ArtifactNotFoundException ex) {
      throw new NotFoundException("Training data for series_id '" + seriesId + "' version '"
          + record.version() + "' was not found.", ex);
    } catch (ApiException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      log.error("Loading training data failed for series {} v{}", seriesId, record.version(), ex);
      throw new InternalException("Unexpected error while loading training data.", ex);
    }
  }

  public ModelVersionsResponse versions(String rawSeriesId) {
    String seriesId = SeriesIds.requireValid(rawSeriesId);
    List<ModelRecordView> views;
    try {
      views = records.listVersions(seriesId);
    } catch (RuntimeException ex) {
      if (DataAccessErrors.isPoolExhausted(ex)) {
        throw DataAccessErrors.unavailable(ex);
      }
      throw ex;
    }
    if (views.isEmpty()) {
      throw new NotFoundException("No trained model found for series_id '" + seriesId + "'.");
    }
    return new ModelVersionsResponse(seriesId, views.stream()
        .map(view -> new ModelVersionsResponse.VersionEntry(view.version(), view.createdAt(),
            view.updatedAt()))
        .toList());
  }
}
