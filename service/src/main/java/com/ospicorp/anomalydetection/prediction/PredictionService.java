package com.ospicorp.anomalydetection.prediction;

import com.ospicorp.anomalydetection.detection.AnomalyModel;
import com.ospicorp.anomalydetection.detection.Trainer;
import com.ospicorp.anomalydetection.error.ApiException;
import com.ospicorp.anomalydetection.error.InternalException;
import com.ospicorp.anomalydetection.error.NotFoundException;
import com.ospicorp.anomalydetection.error.ValidationException;
import com.ospicorp.anomalydetection.registry.ModelRecordLookup;
import com.ospicorp.anomalydetection.registry.ModelRecordView;
import com.ospicorp.anomalydetection.series.DataPoint;
import com.ospicorp.anomalydetection.series.ModelState;
import com.ospicorp.anomalydetection.series.SeriesIds;
import com.ospicorp.anomalydetection.series.TimeSeriesValidator;
import com.ospicorp.anomalydetection.storage.ArtifactNotFoundException;
import com.ospicorp.anomalydetection.storage.ArtifactStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class PredictionService {
  private static final Logger log = LoggerFactory.getLogger(PredictionService.class);

  private final ModelRecordLookup lookup;
  private final ArtifactStorage storage;
  private final Trainer trainer;

  public PredictionService(ModelRecordLookup lookup, ArtifactStorage storage, Trainer trainer) {
    this.lookup = lookup;
    this.storage = storage;
    this.trainer = trainer;
  }

  /**
   * Scores one point against a stored model. Version 0 selects the latest version; the
   * response always reports the version that was actually used.
   */
  public PredictResponse predict(String rawSeriesId, int version, PredictRequest request) {
    if (request == null) {
      throw new ValidationException("timestamp and value must be provided.");
    }
    DataPoint point = TimeSeriesValidator.forPrediction(request.timestamp(), request.value())
        .orElseThrow();
    String seriesId = SeriesIds.requireValid(rawSeriesId);
    SeriesIds.requireVersion(version);

    ModelRecordView record = lookup.resolve(seriesId, version);
    if (record.modelPath() == null) {
      log.error("Model record {} v{} has no model path", seriesId, record.version());
      throw new InternalException("Model path is missing for series_id '" + seriesId
          + "' and version '" + record.version() + "'.");
    }

    try {
      ModelState state = storage.loadState(record.modelPath());
      AnomalyModel model = trainer.restore(state);
      boolean anomaly = model.predict(point);
      return new PredictResponse(anomaly, String.valueOf(record.version()));
    } catch (ArtifactNotFoundException ex) {
      log.warn("Model artifact {} for series {} v{} is missing", record.modelPath(), seriesId,
          record.version());
      throw new NotFoundException("Model artifact for series_id '" + seriesId + "' version '"
          + record.version() + "' was not found.", ex);
    } catch (ApiException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      log.error("Prediction failed for series {} v{}", seriesId, record.version(), ex);
      throw new InternalException("Unexpected error while predicting anomaly.", ex);
    }
  }
}
