package com.ospicorp.anomalydetection.training;

import com.ospicorp.anomalydetection.config.AnomalyProperties;
import com.ospicorp.anomalydetection.detection.Trainer;
import com.ospicorp.anomalydetection.error.ApiException;
import com.ospicorp.anomalydetection.error.DataAccessErrors;
import com.ospicorp.anomalydetection.error.InternalException;
import com.ospicorp.anomalydetection.error.ValidationException;
import com.ospicorp.anomalydetection.registry.ModelRecord;
import com.ospicorp.anomalydetection.registry.ModelRecordRepository;
import com.ospicorp.anomalydetection.registry.UnattachedRecordException;
import com.ospicorp.anomalydetection.series.ModelState;
import com.ospicorp.anomalydetection.series.SeriesIds;
import com.ospicorp.anomalydetection.series.TimeSeries;
import com.ospicorp.anomalydetection.series.TimeSeriesValidator;
import com.ospicorp.anomalydetection.storage.ArtifactStorage;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Fits a model for a series and registers it as the series' next version.
 *
 * <p>Version allocation, the placeholder row, both artifact writes and the path update share
 * one transaction. A failure at any point rolls the counter and the row back together, so
 * readers only ever see rows whose artifacts exist.
 */
@Service
public class TrainingService {
  private static final Logger log = LoggerFactory.getLogger(TrainingService.class);

  private final Trainer trainer;
  private final ModelRecordRepository records;
  private final ArtifactStorage storage;
  private final TransactionTemplate transactions;
  private final Clock clock;
  private final int minPoints;
  private final int maxAttempts;

  public TrainingService(Trainer trainer, ModelRecordRepository records, ArtifactStorage storage,
      TransactionTemplate transactions, Clock clock, AnomalyProperties properties) {
    this.trainer = trainer;
    this.records = records;
    this.storage = storage;
    this.transactions = transactions;
    this.clock = clock;
    this.minPoints = properties.training().minPoints();
    this.maxAttempts = properties.training().maxAttempts();
  }

  public TrainResponse train(String rawSeriesId, TrainRequest request) {
    String seriesId = SeriesIds.requireValid(rawSeriesId);
    if (request == null) {
      throw new ValidationException("timestamps and values must be provided.");
    }
    TimeSeries series = TimeSeriesValidator
        .forTraining(request.timestamps(), request.values(), minPoints)
        .orElseThrow();

    ModelState state;
    try {
      state = trainer.train(series);
    } catch (RuntimeException ex) {
      log.error("Model fit failed for series {}", seriesId, ex);
      throw new InternalException("Unexpected error while training model.", ex);
    }

    for (int attempt = 1; ; attempt++) {
      try {
        int version = register(seriesId, series, state);
        log.info("Registered model version {} for series {} ({} points)", version, seriesId,
            series.size());
        return new TrainResponse(seriesId, String.valueOf(version), series.size());
      } catch (ConcurrencyFailureException ex) {
        if (attempt >= maxAttempts) {
          log.error("Giving up on series {} after {} conflicting attempts", seriesId, attempt, ex);
          throw new InternalException(
              "Training could not be committed because of concurrent updates.", ex);
        }
        log.warn("Concurrent update while registering series {} (attempt {}/{}), retrying",
            seriesId, attempt, maxAttempts);
      } catch (ApiException | UnattachedRecordException ex) {
        throw ex;
      } catch (RuntimeException ex) {
        if (DataAccessErrors.isPoolExhausted(ex)) {
          log.warn("Database unavailable while training series {}: {}", seriesId, ex.getMessage());
          throw DataAccessErrors.unavailable(ex);
        }
        log.error("Training failed for series {}", seriesId, ex);
        throw new InternalException("Unexpected error while training model.", ex);
      }
    }
  }

  private int register(String seriesId, TimeSeries series, ModelState state) {
    Integer version = transactions.execute(status -> {
      ModelRecord record = ModelRecord.build(seriesId, null, null, null, clock);
      int allocated = records.save(status, record);
      List<String> written = new ArrayList<>(2);
      try {
        written.add(storage.saveState(seriesId, allocated, state));
        written.add(storage.saveData(seriesId, allocated, series));
        records.update(record, written.get(0), written.get(1));
      } catch (RuntimeException ex) {
        // Still holding the counter row lock, so no other request can own this version yet.
        discard(written);
        throw ex;
      }
      return allocated;
    });
    if (version == null) {
      throw new IllegalStateException("Training transaction returned no version");
    }
    return version;
  }

  private void discard(List<String> paths) {
    for (String path : paths) {
      try {
        storage.delete(path);
        log.warn("Removed artifact {} of a rolled back training attempt", path);
      } catch (RuntimeException ex) {
        log.warn("Could not remove artifact {}: {}", path, ex.getMessage());
      }
    }
  }
}
