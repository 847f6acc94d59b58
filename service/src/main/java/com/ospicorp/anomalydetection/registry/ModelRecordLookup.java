package com.ospicorp.anomalydetection.registry;

import com.ospicorp.anomalydetection.error.DataAccessErrors;
import com.ospicorp.anomalydetection.error.NotFoundException;
import java.util.NoSuchElementException;
import org.springframework.stereotype.Component;

/** Read-side resolution of a series version with failures already mapped to API errors. */
@Component
public class ModelRecordLookup {
  private final ModelRecordRepository records;

  public ModelRecordLookup(ModelRecordRepository records) {
    this.records = records;
  }

  public ModelRecordView resolve(String seriesId, int version) {
    try {
      return records.resolve(seriesId, version);
    } catch (NoSuchElementException ex) {
      throw new NotFoundException(ex.getMessage(), ex);
    } catch (RuntimeException ex) {
      if (DataAccessErrors.isPoolExhausted(ex)) {
        throw DataAccessErrors.unavailable(ex);
      }
      throw ex;
    }
  }
}
