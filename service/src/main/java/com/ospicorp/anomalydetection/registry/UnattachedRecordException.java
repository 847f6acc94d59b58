package com.ospicorp.anomalydetection.registry;

/** A record was modified outside the transaction it was saved in. */
public class UnattachedRecordException extends IllegalStateException {

  public UnattachedRecordException(String message) {
    super(message);
  }
}
