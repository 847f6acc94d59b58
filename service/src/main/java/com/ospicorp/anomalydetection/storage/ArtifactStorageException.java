package com.ospicorp.anomalydetection.storage;

public class ArtifactStorageException extends RuntimeException {

  public ArtifactStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
