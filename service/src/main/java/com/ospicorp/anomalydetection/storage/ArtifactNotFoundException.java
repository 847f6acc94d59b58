package com.ospicorp.anomalydetection.storage;

public class ArtifactNotFoundException extends RuntimeException {
  private final String path;

  public ArtifactNotFoundException(String path, Throwable cause) {
    super("Artifact not found: " + path, cause);
    this.path = path;
  }

  public String path() {
    return path;
  }
}
