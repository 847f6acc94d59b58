package com.ospicorp.anomalydetection.storage;

public enum StorageBackend {
  LOCAL,
  S3
}
