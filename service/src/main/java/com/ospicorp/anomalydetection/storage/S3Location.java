package com.ospicorp.anomalydetection.storage;

public record S3Location(String bucket, String key) {
  static final String SCHEME = "s3://";

  /**
   * Accepts either a canonical {@code s3://bucket/key} URI or a bare key, which is resolved
   * against {@code defaultBucket}.
   */
  public static S3Location resolve(String path, String defaultBucket) {
    if (path == null || path.isBlank()) {
      throw new IllegalArgumentException("S3 path must not be blank");
    }
    String value = path.strip();
    if (value.startsWith(SCHEME)) {
      String withoutScheme = value.substring(SCHEME.length());
      int slash = withoutScheme.indexOf('/');
      if (slash <= 0 || slash == withoutScheme.length() - 1) {
        throw new IllegalArgumentException("Invalid S3 URI: '" + path + "'");
      }
      return new S3Location(withoutScheme.substring(0, slash), withoutScheme.substring(slash + 1));
    }
    String key = value;
    while (key.startsWith("/")) {
      key = key.substring(1);
    }
    if (key.isEmpty()) {
      throw new IllegalArgumentException("Invalid S3 key: '" + path + "'");
    }
    return new S3Location(defaultBucket, key);
  }

  public String toUri() {
    return SCHEME + bucket + "/" + key;
  }
}
