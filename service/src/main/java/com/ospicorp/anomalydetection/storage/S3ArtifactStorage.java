package com.ospicorp.anomalydetection.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.anomalydetection.series.ModelState;
import com.ospicorp.anomalydetection.series.TimeSeries;
import java.io.IOException;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * Stores artifacts as JSON objects under {@code {prefix}/{series_id}/{filename}} and reports
 * their location as {@code s3://bucket/key}.
 */
public class S3ArtifactStorage implements ArtifactStorage {
  private static final Logger log = LoggerFactory.getLogger(S3ArtifactStorage.class);
  private static final Set<String> NOT_FOUND_CODES = Set.of("NoSuchKey", "404", "NotFound");
  private static final String JSON = "application/json";

  private final S3Client s3Client;
  private final String bucket;
  private final String prefix;
  private final ObjectMapper mapper;

  public S3ArtifactStorage(S3Client s3Client, String bucket, String prefix, ObjectMapper mapper) {
    if (bucket == null || bucket.isBlank()) {
      throw new IllegalArgumentException("S3 bucket must be configured");
    }
    this.s3Client = s3Client;
    this.bucket = bucket.strip();
    this.prefix = normalizePrefix(prefix);
    this.mapper = mapper;
  }

  @Override
  public String saveState(String seriesId, int version, ModelState state) {
    return put(objectKey(seriesId, ArtifactStorage.modelFileName(seriesId, version)), state);
  }

  @Override
  public String saveData(String seriesId, int version, TimeSeries payload) {
    return put(objectKey(seriesId, ArtifactStorage.dataFileName(seriesId, version)), payload);
  }

  @Override
  public ModelState loadState(String path) {
    return get(path, ModelState.class);
  }

  @Override
  public TimeSeries loadData(String path) {
    return get(path, TimeSeries.class);
  }

  @Override
  public boolean delete(String path) {
    S3Location location = S3Location.resolve(path, bucket);
    try {
      s3Client.headObject(HeadObjectRequest.builder()
          .bucket(location.bucket())
          .key(location.key())
          .build());
    } catch (S3Exception ex) {
      if (isNotFound(ex)) {
        return false;
      }
      throw ex;
    }
    s3Client.deleteObject(DeleteObjectRequest.builder()
        .bucket(location.bucket())
        .key(location.key())
        .build());
    return true;
  }

  String objectKey(String seriesId, String filename) {
    String base = seriesId + "/" + filename;
    return prefix.isEmpty() ? base : prefix + "/" + base;
  }

  private String put(String key, Object payload) {
    byte[] body;
    try {
      body = mapper.writeValueAsBytes(payload);
    } catch (IOException ex) {
      throw new ArtifactStorageException("Failed to serialize artifact " + key, ex);
    }
    s3Client.putObject(PutObjectRequest.builder()
            .bucket(bucket)
            .key(key)
            .contentType(JSON)
            .build(),
        RequestBody.fromBytes(body));
    String uri = new S3Location(bucket, key).toUri();
    log.debug("Uploaded artifact {}", uri);
    return uri;
  }

  private <T> T get(String path, Class<T> type) {
    S3Location location = S3Location.resolve(path, bucket);
    ResponseBytes<GetObjectResponse> bytes;
    try {
      bytes = s3Client.getObjectAsBytes(GetObjectRequest.builder()
          .bucket(location.bucket())
          .key(location.key())
          .build());
    } catch (S3Exception ex) {
      if (isNotFound(ex)) {
        throw new ArtifactNotFoundException(path, ex);
      }
      throw ex;
    }
    try {
      return mapper.readValue(bytes.asByteArray(), type);
    } catch (IOException ex) {
      throw new ArtifactStorageException("Failed to parse artifact " + path, ex);
    }
  }

  static boolean isNotFound(S3Exception ex) {
    if (ex instanceof NoSuchKeyException || ex.statusCode() == 404) {
      return true;
    }
    AwsErrorDetails details = ex.awsErrorDetails();
    return details != null && details.errorCode() != null
        && NOT_FOUND_CODES.contains(details.errorCode().strip());
  }

  static String normalizePrefix(String prefix) {
    if (prefix == null) {
      return "";
    }
    String value = prefix.strip();
    int start = 0;
    int end = value.length();
    while (start < end && value.charAt(start) == '/') {
      start++;
    }
    while (end > start && value.charAt(end - 1) == '/') {
      end--;
    }
    return value.substring(start, end);
  }
}
