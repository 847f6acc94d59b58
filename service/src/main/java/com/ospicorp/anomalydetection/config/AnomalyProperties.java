package com.ospicorp.anomalydetection.config;

import com.ospicorp.anomalydetection.storage.StorageBackend;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "anomaly")
public record AnomalyProperties(
    @Valid @DefaultValue Training training,
    @Valid @DefaultValue Storage storage,
    @Valid @DefaultValue Health health) {

  public record Training(
      @Min(2) @DefaultValue("3") int minPoints,
      @Min(1) @DefaultValue("3") int maxAttempts) {}

  public record Storage(
      @NotNull @DefaultValue("local") StorageBackend backend,
      @Valid @DefaultValue Local local,
      @Valid @DefaultValue S3 s3) {}

  public record Local(
      @DefaultValue("./data/models") String modelFolder,
      @DefaultValue("./data/data") String dataFolder) {}

  /** Credentials are optional; without them the SDK's default provider chain applies. */
  public record S3(
      String bucket,
      @DefaultValue("") String prefix,
      @DefaultValue("us-east-1") String region,
      String endpointUrl,
      String accessKeyId,
      String secretAccessKey,
      String sessionToken) {}

  public record Health(@Min(1) @DefaultValue("100") int latencyHistoryLimit) {}
}
