package com.ospicorp.anomalydetection.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.anomalydetection.storage.ArtifactStorage;
import com.ospicorp.anomalydetection.storage.LocalArtifactStorage;
import com.ospicorp.anomalydetection.storage.S3ArtifactStorage;
import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

@Configuration
@EnableConfigurationProperties(AnomalyProperties.class)
public class StorageConfig {
  private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnProperty(name = "anomaly.storage.backend", havingValue = "s3")
  S3Client s3Client(AnomalyProperties properties) {
    AnomalyProperties.S3 s3 = properties.storage().s3();
    S3ClientBuilder builder = S3Client.builder().region(Region.of(s3.region()));
    if (StringUtils.hasText(s3.endpointUrl())) {
      builder.endpointOverride(URI.create(s3.endpointUrl()))
          .forcePathStyle(true);
    }
    if (StringUtils.hasText(s3.accessKeyId()) && StringUtils.hasText(s3.secretAccessKey())) {
      AwsCredentials credentials = StringUtils.hasText(s3.sessionToken())
          ? AwsSessionCredentials.create(s3.accessKeyId(), s3.secretAccessKey(), s3.sessionToken())
          : AwsBasicCredentials.create(s3.accessKeyId(), s3.secretAccessKey());
      builder.credentialsProvider(StaticCredentialsProvider.create(credentials));
    } else {
      builder.credentialsProvider(DefaultCredentialsProvider.create());
    }
    return builder.build();
  }

  @Bean
  ArtifactStorage artifactStorage(AnomalyProperties properties, ObjectMapper mapper,
      ObjectProvider<S3Client> s3Client) {
    AnomalyProperties.Storage storage = properties.storage();
    switch (storage.backend()) {
      case S3 -> {
        AnomalyProperties.S3 s3 = storage.s3();
        if (!StringUtils.hasText(s3.bucket())) {
          throw new IllegalStateException(
              "anomaly.storage.s3.bucket must be set when anomaly.storage.backend is s3");
        }
        log.info("Using S3 artifact storage in bucket {} (prefix '{}')", s3.bucket(), s3.prefix());
        return new S3ArtifactStorage(s3Client.getObject(), s3.bucket(), s3.prefix(), mapper);
      }
      default -> {
        AnomalyProperties.Local local = storage.local();
        log.info("Using local artifact storage (models: {}, data: {})", local.modelFolder(),
            local.dataFolder());
        return new LocalArtifactStorage(Path.of(local.modelFolder()), Path.of(local.dataFolder()),
            mapper);
      }
    }
  }
}
