package com.ospicorp.anomalydetection.trainingdata;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

public record ModelVersionsResponse(
    @JsonProperty("series_id") String seriesId,
    List<VersionEntry> versions) {

  public record VersionEntry(
      int version,
      @JsonProperty("created_at") Instant createdAt,
      @JsonProperty("updated_at") Instant updatedAt) {}
}
