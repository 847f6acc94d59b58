package com.ospicorp.anomalydetection.trainingdata;

import com.ospicorp.anomalydetection.error.ConflictException;
import com.ospicorp.anomalydetection.series.ModelVersions;
import com.ospicorp.anomalydetection.series.SeriesIds;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Pattern;
import java.util.Comparator;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
@Tag(name = "Training data")
public class TrainingDataController {
  private static final MediaType CSV_MEDIA_TYPE = CsvHttpMessageConverter.TEXT_CSV;

  private final TrainingDataService trainingDataService;

  public TrainingDataController(TrainingDataService trainingDataService) {
    this.trainingDataService = trainingDataService;
  }

  @GetMapping("/training-data/{series_id}")
  @Operation(summary = "Get training data",
      description = "Returns the points a model version was trained on, as JSON or CSV.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Training points",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = TrainingDataResponse.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "404", description = "No such model or artifact",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<?> trainingData(
      @PathVariable("series_id") @Pattern(regexp = SeriesIds.SERIES_ID_REGEX)
      @Parameter(description = "Series identifier", example = "sensor-42") String seriesId,
      @RequestParam(name = "version", defaultValue = "0")
      @Parameter(description = "Model version: N, vN or VN; 0 selects the latest") String version,
      @RequestParam(name = "format", required = false)
      @Parameter(description = "json or csv; overrides the Accept header") String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = selectMediaType(format, accept);
    TrainingDataResponse result = trainingDataService.load(seriesId, ModelVersions.parse(version));
    Object body = contentType.isCompatibleWith(CSV_MEDIA_TYPE) ? result.points() : result;
    return ResponseEntity.ok().contentType(contentType).body(body);
  }

  @GetMapping("/models/{series_id}/versions")
  @Operation(summary = "List model versions", description = "Committed versions of a series, oldest first.")
  public ModelVersionsResponse versions(
      @PathVariable("series_id") @Pattern(regexp = SeriesIds.SERIES_ID_REGEX)
      @Parameter(description = "Series identifier", example = "sensor-42") String seriesId) {
    return trainingDataService.versions(seriesId);
  }

  static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CSV_MEDIA_TYPE;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw new ConflictException("Invalid format value. Supported values: json,csv.");
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CSV_MEDIA_TYPE)) {
        return CSV_MEDIA_TYPE;
      }
    }
    return MediaType.APPLICATION_JSON;
  }
}
