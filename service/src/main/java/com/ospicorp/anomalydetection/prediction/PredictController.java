package com.ospicorp.anomalydetection.prediction;

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
import org.springframework.http.ProblemDetail;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
@Tag(name = "Prediction")
public class PredictController {
  private final PredictionService predictionService;

  public PredictController(PredictionService predictionService) {
    this.predictionService = predictionService;
  }

  @PostMapping("/predict/{series_id}")
  @Operation(summary = "Score a data point",
      description = "Flags the point as anomalous or not using the requested model version (0 = latest).")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Prediction",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = PredictResponse.class))),
      @ApiResponse(responseCode = "400", description = "Invalid series id or version",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "404", description = "No such model or artifact",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "422", description = "Invalid data point or version format",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public PredictResponse predict(
      @PathVariable("series_id") @Pattern(regexp = SeriesIds.SERIES_ID_REGEX)
      @Parameter(description = "Series identifier", example = "sensor-42") String seriesId,
      @RequestParam(name = "version", defaultValue = "0")
      @Parameter(description = "Model version: N, vN or VN; 0 selects the latest", example = "v1") String version,
      @RequestBody PredictRequest request) {
    return predictionService.predict(seriesId, ModelVersions.parse(version), request);
  }
}
