package com.ospicorp.anomalydetection.training;

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
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
@Tag(name = "Training")
public class TrainController {
  private final TrainingService trainingService;

  public TrainController(TrainingService trainingService) {
    this.trainingService = trainingService;
  }

  @PostMapping("/fit/{series_id}")
  @Operation(summary = "Train a model",
      description = "Fits an anomaly model on the given points and registers it as the next version of the series.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Model trained",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = TrainResponse.class))),
      @ApiResponse(responseCode = "400", description = "Invalid series id",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "422", description = "Invalid training data",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "503", description = "Database temporarily unavailable",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public TrainResponse fit(
      @PathVariable("series_id") @Pattern(regexp = SeriesIds.SERIES_ID_REGEX)
      @Parameter(description = "Series identifier", example = "sensor-42") String seriesId,
      @RequestBody TrainRequest request) {
    return trainingService.train(seriesId, request);
  }
}
