package com.ospicorp.anomalydetection.training;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ospicorp.anomalydetection.config.AnomalyProperties;
import com.ospicorp.anomalydetection.config.SecurityConfig;
import com.ospicorp.anomalydetection.error.ConflictException;
import com.ospicorp.anomalydetection.error.UnavailableException;
import com.ospicorp.anomalydetection.error.ValidationException;
import com.ospicorp.anomalydetection.health.LatencyTracker;
import com.ospicorp.anomalydetection.series.TimeSeriesValidator;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(TrainController.class)
@Import({SecurityConfig.class, LatencyTracker.class})
@EnableConfigurationProperties(AnomalyProperties.class)
class TrainControllerTest {
  private static final String BODY = """
      {"timestamps": [1700000000, 1700000001, 1700000002], "values": [1.0, 1.1, 0.9]}
      """;

  @Autowired
  private MockMvc mockMvc;

  @Autowired
  private LatencyTracker latencyTracker;

  @MockBean
  private TrainingService trainingService;

  @Test
  void trainsAndReportsVersionAsString() throws Exception {
    when(trainingService.train(eq("s1"), any(TrainRequest.class)))
        .thenReturn(new TrainResponse("s1", "1", 3));

    mockMvc.perform(post("/fit/s1").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.series_id").value("s1"))
        .andExpect(jsonPath("$.version").value("1"))
        .andExpect(jsonPath("$.points_used").value(3));

    assertThat(latencyTracker.snapshot(LatencyTracker.Operation.TRAINING).avg()).isPositive();
  }

  @Test
  void validationErrorsAreUnprocessable() throws Exception {
    when(trainingService.train(eq("s1"), any(TrainRequest.class))).thenThrow(new ValidationException(
        List.of("Input list cannot contain constant values only.")));

    mockMvc.perform(post("/fit/s1").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_PROBLEM_JSON))
        .andExpect(jsonPath("$.detail").value("Input list cannot contain constant values only."))
        .andExpect(jsonPath("$.errors[0]").value("Input list cannot contain constant values only."))
        .andExpect(jsonPath("$.path").value("/fit/s1"));
  }

  @Test
  void fractionalOrNonNumericTimestampsAreUnprocessable() throws Exception {
    when(trainingService.train(eq("s1"), any(TrainRequest.class))).thenAnswer(invocation -> {
      TrainRequest request = invocation.getArgument(1);
      TimeSeriesValidator.forTraining(request.timestamps(), request.values(), 3).orElseThrow();
      return new TrainResponse("s1", "1", 3);
    });

    for (String timestamps : List.of("[0.5, 1.5, 2.5]", "[true, false, true]", "[\"1\", \"2\", \"3\"]")) {
      mockMvc.perform(post("/fit/s1").contentType(MediaType.APPLICATION_JSON)
              .content("{\"timestamps\": " + timestamps + ", \"values\": [1.0, 1.1, 0.9]}"))
          .andExpect(status().isUnprocessableEntity())
          .andExpect(jsonPath("$.errors[0]")
              .value("Input list must contain only integer Unix timestamps."));
    }
  }

  @Test
  void malformedJsonIsUnprocessable() throws Exception {
    mockMvc.perform(post("/fit/s1").contentType(MediaType.APPLICATION_JSON).content("{\"timestamps\": ["))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.detail").value("Malformed request body."));
  }

  @Test
  void invalidSeriesIdIsBadRequest() throws Exception {
    when(trainingService.train(eq("a..b"), any(TrainRequest.class)))
        .thenThrow(new ConflictException("series_id cannot contain consecutive dots."));

    mockMvc.perform(post("/fit/a..b").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Bad Request"));
  }

  @Test
  void exhaustedPoolAsksClientToRetry() throws Exception {
    when(trainingService.train(eq("s1"), any(TrainRequest.class)))
        .thenThrow(new UnavailableException("Database connection pool exhausted; retry later.", 1, null));

    mockMvc.perform(post("/fit/s1").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isServiceUnavailable())
        .andExpect(header().string("Retry-After", "1"));
  }

  @Test
  void unexpectedFailuresDoNotLeakDetails() throws Exception {
    when(trainingService.train(eq("s1"), any(TrainRequest.class)))
        .thenThrow(new IllegalStateException("connection string with password"));

    mockMvc.perform(post("/fit/s1").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.detail").value("Unexpected server error."));
  }
}
