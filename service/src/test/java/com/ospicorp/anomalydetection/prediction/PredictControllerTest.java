package com.ospicorp.anomalydetection.prediction;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ospicorp.anomalydetection.config.AnomalyProperties;
import com.ospicorp.anomalydetection.config.SecurityConfig;
import com.ospicorp.anomalydetection.error.InternalException;
import com.ospicorp.anomalydetection.error.NotFoundException;
import com.ospicorp.anomalydetection.health.LatencyTracker;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(PredictController.class)
@Import({SecurityConfig.class, LatencyTracker.class})
@EnableConfigurationProperties(AnomalyProperties.class)
class PredictControllerTest {
  private static final String BODY = "{\"timestamp\": \"1700000003\", \"value\": 100.0}";

  @Autowired
  private MockMvc mockMvc;

  @MockBean
  private PredictionService predictionService;

  @Test
  void defaultsToLatestVersion() throws Exception {
    when(predictionService.predict(eq("s1"), eq(0), any(PredictRequest.class)))
        .thenReturn(new PredictResponse(true, "1"));

    mockMvc.perform(post("/predict/s1").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.anomaly").value(true))
        .andExpect(jsonPath("$.model_version").value("1"));
  }

  @Test
  void acceptsPrefixedVersions() throws Exception {
    when(predictionService.predict(eq("s1"), eq(2), any(PredictRequest.class)))
        .thenReturn(new PredictResponse(false, "2"));

    mockMvc.perform(post("/predict/s1").param("version", "v2")
            .contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.model_version").value("2"));
  }

  @Test
  void numericTimestampIsCoercedToItsDigits() throws Exception {
    PredictRequest expected = new PredictRequest("1700000003", 1.05);
    when(predictionService.predict("s1", 0, expected)).thenReturn(new PredictResponse(false, "1"));

    mockMvc.perform(post("/predict/s1").contentType(MediaType.APPLICATION_JSON)
            .content("{\"timestamp\": 1700000003, \"value\": 1.05}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.anomaly").value(false));
  }

  @Test
  void versionWithoutDigitsIsUnprocessable() throws Exception {
    mockMvc.perform(post("/predict/s1").param("version", "latest")
            .contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.errors[0]").value("Version must contain at least one digit."));
    verify(predictionService, never()).predict(anyString(), anyInt(), any());
  }

  @Test
  void missingModelIsNotFound() throws Exception {
    when(predictionService.predict(eq("ghost"), eq(0), any(PredictRequest.class)))
        .thenThrow(new NotFoundException("No trained model found for series_id 'ghost'."));

    mockMvc.perform(post("/predict/ghost").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.detail").value("No trained model found for series_id 'ghost'."));
  }

  @Test
  void inconsistentRecordIsServerError() throws Exception {
    when(predictionService.predict(eq("s1"), eq(3), any(PredictRequest.class)))
        .thenThrow(new InternalException("Model path is missing for series_id 's1' and version '3'."));

    mockMvc.perform(post("/predict/s1").param("version", "3")
            .contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.detail").value("Model path is missing for series_id 's1' and version '3'."));
  }
}
