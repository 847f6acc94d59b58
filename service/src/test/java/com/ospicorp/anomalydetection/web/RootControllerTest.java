package com.ospicorp.anomalydetection.web;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ospicorp.anomalydetection.config.AnomalyProperties;
import com.ospicorp.anomalydetection.config.SecurityConfig;
import com.ospicorp.anomalydetection.health.LatencyTracker;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(RootController.class)
@Import({SecurityConfig.class, LatencyTracker.class})
@EnableConfigurationProperties(AnomalyProperties.class)
class RootControllerTest {

  @Autowired
  private MockMvc mockMvc;

  @Test
  void rootAndPingRespond() throws Exception {
    mockMvc.perform(get("/"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ok"))
        .andExpect(header().string("X-Content-Type-Options", "nosniff"));
    mockMvc.perform(get("/v1/ping"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.pong").value(true));
  }

  @Test
  void unknownPathIsProblemNotFound() throws Exception {
    mockMvc.perform(get("/does-not-exist"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.status").value(404))
        .andExpect(jsonPath("$.instance").value("/does-not-exist"));
  }

  @Test
  void wrongMethodIsReportedAsSuch() throws Exception {
    mockMvc.perform(put("/v1/ping"))
        .andExpect(status().isMethodNotAllowed());
  }
}
