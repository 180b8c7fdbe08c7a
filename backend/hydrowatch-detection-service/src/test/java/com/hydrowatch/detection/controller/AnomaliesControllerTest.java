package com.hydrowatch.detection.controller;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.hydrowatch.detection.controller.dto.AnomaliesResponse;
import com.hydrowatch.detection.controller.dto.AnomalyEventView;
import com.hydrowatch.detection.exception.GlobalExceptionHandler;
import com.hydrowatch.detection.service.AnomalyQueryService;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@DisplayName("AnomaliesController Tests")
class AnomaliesControllerTest {

  private AnomalyQueryService queries;
  private MockMvc mvc;

  @BeforeEach
  void setUp() {
    queries = mock(AnomalyQueryService.class);
    mvc = MockMvcBuilders.standaloneSetup(new AnomaliesController(queries))
        .setControllerAdvice(new GlobalExceptionHandler())
        .setMessageConverters(new MappingJackson2HttpMessageConverter(Jackson2ObjectMapperBuilder.json()
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE).build()))
        .build();
  }

  @Test
  @DisplayName("Filters are passed to the query service")
  void filtered() throws Exception {
    Instant since = Instant.parse("2026-03-01T00:00:00Z");
    AnomalyEventView view = new AnomalyEventView("1", "node-7", "leak", "high", 0.7, "Pressure history indicates a leak",
        "history", null, null, since.plusSeconds(60));
    when(queries.latest(eq(0), eq(5), eq("node-7"), eq("leak"), eq(since)))
        .thenReturn(new AnomaliesResponse(List.of(view), new AnomaliesResponse.Meta(3, 0, 5)));

    mvc.perform(get("/api/anomalies").param("limit", "5").param("device_id", "node-7")
            .param("type", "leak").param("since", "2026-03-01T00:00:00Z"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.anomalies[0].device_id").value("node-7"))
        .andExpect(jsonPath("$.anomalies[0].anomaly_type").value("leak"))
        .andExpect(jsonPath("$.meta.anomalies_today").value(3));
  }

  @Test
  @DisplayName("Unfiltered listing")
  void unfiltered() throws Exception {
    when(queries.latest(eq(0), eq(20), isNull(), isNull(), isNull()))
        .thenReturn(new AnomaliesResponse(List.of(), new AnomaliesResponse.Meta(0, 0, 20)));
    mvc.perform(get("/api/anomalies"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.anomalies").isEmpty());
  }

  @Test
  @DisplayName("A malformed since parameter is a 400")
  void badSince() throws Exception {
    mvc.perform(get("/api/anomalies").param("since", "last week"))
        .andExpect(status().isBadRequest());
  }
}
