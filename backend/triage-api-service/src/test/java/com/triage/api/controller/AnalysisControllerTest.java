package com.triage.api.controller;

import com.triage.api.model.AnalysisResponse;
import com.triage.api.service.IncidentAnalysisService;
import com.triage.api.service.IncidentNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AnalysisController.class)
class AnalysisControllerTest {

  @Autowired
  private MockMvc mvc;

  @MockBean
  private IncidentAnalysisService analysis;

  @Test
  void returnsReportWithSnakeCaseFields() throws Exception {
    Instant spike = Instant.parse("2024-05-01T12:10:00Z");
    when(analysis.analyze("inc-1")).thenReturn(new AnalysisResponse(
        "inc-1",
        List.of(new AnalysisResponse.AnomalyOut("error_rate", spike, 5.0, 1.0, 0.1, 40.0)),
        List.of(new AnalysisResponse.CauseOut("deploy", spike.plusSeconds(120), Map.of("sha", "abc123"), 1.0,
            List.of("error_rate anomalous at 2024-05-01T12:10:00Z (z=40.00) near event")))));

    mvc.perform(get("/analysis/inc-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.incident_id").value("inc-1"))
        .andExpect(jsonPath("$.anomalies[0].metric_name").value("error_rate"))
        .andExpect(jsonPath("$.anomalies[0].ts").value("2024-05-01T12:10:00Z"))
        .andExpect(jsonPath("$.anomalies[0].baseline_mean").value(1.0))
        .andExpect(jsonPath("$.anomalies[0].baseline_std").value(0.1))
        .andExpect(jsonPath("$.anomalies[0].z_score").value(40.0))
        .andExpect(jsonPath("$.likely_causes[0].event_type").value("deploy"))
        .andExpect(jsonPath("$.likely_causes[0].meta.sha").value("abc123"))
        .andExpect(jsonPath("$.likely_causes[0].confidence").value(1.0))
        .andExpect(jsonPath("$.likely_causes[0].evidence.length()").value(1));
  }

  @Test
  void unknownIncidentIs404() throws Exception {
    when(analysis.analyze("nope")).thenThrow(new IncidentNotFoundException("nope"));

    mvc.perform(get("/analysis/nope"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.detail").value("Incident not found"));
  }
}
