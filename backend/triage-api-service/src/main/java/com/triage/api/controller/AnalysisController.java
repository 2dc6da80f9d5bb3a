package com.triage.api.controller;

import com.triage.api.model.AnalysisResponse;
import com.triage.api.service.IncidentAnalysisService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AnalysisController {

  private final IncidentAnalysisService analysis;

  public AnalysisController(IncidentAnalysisService analysis) {
    this.analysis = analysis;
  }

  @GetMapping("/analysis/{incidentId}")
  public AnalysisResponse analyze(@PathVariable("incidentId") String incidentId) {
    return analysis.analyze(incidentId);
  }
}
