package com.triage.api.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AnalysisResponse(
    String incidentId,
    List<AnomalyOut> anomalies,
    List<CauseOut> likelyCauses
) {
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record AnomalyOut(
      String metricName,
      Instant ts,
      double value,
      double baselineMean,
      double baselineStd,
      double zScore
  ) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record CauseOut(
      String eventType,
      Instant ts,
      Map<String, Object> meta,
      double confidence,
      List<String> evidence
  ) {}
}
