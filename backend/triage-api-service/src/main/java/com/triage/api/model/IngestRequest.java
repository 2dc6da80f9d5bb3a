package com.triage.api.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One batch of samples and events for an incident. When {@code incidentId} is absent or
 * unknown a new incident is created from {@code name}, {@code source} and {@code meta}.
 * Timestamps without an offset are read as UTC.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IngestRequest(
    String incidentId,
    String name,
    String source,
    Map<String, Object> meta,
    List<@Valid @NotNull MetricIn> metrics,
    List<@Valid @NotNull EventIn> events
) {
  public IngestRequest {
    metrics = metrics == null ? List.of() : metrics;
    events = events == null ? List.of() : events;
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record MetricIn(
      @NotNull @JsonDeserialize(using = UtcInstantDeserializer.class) Instant ts,
      @NotBlank String metricName,
      @NotNull Double value
  ) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record EventIn(
      @NotNull @JsonDeserialize(using = UtcInstantDeserializer.class) Instant ts,
      @NotBlank String eventType,
      Map<String, Object> meta
  ) {}
}
