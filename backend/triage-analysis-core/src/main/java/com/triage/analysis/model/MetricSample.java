package com.triage.analysis.model;

import java.time.Instant;

public record MetricSample(
    String metricName,
    Instant ts,
    double value
) {}
