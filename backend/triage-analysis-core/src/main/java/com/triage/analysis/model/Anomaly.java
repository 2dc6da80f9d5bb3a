package com.triage.analysis.model;

import java.time.Instant;

public record Anomaly(
    String metricName,
    Instant ts,
    double value,
    double baselineMean,
    double baselineStd,
    double zScore
) {}
