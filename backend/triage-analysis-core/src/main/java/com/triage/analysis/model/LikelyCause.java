package com.triage.analysis.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record LikelyCause(
    String eventType,
    Instant ts,
    Map<String, Object> meta,
    double confidence,
    List<String> evidence
) {}
