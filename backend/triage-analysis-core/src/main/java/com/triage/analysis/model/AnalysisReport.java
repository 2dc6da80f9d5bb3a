package com.triage.analysis.model;

import java.util.List;

public record AnalysisReport(
    String incidentId,
    List<Anomaly> anomalies,
    List<LikelyCause> likelyCauses
) {}
