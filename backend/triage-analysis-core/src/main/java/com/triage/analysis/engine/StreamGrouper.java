package com.triage.analysis.engine;

import com.triage.analysis.model.MetricSample;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits an incident's metric samples into one time-ordered stream per metric name.
 * Streams appear in the order their first sample was seen.
 */
public class StreamGrouper {

  public Map<String, List<MetricSample>> group(List<MetricSample> samples) {
    Map<String, List<MetricSample>> byMetric = new LinkedHashMap<>();
    for (MetricSample s : samples) {
      byMetric.computeIfAbsent(s.metricName(), k -> new ArrayList<>()).add(s);
    }
    // List.sort is stable: equal timestamps keep arrival order
    for (List<MetricSample> stream : byMetric.values()) {
      stream.sort(Comparator.comparing(MetricSample::ts));
    }
    return byMetric;
  }
}
