package com.triage.analysis.engine;

import com.triage.analysis.model.Baseline;
import com.triage.analysis.model.MetricSample;

import java.util.List;
import java.util.Optional;

/**
 * Derives the static baseline of a metric stream from its earliest points.
 */
public class BaselineEstimator {

  static final int MIN_POINTS = 6;
  static final int MIN_BASELINE = 10;
  static final int MAX_BASELINE = 30;
  static final double MIN_STD = 1e-9;

  /**
   * Number of leading points used as baseline for a stream of {@code n} points:
   * {@code n / 5} clamped into [10, 30]. May exceed {@code n} for short streams.
   */
  public static int baselineSize(int n) {
    return Math.min(MAX_BASELINE, Math.max(MIN_BASELINE, n / 5));
  }

  /**
   * @return empty when the stream is too short or its baseline has no spread
   */
  public Optional<Baseline> estimate(List<MetricSample> stream) {
    int n = stream.size();
    if (n < MIN_POINTS) return Optional.empty();

    int baselineN = baselineSize(n);
    List<MetricSample> window = stream.subList(0, Math.min(baselineN, n));

    double sum = 0.0;
    for (MetricSample p : window) sum += p.value();
    double mean = sum / window.size();

    double var = 0.0;
    for (MetricSample p : window) {
      double d = p.value() - mean;
      var += d * d;
    }
    // population variance
    double std = Math.sqrt(var / window.size());
    if (std < MIN_STD) return Optional.empty();

    return Optional.of(new Baseline(baselineN, mean, std));
  }
}
