package com.triage.analysis.engine;

import com.triage.analysis.model.Anomaly;
import com.triage.analysis.model.Baseline;
import com.triage.analysis.model.MetricSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class AnomalyDetector {

  private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

  static final double Z_THRESHOLD = 3.0;

  private final BaselineEstimator baselines;

  public AnomalyDetector(BaselineEstimator baselines) {
    this.baselines = baselines;
  }

  /**
   * Scores every post-baseline point of every stream and returns the outliers in
   * chronological order. Equal timestamps keep discovery order (stream order, then index).
   */
  public List<Anomaly> detect(Map<String, List<MetricSample>> streams) {
    List<Anomaly> anomalies = new ArrayList<>();
    for (Map.Entry<String, List<MetricSample>> e : streams.entrySet()) {
      String metricName = e.getKey();
      List<MetricSample> points = e.getValue();

      Optional<Baseline> maybeBaseline = baselines.estimate(points);
      if (maybeBaseline.isEmpty()) {
        log.debug("Skipping metric='{}' points={}: no usable baseline", metricName, points.size());
        continue;
      }
      Baseline b = maybeBaseline.get();

      int found = 0;
      for (int i = b.size(); i < points.size(); i++) {
        MetricSample p = points.get(i);
        double z = (p.value() - b.mean()) / b.std();
        if (Math.abs(z) >= Z_THRESHOLD) {
          anomalies.add(new Anomaly(metricName, p.ts(), p.value(), b.mean(), b.std(), z));
          found++;
        }
      }
      if (log.isDebugEnabled()) {
        log.debug("Metric check: metric='{}' points={} baseline={} mean={} std={} anomalies={}",
            metricName, points.size(), b.size(),
            String.format("%.2f", b.mean()), String.format("%.2f", b.std()), found);
      }
    }
    anomalies.sort(Comparator.comparing(Anomaly::ts));
    return anomalies;
  }
}
