package com.triage.analysis.engine;

import com.triage.analysis.model.Anomaly;
import com.triage.analysis.model.AnalysisReport;
import com.triage.analysis.model.EventRecord;
import com.triage.analysis.model.LikelyCause;
import com.triage.analysis.model.MetricSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs the full analysis over one incident snapshot: group streams, detect anomalies
 * against per-metric baselines, then rank events by proximity to those anomalies.
 * <p>
 * Stateless and safe to share between threads; every call works only on its arguments.
 */
public class IncidentAnalyzer {

  private static final Logger log = LoggerFactory.getLogger(IncidentAnalyzer.class);

  private final StreamGrouper grouper;
  private final AnomalyDetector detector;
  private final ProximityScorer scorer;
  private final CauseRanker ranker;

  public IncidentAnalyzer() {
    this(new StreamGrouper(), new AnomalyDetector(new BaselineEstimator()),
        new ProximityScorer(), new CauseRanker());
  }

  public IncidentAnalyzer(StreamGrouper grouper, AnomalyDetector detector,
                          ProximityScorer scorer, CauseRanker ranker) {
    this.grouper = grouper;
    this.detector = detector;
    this.scorer = scorer;
    this.ranker = ranker;
  }

  public AnalysisReport analyze(String incidentId, List<MetricSample> metrics, List<EventRecord> events) {
    Objects.requireNonNull(incidentId, "incidentId");
    Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(events, "events");

    Map<String, List<MetricSample>> streams = grouper.group(metrics);
    List<Anomaly> anomalies = detector.detect(streams);
    Map<String, CauseAccumulator> candidates = scorer.score(anomalies, events);
    List<LikelyCause> causes = ranker.rank(candidates.values());

    log.debug("Analyzed incident={} metrics={} streams={} events={} anomalies={} candidates={}",
        incidentId, metrics.size(), streams.size(), events.size(), anomalies.size(), candidates.size());
    return new AnalysisReport(incidentId, List.copyOf(anomalies), causes);
  }
}
