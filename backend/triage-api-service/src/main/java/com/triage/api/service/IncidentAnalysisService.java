package com.triage.api.service;

import com.triage.analysis.engine.IncidentAnalyzer;
import com.triage.analysis.model.AnalysisReport;
import com.triage.analysis.model.EventRecord;
import com.triage.analysis.model.MetricSample;
import com.triage.api.model.AnalysisResponse;
import com.triage.api.repo.IncidentEventRepository;
import com.triage.api.repo.IncidentRepository;
import com.triage.api.repo.MetricPointRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class IncidentAnalysisService {

  private static final Logger log = LoggerFactory.getLogger(IncidentAnalysisService.class);

  private final IncidentRepository incidents;
  private final MetricPointRepository metricPoints;
  private final IncidentEventRepository events;
  private final IncidentAnalyzer analyzer;
  private final MeterRegistry metrics;
  private final Counter analysesRun;
  private final Counter anomaliesDetected;
  private final Timer analysisDuration;

  public IncidentAnalysisService(IncidentRepository incidents,
                                 MetricPointRepository metricPoints,
                                 IncidentEventRepository events,
                                 IncidentAnalyzer analyzer,
                                 MeterRegistry metrics) {
    this.incidents = incidents;
    this.metricPoints = metricPoints;
    this.events = events;
    this.analyzer = analyzer;
    this.metrics = metrics;
    this.analysesRun = metrics.counter("triage_analyses_total");
    this.anomaliesDetected = metrics.counter("triage_anomalies_detected_total");
    this.analysisDuration = metrics.timer("triage_analysis_duration_seconds");
  }

  /**
   * Loads the incident's full history in one read-only transaction and runs the analysis over it.
   *
   * @throws IncidentNotFoundException if no incident has this id
   */
  @Transactional(readOnly = true)
  public AnalysisResponse analyze(String incidentId) {
    if (!incidents.existsById(incidentId)) {
      throw new IncidentNotFoundException(incidentId);
    }

    List<MetricSample> samples = metricPoints.findByIncidentIdOrderByMetricNameAscTsAsc(incidentId).stream()
        .map(p -> new MetricSample(p.getMetricName(), p.getTs(), p.getValue()))
        .toList();
    List<EventRecord> eventLog = events.findByIncidentIdOrderByTsAsc(incidentId).stream()
        .map(e -> new EventRecord(e.getId(), e.getEventType(), e.getTs(), e.getMeta()))
        .toList();

    Timer.Sample sample = Timer.start(metrics);
    AnalysisReport report;
    try {
      report = analyzer.analyze(incidentId, samples, eventLog);
    } finally {
      sample.stop(analysisDuration);
    }
    analysesRun.increment();
    anomaliesDetected.increment(report.anomalies().size());

    log.info("[analyze] incident={} points={} events={} anomalies={} causes={}",
        incidentId, samples.size(), eventLog.size(), report.anomalies().size(), report.likelyCauses().size());
    return toResponse(report);
  }

  private static AnalysisResponse toResponse(AnalysisReport report) {
    List<AnalysisResponse.AnomalyOut> anomalies = report.anomalies().stream()
        .map(a -> new AnalysisResponse.AnomalyOut(
            a.metricName(), a.ts(), a.value(), a.baselineMean(), a.baselineStd(), a.zScore()))
        .toList();
    List<AnalysisResponse.CauseOut> causes = report.likelyCauses().stream()
        .map(c -> new AnalysisResponse.CauseOut(
            c.eventType(), c.ts(), c.meta(), c.confidence(), c.evidence()))
        .toList();
    return new AnalysisResponse(report.incidentId(), anomalies, causes);
  }
}
