package com.triage.api.service;

import com.triage.api.entity.Incident;
import com.triage.api.entity.MetaJsonConverter;
import com.triage.api.model.IngestRequest;
import com.triage.api.model.IngestResponse;
import com.triage.api.repo.IncidentEventRepository;
import com.triage.api.repo.IncidentRepository;
import com.triage.api.repo.MetricPointRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

/**
 * Stores incoming samples and events. Rows already present for the incident (same timestamp and
 * metric name, or same timestamp and event type) are skipped rather than rejected, including rows
 * written by a concurrent ingest or earlier in the same batch.
 */
@Service
public class IngestService {

  private static final Logger log = LoggerFactory.getLogger(IngestService.class);
  private static final MetaJsonConverter META_JSON = new MetaJsonConverter();

  private final IncidentRepository incidents;
  private final MetricPointRepository metricPoints;
  private final IncidentEventRepository events;
  private final Counter metricsIngested;
  private final Counter eventsIngested;
  private final Counter incidentsCreated;

  public IngestService(IncidentRepository incidents,
                       MetricPointRepository metricPoints,
                       IncidentEventRepository events,
                       MeterRegistry metrics) {
    this.incidents = incidents;
    this.metricPoints = metricPoints;
    this.events = events;
    this.metricsIngested = metrics.counter("triage_metrics_ingested_total");
    this.eventsIngested = metrics.counter("triage_events_ingested_total");
    this.incidentsCreated = metrics.counter("triage_incidents_created_total");
  }

  @Transactional
  public IngestResponse ingest(IngestRequest req) {
    Incident incident = null;
    if (req.incidentId() != null) {
      incident = incidents.findById(req.incidentId()).orElse(null);
    }
    boolean created = incident == null;
    if (created) {
      String id = req.incidentId() != null ? req.incidentId() : UUID.randomUUID().toString();
      incident = incidents.save(new Incident(id, req.name(), req.source(), req.meta(), Instant.now()));
      incidentsCreated.increment();
    }
    String incidentId = incident.getId();

    int metricsInserted = insertMetrics(incidentId, req.metrics());
    int eventsInserted = insertEvents(incidentId, req.events());

    metricsIngested.increment(metricsInserted);
    eventsIngested.increment(eventsInserted);
    log.info("[ingest] incident={} created={} metrics={}/{} events={}/{}",
        incidentId, created, metricsInserted, req.metrics().size(), eventsInserted, req.events().size());
    return new IngestResponse(incidentId, metricsInserted, eventsInserted);
  }

  private int insertMetrics(String incidentId, List<IngestRequest.MetricIn> batch) {
    int inserted = 0;
    for (IngestRequest.MetricIn m : batch) {
      inserted += metricPoints.insertIfAbsent(
          UUID.randomUUID().toString(), incidentId, storedPrecision(m.ts()), m.metricName(), m.value());
    }
    if (inserted < batch.size()) {
      log.debug("Skipped {} duplicate metric points for incident={}", batch.size() - inserted, incidentId);
    }
    return inserted;
  }

  private int insertEvents(String incidentId, List<IngestRequest.EventIn> batch) {
    int inserted = 0;
    for (IngestRequest.EventIn e : batch) {
      inserted += events.insertIfAbsent(
          UUID.randomUUID().toString(), incidentId, storedPrecision(e.ts()), e.eventType(),
          META_JSON.convertToDatabaseColumn(e.meta()));
    }
    if (inserted < batch.size()) {
      log.debug("Skipped {} duplicate events for incident={}", batch.size() - inserted, incidentId);
    }
    return inserted;
  }

  // timestamp columns keep microseconds; truncate so the unique key compares what is stored
  private static Instant storedPrecision(Instant ts) {
    return ts.truncatedTo(ChronoUnit.MICROS);
  }
}
