package com.triage.api.entity;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.Map;

@Entity
@Table(
  name = "events",
  indexes = {
    @Index(name = "ix_event_incident_ts", columnList = "incident_id,ts")
  },
  uniqueConstraints = {
    @UniqueConstraint(name = "uq_event", columnNames = {"incident_id", "ts", "event_type"})
  }
)
public class IncidentEvent {
  @Id @GeneratedValue(strategy = GenerationType.UUID)
  private String id;

  @Column(name = "incident_id", nullable = false) private String incidentId;
  @Column(nullable = false) private Instant ts;
  @Column(name = "event_type", nullable = false) private String eventType;

  @Convert(converter = MetaJsonConverter.class)
  @Column(name = "metadata", length = 8192)
  private Map<String, Object> meta;

  protected IncidentEvent() {}

  public IncidentEvent(String incidentId, Instant ts, String eventType, Map<String, Object> meta) {
    this.incidentId = incidentId;
    this.ts = ts;
    this.eventType = eventType;
    this.meta = meta;
  }

  public String getId() { return id; }
  public String getIncidentId() { return incidentId; }
  public Instant getTs() { return ts; }
  public String getEventType() { return eventType; }
  public Map<String, Object> getMeta() { return meta; }
}
