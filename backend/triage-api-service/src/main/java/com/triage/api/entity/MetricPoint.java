package com.triage.api.entity;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(
  name = "metric_points",
  indexes = {
    @Index(name = "ix_metric_incident_ts", columnList = "incident_id,ts"),
    @Index(name = "ix_metric_incident_name_ts", columnList = "incident_id,metric_name,ts")
  },
  uniqueConstraints = {
    @UniqueConstraint(name = "uq_metric_point", columnNames = {"incident_id", "ts", "metric_name"})
  }
)
public class MetricPoint {
  @Id @GeneratedValue(strategy = GenerationType.UUID)
  private String id;

  @Column(name = "incident_id", nullable = false) private String incidentId;
  @Column(nullable = false) private Instant ts;
  @Column(name = "metric_name", nullable = false) private String metricName;
  @Column(nullable = false) private double value;

  protected MetricPoint() {}

  public MetricPoint(String incidentId, Instant ts, String metricName, double value) {
    this.incidentId = incidentId;
    this.ts = ts;
    this.metricName = metricName;
    this.value = value;
  }

  public String getId() { return id; }
  public String getIncidentId() { return incidentId; }
  public Instant getTs() { return ts; }
  public String getMetricName() { return metricName; }
  public double getValue() { return value; }
}
