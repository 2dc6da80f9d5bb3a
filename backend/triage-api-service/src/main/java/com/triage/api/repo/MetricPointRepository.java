package com.triage.api.repo;

import com.triage.api.entity.MetricPoint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface MetricPointRepository extends JpaRepository<MetricPoint, String> {
  List<MetricPoint> findByIncidentIdOrderByMetricNameAscTsAsc(String incidentId);

  /** Returns 1 when the row was stored, 0 when a point with the same metric and ts already exists. */
  @Modifying
  @Query(value = """
      INSERT INTO metric_points (id, incident_id, ts, metric_name, value)
      VALUES (:id, :incidentId, :ts, :metricName, :value)
      ON CONFLICT DO NOTHING
      """, nativeQuery = true)
  int insertIfAbsent(@Param("id") String id,
                     @Param("incidentId") String incidentId,
                     @Param("ts") Instant ts,
                     @Param("metricName") String metricName,
                     @Param("value") double value);
}
