package com.triage.api.repo;

import com.triage.api.entity.IncidentEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface IncidentEventRepository extends JpaRepository<IncidentEvent, String> {
  List<IncidentEvent> findByIncidentIdOrderByTsAsc(String incidentId);

  /** Returns 1 when the row was stored, 0 when an event of that type already exists at that ts. */
  @Modifying
  @Query(value = """
      INSERT INTO events (id, incident_id, ts, event_type, metadata)
      VALUES (:id, :incidentId, :ts, :eventType, :metadata)
      ON CONFLICT DO NOTHING
      """, nativeQuery = true)
  int insertIfAbsent(@Param("id") String id,
                     @Param("incidentId") String incidentId,
                     @Param("ts") Instant ts,
                     @Param("eventType") String eventType,
                     @Param("metadata") String metadataJson);
}
