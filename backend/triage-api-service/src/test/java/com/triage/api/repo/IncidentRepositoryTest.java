package com.triage.api.repo;

import com.triage.api.entity.Incident;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class IncidentRepositoryTest {

  private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

  @Autowired
  private TestEntityManager em;

  @Autowired
  private IncidentRepository incidents;

  @Test
  void savingNewIncidentWithAssignedIdKeepsTheSameInstance() {
    Incident incident = new Incident("incident_789", "db failover", "pagerduty", Map.of("sev", 1), T0);
    assertThat(incident.isNew()).isTrue();

    Incident saved = incidents.save(incident);

    // merge would hand back a managed copy; persist manages the instance it was given
    assertThat(saved).isSameAs(incident);
    assertThat(saved.isNew()).isFalse();
  }

  @Test
  void loadedIncidentIsNotNew() {
    incidents.saveAndFlush(new Incident("incident_790", null, null, null, T0));
    em.clear();

    Incident loaded = incidents.findById("incident_790").orElseThrow();

    assertThat(loaded.isNew()).isFalse();
    assertThat(loaded.getCreatedAt()).isEqualTo(T0);
  }
}
