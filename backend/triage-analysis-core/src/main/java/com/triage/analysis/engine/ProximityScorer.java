package com.triage.analysis.engine;

import com.triage.analysis.model.Anomaly;
import com.triage.analysis.model.EventRecord;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Links anomalies to events that happened within a fixed window around them.
 * Each event accumulates a linearly decayed weight: 1.0 at zero distance, 0.0 at the
 * window edge.
 */
public class ProximityScorer {

  static final Duration WINDOW = Duration.ofMinutes(5);

  private static final double WINDOW_SECONDS = WINDOW.toNanos() / 1e9;

  /**
   * @param anomalies chronologically ordered anomalies
   * @param events    incident events; those without a timestamp are ignored
   * @return accumulators keyed by event id, in the order each event was first touched
   */
  public Map<String, CauseAccumulator> score(List<Anomaly> anomalies, List<EventRecord> events) {
    List<EventRecord> timed = events.stream().filter(ev -> ev.ts() != null).toList();

    Map<String, CauseAccumulator> causes = new LinkedHashMap<>();
    for (Anomaly a : anomalies) {
      for (EventRecord ev : timed) {
        Duration dt = Duration.between(a.ts(), ev.ts()).abs();
        if (dt.compareTo(WINDOW) > 0) continue;

        double proximity = Math.max(0.0, 1.0 - (dt.toNanos() / 1e9) / WINDOW_SECONDS);
        causes.computeIfAbsent(ev.id(), k -> new CauseAccumulator(ev))
            .add(proximity, evidenceLine(a));
      }
    }
    return causes;
  }

  static String evidenceLine(Anomaly a) {
    return String.format(Locale.ROOT, "%s anomalous at %s (z=%.2f) near event",
        a.metricName(), a.ts(), a.zScore());
  }
}
