package com.triage.analysis.engine;

import com.triage.analysis.model.EventRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Running proximity score and evidence for one event, local to a single analysis.
 */
public final class CauseAccumulator {

  static final int MAX_EVIDENCE = 5;

  private final EventRecord event;
  private final List<String> evidence = new ArrayList<>(MAX_EVIDENCE);
  private double score;

  CauseAccumulator(EventRecord event) {
    this.event = event;
  }

  void add(double proximity, String line) {
    score += proximity;
    if (evidence.size() < MAX_EVIDENCE) evidence.add(line);
  }

  public EventRecord getEvent() { return event; }
  public double getScore() { return score; }
  public List<String> getEvidence() { return Collections.unmodifiableList(evidence); }
}
