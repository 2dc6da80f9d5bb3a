package com.triage.analysis.engine;

import com.triage.analysis.model.EventRecord;
import com.triage.analysis.model.LikelyCause;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Turns accumulated proximity scores into confidences relative to the top scorer.
 */
public class CauseRanker {

  static final int TOP_K = 5;

  public List<LikelyCause> rank(Collection<CauseAccumulator> candidates) {
    if (candidates.isEmpty()) return List.of();

    double maxScore = candidates.stream().mapToDouble(CauseAccumulator::getScore).max().orElse(0.0);
    if (maxScore == 0.0) maxScore = 1.0;

    List<LikelyCause> causes = new ArrayList<>(candidates.size());
    for (CauseAccumulator c : candidates) {
      EventRecord ev = c.getEvent();
      causes.add(new LikelyCause(
          ev.eventType(),
          ev.ts(),
          ev.meta(),
          round3(c.getScore() / maxScore),
          List.copyOf(c.getEvidence())
      ));
    }
    // stable: ties keep first-discovery order
    causes.sort(Comparator.comparingDouble(LikelyCause::confidence).reversed());
    return causes.size() > TOP_K ? List.copyOf(causes.subList(0, TOP_K)) : List.copyOf(causes);
  }

  static double round3(double v) {
    return new BigDecimal(v).setScale(3, RoundingMode.HALF_EVEN).doubleValue();
  }
}
