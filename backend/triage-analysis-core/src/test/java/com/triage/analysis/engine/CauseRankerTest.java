package com.triage.analysis.engine;

import com.triage.analysis.model.EventRecord;
import com.triage.analysis.model.LikelyCause;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CauseRankerTest {

  private static final Instant T = Instant.parse("2024-05-01T12:00:00Z");

  private final CauseRanker ranker = new CauseRanker();

  @Test
  void noCandidatesGiveNoCauses() {
    assertThat(ranker.rank(List.of())).isEmpty();
  }

  @Test
  void normalizesAgainstTopScorerAndRoundsToThreeDecimals() {
    List<CauseAccumulator> candidates = List.of(
        candidate("flag", 1.0),
        candidate("deploy", 3.0),
        candidate("config", 2.0));

    List<LikelyCause> causes = ranker.rank(candidates);

    assertThat(causes).extracting(LikelyCause::eventType).containsExactly("deploy", "config", "flag");
    assertThat(causes).extracting(LikelyCause::confidence).containsExactly(1.0, 0.667, 0.333);
  }

  @Test
  void tiesKeepDiscoveryOrder() {
    List<LikelyCause> causes = ranker.rank(List.of(
        candidate("a", 0.5),
        candidate("b", 1.0),
        candidate("c", 0.5),
        candidate("d", 1.0)));

    assertThat(causes).extracting(LikelyCause::eventType).containsExactly("b", "d", "a", "c");
  }

  @Test
  void keepsOnlyTopFive() {
    List<CauseAccumulator> candidates = new ArrayList<>();
    for (int i = 1; i <= 8; i++) candidates.add(candidate("e" + i, i));

    List<LikelyCause> causes = ranker.rank(candidates);

    assertThat(causes).extracting(LikelyCause::eventType).containsExactly("e8", "e7", "e6", "e5", "e4");
    assertThat(causes.get(0).confidence()).isEqualTo(1.0);
  }

  @Test
  void zeroTopScoreDoesNotDivideByZero() {
    List<LikelyCause> causes = ranker.rank(List.of(candidate("edge", 0.0)));

    assertThat(causes).hasSize(1);
    assertThat(causes.get(0).confidence()).isEqualTo(0.0);
  }

  @Test
  void carriesEventFieldsAndEvidenceThrough() {
    Map<String, Object> meta = Map.of("version", "1.4.2");
    CauseAccumulator acc = new CauseAccumulator(new EventRecord("ev-1", "deploy", T, meta));
    acc.add(0.8, "errors anomalous at 2024-05-01T12:00:00Z (z=9.00) near event");

    LikelyCause cause = ranker.rank(List.of(acc)).get(0);

    assertThat(cause.eventType()).isEqualTo("deploy");
    assertThat(cause.ts()).isEqualTo(T);
    assertThat(cause.meta()).isEqualTo(meta);
    assertThat(cause.evidence()).containsExactly("errors anomalous at 2024-05-01T12:00:00Z (z=9.00) near event");
  }

  private static CauseAccumulator candidate(String type, double score) {
    CauseAccumulator acc = new CauseAccumulator(new EventRecord(type, type, T, null));
    acc.add(score, type + " evidence");
    return acc;
  }
}
