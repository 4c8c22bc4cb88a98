package dev.dripdirective.ranking;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Pure static utility fusing retrieval relevance with composer confidence.
 *
 * <p>Per group:
 *
 * <ol>
 *   <li>{@code avgRelevance} = mean of the members' retrieval scores. A member absent from the
 *       score map contributes 0; if no member is known at all the group gets the neutral relevance.
 *   <li>{@code confidence} = composer confidence clamped to [0, 1]; missing or NaN becomes 0.5.
 *   <li>{@code fused = relevanceWeight * avgRelevance + confidenceWeight * confidence}.
 * </ol>
 *
 * <p>Relevance, confidence and fused score are reported rounded to 3 decimals. Groups are
 * stable-sorted by the fused score (at the 3-decimal precision it is reported with)
 * descending, so equal scores keep the composer's order. Ranks are 1..M and each group's id is
 * rewritten to its rank.
 */
public final class HybridRanker {

  private static final double NEUTRAL_CONFIDENCE = 0.5;

  private HybridRanker() {}

  /**
   * Ranks composed groups.
   *
   * @param groups groups in composer order
   * @param relevanceByItemId retrieval relevance per item id
   * @param weights fusion weights
   * @return ranked groups, best first; empty if {@code groups} is empty
   */
  public static List<RankedGroup> rank(
      List<ComposedGroup> groups, Map<String, Double> relevanceByItemId, RankingWeights weights) {
    if (groups.isEmpty()) {
      return List.of();
    }

    List<Scored> scored = new ArrayList<>(groups.size());
    for (ComposedGroup group : groups) {
      double relevance = averageRelevance(group, relevanceByItemId, weights.neutralRelevance());
      double confidence = confidence(group);
      double fused =
          weights.relevanceWeight() * relevance + weights.confidenceWeight() * confidence;
      scored.add(new Scored(group, round3(relevance), round3(confidence), round3(fused)));
    }

    // List.sort is stable
    scored.sort(Comparator.comparingDouble(Scored::fused).reversed());

    List<RankedGroup> ranked = new ArrayList<>(scored.size());
    for (int i = 0; i < scored.size(); i++) {
      Scored s = scored.get(i);
      int rank = i + 1;
      ranked.add(
          new RankedGroup(
              rank,
              rank,
              s.group().name(),
              s.group().itemIds(),
              s.group().description(),
              s.relevance(),
              s.confidence(),
              s.fused()));
    }
    return ranked;
  }

  /** {@link #rank(List, Map, RankingWeights)} with {@link RankingWeights#DEFAULTS}. */
  public static List<RankedGroup> rank(
      List<ComposedGroup> groups, Map<String, Double> relevanceByItemId) {
    return rank(groups, relevanceByItemId, RankingWeights.DEFAULTS);
  }

  static double averageRelevance(
      ComposedGroup group, Map<String, Double> relevanceByItemId, double neutral) {
    if (group.itemIds().isEmpty()) {
      return neutral;
    }
    double sum = 0.0;
    boolean anyKnown = false;
    for (String itemId : group.itemIds()) {
      Double score = relevanceByItemId.get(itemId);
      if (score != null) {
        sum += score;
        anyKnown = true;
      }
    }
    return anyKnown ? sum / group.itemIds().size() : neutral;
  }

  private static double confidence(ComposedGroup group) {
    Double raw = group.confidence();
    if (raw == null || raw.isNaN()) {
      return NEUTRAL_CONFIDENCE;
    }
    return Math.max(0.0, Math.min(1.0, raw));
  }

  static double round3(double value) {
    return Math.round(value * 1000.0) / 1000.0;
  }

  private record Scored(ComposedGroup group, double relevance, double confidence, double fused) {}
}
