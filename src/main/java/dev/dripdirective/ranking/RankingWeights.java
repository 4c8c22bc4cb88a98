package dev.dripdirective.ranking;

/**
 * Tunable weights for {@link HybridRanker}.
 *
 * @param relevanceWeight weight of average retrieval relevance
 * @param confidenceWeight weight of composer confidence
 * @param neutralRelevance relevance assumed for a group none of whose members has a known score
 */
public record RankingWeights(
    double relevanceWeight, double confidenceWeight, double neutralRelevance) {

  public static final RankingWeights DEFAULTS = new RankingWeights(0.6, 0.4, 0.5);

  public RankingWeights {
    requireUnit("relevanceWeight", relevanceWeight);
    requireUnit("confidenceWeight", confidenceWeight);
    requireUnit("neutralRelevance", neutralRelevance);
    if (relevanceWeight == 0.0 && confidenceWeight == 0.0) {
      throw new IllegalArgumentException("relevanceWeight and confidenceWeight must not both be 0");
    }
  }

  private static void requireUnit(String name, double value) {
    if (!(value >= 0.0 && value <= 1.0)) {
      throw new IllegalArgumentException(name + " must be in [0.0, 1.0], got: " + value);
    }
  }
}
