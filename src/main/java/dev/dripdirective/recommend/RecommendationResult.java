package dev.dripdirective.recommend;

import dev.dripdirective.diversify.Candidate;
import dev.dripdirective.ranking.RankedGroup;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Output of {@link RecommendationEngine#recommend}.
 *
 * @param outcome how the request ended
 * @param groups ranked groups, best first; empty unless {@code outcome} is {@code RANKED}
 * @param selected the diverse candidates handed to the composer
 * @param recordId history record id when the result was committed, otherwise null
 */
public record RecommendationResult(
    RecommendationOutcome outcome,
    List<RankedGroup> groups,
    List<Candidate> selected,
    @Nullable Long recordId) {

  static final String INSUFFICIENT_ITEMS =
      "Insufficient distinct items to build a recommendation. "
          + "Add more items to your wardrobe or try a different request.";
  static final String TEMPORARILY_UNAVAILABLE =
      "Insufficient distinct items could be retrieved right now. Please try again shortly.";

  public RecommendationResult {
    groups = List.copyOf(groups);
    selected = List.copyOf(selected);
  }

  static RecommendationResult empty(RecommendationOutcome outcome, List<Candidate> selected) {
    return new RecommendationResult(outcome, List.of(), selected, null);
  }

  public boolean isRanked() {
    return outcome == RecommendationOutcome.RANKED;
  }

  /** Message to show the user instead of results, or empty when there are results to show. */
  public Optional<String> userMessage() {
    switch (outcome) {
      case RANKED:
        return Optional.empty();
      case STORE_UNAVAILABLE:
      case EMBEDDING_UNAVAILABLE:
      case ABANDONED:
        return Optional.of(TEMPORARILY_UNAVAILABLE);
      default:
        return Optional.of(INSUFFICIENT_ITEMS);
    }
  }
}
