package dev.dripdirective.ranking;

import java.util.List;

/**
 * A composed group after hybrid ranking. {@code id} equals {@code rank}, so downstream consumers
 * can use either.
 *
 * @param id final identifier (same as rank)
 * @param rank 1 = best; ranks form a contiguous 1..M sequence
 * @param name display name
 * @param itemIds member wardrobe item ids
 * @param description free-text rationale
 * @param relevance average retrieval relevance of the members, rounded to 3 decimals
 * @param composerConfidence composer confidence after defaulting and clamping
 * @param fusedScore weighted fusion of relevance and confidence, rounded to 3 decimals
 */
public record RankedGroup(
    int id,
    int rank,
    String name,
    List<String> itemIds,
    String description,
    double relevance,
    double composerConfidence,
    double fusedScore) {

  public RankedGroup {
    itemIds = List.copyOf(itemIds);
  }
}
