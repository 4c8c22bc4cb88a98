package dev.dripdirective.recommend;

import dev.dripdirective.ranking.RankedGroup;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Text summary of a finalized recommendation. Its embedding is stored in the tenant's
 * recommendation partition and penalises near-repeats in later requests.
 *
 * <p>Format: {@code Query: <q> | Outfits recommended: | <name>: <description> | ... | Items used:
 * <id>, <id>}. Item ids are listed once, in ranked order.
 */
public final class RecommendationDigest {

  private static final String SEPARATOR = " | ";

  private RecommendationDigest() {}

  public static String text(String query, List<RankedGroup> groups) {
    List<String> parts = new ArrayList<>();
    parts.add("Query: " + query);
    parts.add("Outfits recommended:");
    Set<String> itemIds = new LinkedHashSet<>();
    for (RankedGroup group : groups) {
      parts.add(group.name() + ": " + group.description());
      itemIds.addAll(group.itemIds());
    }
    parts.add("Items used: " + String.join(", ", itemIds));
    return String.join(SEPARATOR, parts);
  }
}
