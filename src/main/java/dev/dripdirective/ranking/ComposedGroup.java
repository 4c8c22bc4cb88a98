package dev.dripdirective.ranking;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * One outfit as returned by the external composer.
 *
 * @param id the composer's own identifier; replaced by the rank after ranking
 * @param name display name
 * @param itemIds member wardrobe item ids
 * @param confidence composer-assigned quality score, nominally in [0, 1]; opaque and not assumed to
 *     be calibrated. Null when the composer gave none.
 * @param description free-text rationale
 */
public record ComposedGroup(
    int id, String name, List<String> itemIds, @Nullable Double confidence, String description) {

  public ComposedGroup {
    itemIds = itemIds == null ? List.of() : List.copyOf(itemIds);
    name = name == null ? "" : name;
    description = description == null ? "" : description;
  }
}
