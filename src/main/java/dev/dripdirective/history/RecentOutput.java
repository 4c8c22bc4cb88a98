package dev.dripdirective.history;

import dev.langchain4j.data.embedding.Embedding;
import java.time.Instant;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Decoded view of a {@link RecommendationRecord}.
 *
 * @param recordId the history record id
 * @param query the request text
 * @param itemGroups item ids per outfit, in the order they were ranked
 * @param digestEmbedding digest vector, or null if absent or unparsable
 * @param createdAt commit time
 */
public record RecentOutput(
    long recordId,
    String query,
    List<List<String>> itemGroups,
    @Nullable Embedding digestEmbedding,
    Instant createdAt) {

  public RecentOutput {
    itemGroups = itemGroups.stream().map(List::copyOf).toList();
  }
}
