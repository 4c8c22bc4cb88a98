package dev.dripdirective.store;

import dev.langchain4j.data.embedding.Embedding;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * One search hit.
 *
 * @param itemId the caller's item identifier
 * @param similarity cosine similarity to the query, in [-1, 1]
 * @param embedding the stored vector, or null if the backend did not return a usable one
 * @param metadata opaque tags stored with the item
 */
public record SimilarityMatch(
    String itemId,
    double similarity,
    @Nullable Embedding embedding,
    Map<String, String> metadata) {

  public SimilarityMatch {
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }
}
