package dev.dripdirective.diversify;

import dev.langchain4j.data.embedding.Embedding;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A retrieved wardrobe item on its way to the composer.
 *
 * @param itemId the item identifier
 * @param embedding the item vector; null when the stored vector could not be parsed, in which case
 *     the selector ignores the candidate entirely
 * @param relevance similarity to the query in [0, 1]; null to let the selector compute it from the
 *     query embedding
 * @param metadata opaque tags (garment type, color, style), passed through untouched
 */
public record Candidate(
    String itemId,
    @Nullable Embedding embedding,
    @Nullable Double relevance,
    Map<String, String> metadata) {

  public Candidate {
    if (itemId == null || itemId.isBlank()) {
      throw new IllegalArgumentException("itemId must not be blank");
    }
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  /** Convenience constructor for candidates without metadata. */
  public Candidate(String itemId, @Nullable Embedding embedding, @Nullable Double relevance) {
    this(itemId, embedding, relevance, Map.of());
  }

  /** Relevance, or 0.0 when unknown. */
  public double relevanceOrZero() {
    return relevance == null ? 0.0 : relevance;
  }

  Candidate withRelevance(double resolved) {
    return new Candidate(itemId, embedding, resolved, metadata);
  }
}
