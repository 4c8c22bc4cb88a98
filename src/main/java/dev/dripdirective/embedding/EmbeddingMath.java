package dev.dripdirective.embedding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.embedding.Embedding;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Pure static vector primitives shared by the store, the diversification selector and the
 * pipeline.
 *
 * <p>Nothing in here throws on bad vectors: mismatched dimensions, empty vectors and zero
 * magnitudes all score 0.0, and unparsable stored vectors come back as {@link Optional#empty()} so
 * callers can skip a single record without aborting a batch.
 */
public final class EmbeddingMath {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private EmbeddingMath() {}

  /**
   * Cosine similarity of two vectors.
   *
   * @return a value in [-1, 1], or 0.0 if either vector is null, empty, has zero magnitude, or the
   *     lengths differ
   */
  public static double cosineSimilarity(float @Nullable [] a, float @Nullable [] b) {
    if (a == null || b == null || a.length == 0 || a.length != b.length) {
      return 0.0;
    }
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.length; i++) {
      dot += (double) a[i] * b[i];
      normA += (double) a[i] * a[i];
      normB += (double) b[i] * b[i];
    }
    if (normA == 0.0 || normB == 0.0) {
      return 0.0;
    }
    double cosine = dot / (Math.sqrt(normA) * Math.sqrt(normB));
    // rounding can push identical vectors a hair past 1
    return Math.max(-1.0, Math.min(1.0, cosine));
  }

  /** {@link #cosineSimilarity(float[], float[])} over LangChain4j embeddings. */
  public static double cosineSimilarity(@Nullable Embedding a, @Nullable Embedding b) {
    if (a == null || b == null) {
      return 0.0;
    }
    return cosineSimilarity(a.vector(), b.vector());
  }

  /**
   * Parses a stored vector in JSON array form ({@code [0.12,-0.5,...]}, which is also the pgvector
   * text representation).
   *
   * @param raw the stored representation, possibly null or blank
   * @return the embedding, or empty if the input is blank, not a numeric array, empty, or contains
   *     non-finite values
   */
  public static Optional<Embedding> parseEmbedding(@Nullable String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    float[] vector;
    try {
      vector = MAPPER.readValue(raw, float[].class);
    } catch (JsonProcessingException e) {
      return Optional.empty();
    }
    if (vector == null || vector.length == 0) {
      return Optional.empty();
    }
    for (float v : vector) {
      if (!Float.isFinite(v)) {
        return Optional.empty();
      }
    }
    return Optional.of(Embedding.from(vector));
  }

  /**
   * Serializes an embedding to the JSON array form accepted by {@link #parseEmbedding(String)}.
   *
   * @param embedding the embedding to serialize
   * @return JSON array text
   */
  public static String formatEmbedding(Embedding embedding) {
    try {
      return MAPPER.writeValueAsString(embedding.vector());
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize embedding", e);
    }
  }

  /**
   * Converts a native cosine distance ({@code 1 - cos}, range [0, 2]) back into cosine similarity.
   */
  public static double similarityFromCosineDistance(double distance) {
    return 1.0 - distance;
  }

  /**
   * Converts a squared L2 distance between unit vectors into a similarity in [0, 1].
   *
   * <p>For normalized vectors {@code |a - b|^2 = 2 - 2cos}, so {@code cos = 1 - d^2 / 2}; the
   * result here is the coarser {@code max(0, 1 - d^2 / 4)} used by L2 index backends.
   */
  public static double similarityFromSquaredL2(double squaredDistance) {
    return Math.max(0.0, 1.0 - squaredDistance / 4.0);
  }
}
