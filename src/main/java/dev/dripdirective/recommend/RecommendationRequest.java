package dev.dripdirective.recommend;

import dev.langchain4j.data.embedding.Embedding;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Input to {@link RecommendationEngine#recommend}.
 *
 * @param tenantId the tenant (user) the request runs for
 * @param query the request text, recorded in history and in the digest
 * @param queryEmbedding a precomputed query vector; when null the engine embeds the query combined
 *     with {@code profileSummary}
 * @param profileSummary the user's style profile, used only when the engine embeds the query
 * @param excludeIds item ids the caller wants left out, on top of the cooldown set
 */
public record RecommendationRequest(
    String tenantId,
    String query,
    @Nullable Embedding queryEmbedding,
    @Nullable String profileSummary,
    Set<String> excludeIds) {

  public RecommendationRequest {
    if (tenantId == null || tenantId.isBlank()) {
      throw new IllegalArgumentException("tenantId must not be blank");
    }
    if (query == null) {
      throw new IllegalArgumentException("query must not be null");
    }
    excludeIds = excludeIds == null ? Set.of() : Set.copyOf(excludeIds);
  }

  /** A request whose query the engine embeds itself. */
  public static RecommendationRequest ofText(
      String tenantId, String query, @Nullable String profileSummary) {
    return new RecommendationRequest(tenantId, query, null, profileSummary, Set.of());
  }

  /** A request with a caller-supplied query vector. */
  public static RecommendationRequest ofEmbedding(
      String tenantId, String query, Embedding queryEmbedding) {
    return new RecommendationRequest(tenantId, query, queryEmbedding, null, Set.of());
  }

  /** Copy with additional explicit exclusions. */
  public RecommendationRequest excluding(Set<String> ids) {
    return new RecommendationRequest(tenantId, query, queryEmbedding, profileSummary, ids);
  }
}
