package dev.dripdirective.diversify;

import dev.dripdirective.embedding.EmbeddingMath;
import dev.langchain4j.data.embedding.Embedding;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Pure static Maximal Marginal Relevance selection.
 *
 * <p>Greedily picks up to {@code k} candidates. At each step every unselected candidate is scored
 * {@code lambda * relevance - (1 - lambda) * penalty}, where {@code penalty} is the larger of its
 * highest similarity to an already selected candidate and its highest similarity to a recent
 * recommendation embedding (0 when both sets are empty). The two penalties are never averaged:
 * the stricter one wins. The best-scoring candidate is moved into the result; on equal scores the
 * one that came first in the input wins.
 *
 * <p>Candidates without a usable embedding are dropped up front: never selected, never used as a
 * penalty. Recent embeddings that are null or empty are ignored the same way.
 *
 * <p>Cost is O(k * n * (k + r)) similarity computations for n candidates and r recent embeddings;
 * candidate pools are bounded by the store search limit.
 */
public final class MmrSelector {

  /** Default relevance/diversity trade-off: 70% relevance, 30% diversity. */
  public static final double DEFAULT_LAMBDA = 0.7;

  private MmrSelector() {}

  /**
   * Selects a diverse, relevance-ordered subset.
   *
   * @param candidates similarity-filtered candidates, typically in descending relevance order
   * @param queryEmbedding the query vector; used only for candidates whose relevance is unknown
   * @param recentEmbeddings vectors of recent recommendations to diversify against
   * @param k target size (must be >= 0)
   * @param lambda trade-off in [0, 1]; 1.0 = relevance only, 0.0 = diversity only
   * @return the selected candidates in pick order (first = most preferred), each with its
   *     relevance filled in
   */
  public static List<Candidate> select(
      List<Candidate> candidates,
      @Nullable Embedding queryEmbedding,
      List<Embedding> recentEmbeddings,
      int k,
      double lambda) {
    if (k < 0) {
      throw new IllegalArgumentException("k must not be negative, got: " + k);
    }
    if (lambda < 0.0 || lambda > 1.0 || Double.isNaN(lambda)) {
      throw new IllegalArgumentException("lambda must be in [0.0, 1.0], got: " + lambda);
    }
    if (candidates.isEmpty() || k == 0) {
      return List.of();
    }

    List<Candidate> remaining = usable(candidates, queryEmbedding);
    List<float[]> recent = new ArrayList<>();
    for (Embedding embedding : recentEmbeddings) {
      if (embedding != null && embedding.vector().length > 0) {
        recent.add(embedding.vector());
      }
    }

    List<Candidate> selected = new ArrayList<>(Math.min(k, remaining.size()));
    while (!remaining.isEmpty() && selected.size() < k) {
      int bestIdx = 0;
      double bestScore = Double.NEGATIVE_INFINITY;
      for (int i = 0; i < remaining.size(); i++) {
        Candidate candidate = remaining.get(i);
        float[] vector = candidate.embedding().vector();
        double penalty = Math.max(maxSimilarity(vector, selected), maxSimilarityTo(vector, recent));
        double score = lambda * candidate.relevanceOrZero() - (1.0 - lambda) * penalty;
        if (score > bestScore) {
          bestScore = score;
          bestIdx = i;
        }
      }
      selected.add(remaining.remove(bestIdx));
    }
    return selected;
  }

  /** {@link #select} with {@link #DEFAULT_LAMBDA}. */
  public static List<Candidate> select(
      List<Candidate> candidates,
      @Nullable Embedding queryEmbedding,
      List<Embedding> recentEmbeddings,
      int k) {
    return select(candidates, queryEmbedding, recentEmbeddings, k, DEFAULT_LAMBDA);
  }

  private static List<Candidate> usable(List<Candidate> candidates, @Nullable Embedding query) {
    List<Candidate> usable = new ArrayList<>(candidates.size());
    for (Candidate candidate : candidates) {
      Embedding embedding = candidate.embedding();
      if (embedding == null || embedding.vector().length == 0) {
        continue;
      }
      if (candidate.relevance() == null) {
        double similarity = EmbeddingMath.cosineSimilarity(query, embedding);
        usable.add(candidate.withRelevance(Math.max(0.0, similarity)));
      } else {
        usable.add(candidate);
      }
    }
    return usable;
  }

  private static double maxSimilarity(float[] vector, List<Candidate> selected) {
    double max = 0.0;
    for (Candidate other : selected) {
      max = Math.max(max, EmbeddingMath.cosineSimilarity(vector, other.embedding().vector()));
    }
    return max;
  }

  private static double maxSimilarityTo(float[] vector, List<float[]> others) {
    double max = 0.0;
    for (float[] other : others) {
      max = Math.max(max, EmbeddingMath.cosineSimilarity(vector, other));
    }
    return max;
  }
}
