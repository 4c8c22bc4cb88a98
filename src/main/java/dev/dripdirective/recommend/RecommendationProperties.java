package dev.dripdirective.recommend;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the recommendation pipeline, bound from {@code
 * dripdirective.recommendation.*}.
 *
 * <ul>
 *   <li>{@code candidate-limit} - raw candidates fetched from the store (default 40)
 *   <li>{@code diverse-count} - candidates kept by MMR and handed to the composer (default 20)
 *   <li>{@code lambda} - MMR relevance/diversity trade-off in [0.0, 1.0] (default 0.7)
 *   <li>{@code min-similarity} - similarity floor in [-1.0, 1.0] (default 0.3)
 *   <li>{@code cooldown-lookback} - history records scanned for cooldown (default 3)
 *   <li>{@code cooldown-max-ids} - cap on the cooldown set (default 15)
 *   <li>{@code recent-recommendations} - past digests used as diversity penalty (default 5)
 *   <li>{@code search-timeout-ms} - store search timeout (default 2000)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "dripdirective.recommendation")
public class RecommendationProperties {

  private int candidateLimit = 40;
  private int diverseCount = 20;
  private double lambda = 0.7;
  private double minSimilarity = 0.3;
  private int cooldownLookback = 3;
  private int cooldownMaxIds = 15;
  private int recentRecommendations = 5;
  private long searchTimeoutMs = 2000;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (candidateLimit < 1) {
      throw new IllegalStateException(
          "dripdirective.recommendation.candidate-limit must be >= 1, got: " + candidateLimit);
    }
    if (diverseCount < 1) {
      throw new IllegalStateException(
          "dripdirective.recommendation.diverse-count must be >= 1, got: " + diverseCount);
    }
    if (lambda < 0.0 || lambda > 1.0) {
      throw new IllegalStateException(
          "dripdirective.recommendation.lambda must be in [0.0, 1.0], got: " + lambda);
    }
    if (minSimilarity < -1.0 || minSimilarity > 1.0) {
      throw new IllegalStateException(
          "dripdirective.recommendation.min-similarity must be in [-1.0, 1.0], got: "
              + minSimilarity);
    }
    if (cooldownLookback < 0 || cooldownMaxIds < 0 || recentRecommendations < 0) {
      throw new IllegalStateException(
          "dripdirective.recommendation cooldown-lookback, cooldown-max-ids and "
              + "recent-recommendations must not be negative");
    }
    if (searchTimeoutMs < 1) {
      throw new IllegalStateException(
          "dripdirective.recommendation.search-timeout-ms must be >= 1, got: " + searchTimeoutMs);
    }
  }

  public int getCandidateLimit() {
    return candidateLimit;
  }

  public void setCandidateLimit(int candidateLimit) {
    this.candidateLimit = candidateLimit;
  }

  public int getDiverseCount() {
    return diverseCount;
  }

  public void setDiverseCount(int diverseCount) {
    this.diverseCount = diverseCount;
  }

  public double getLambda() {
    return lambda;
  }

  public void setLambda(double lambda) {
    this.lambda = lambda;
  }

  public double getMinSimilarity() {
    return minSimilarity;
  }

  public void setMinSimilarity(double minSimilarity) {
    this.minSimilarity = minSimilarity;
  }

  public int getCooldownLookback() {
    return cooldownLookback;
  }

  public void setCooldownLookback(int cooldownLookback) {
    this.cooldownLookback = cooldownLookback;
  }

  public int getCooldownMaxIds() {
    return cooldownMaxIds;
  }

  public void setCooldownMaxIds(int cooldownMaxIds) {
    this.cooldownMaxIds = cooldownMaxIds;
  }

  public int getRecentRecommendations() {
    return recentRecommendations;
  }

  public void setRecentRecommendations(int recentRecommendations) {
    this.recentRecommendations = recentRecommendations;
  }

  public long getSearchTimeoutMs() {
    return searchTimeoutMs;
  }

  public void setSearchTimeoutMs(long searchTimeoutMs) {
    this.searchTimeoutMs = searchTimeoutMs;
  }
}
