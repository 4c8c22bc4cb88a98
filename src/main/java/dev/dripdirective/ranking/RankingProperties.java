package dev.dripdirective.ranking;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised weights for hybrid ranking, bound from {@code dripdirective.ranking.*}.
 *
 * <ul>
 *   <li>{@code relevance-weight} - weight of average retrieval relevance (default 0.6)
 *   <li>{@code confidence-weight} - weight of composer confidence (default 0.4)
 *   <li>{@code neutral-relevance} - relevance used when no member of a group has a known score
 *       (default 0.5)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}.
 */
@Configuration
@ConfigurationProperties(prefix = "dripdirective.ranking")
public class RankingProperties {

  private double relevanceWeight = RankingWeights.DEFAULTS.relevanceWeight();
  private double confidenceWeight = RankingWeights.DEFAULTS.confidenceWeight();
  private double neutralRelevance = RankingWeights.DEFAULTS.neutralRelevance();

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    try {
      toWeights();
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException("Invalid dripdirective.ranking: " + e.getMessage(), e);
    }
  }

  public RankingWeights toWeights() {
    return new RankingWeights(relevanceWeight, confidenceWeight, neutralRelevance);
  }

  public double getRelevanceWeight() {
    return relevanceWeight;
  }

  public void setRelevanceWeight(double relevanceWeight) {
    this.relevanceWeight = relevanceWeight;
  }

  public double getConfidenceWeight() {
    return confidenceWeight;
  }

  public void setConfidenceWeight(double confidenceWeight) {
    this.confidenceWeight = confidenceWeight;
  }

  public double getNeutralRelevance() {
    return neutralRelevance;
  }

  public void setNeutralRelevance(double neutralRelevance) {
    this.neutralRelevance = neutralRelevance;
  }
}
