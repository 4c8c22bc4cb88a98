package dev.dripdirective.recommend;

/** How a recommendation request ended. Only {@link #RANKED} writes history. */
public enum RecommendationOutcome {
  /** Groups were composed, ranked and recorded. */
  RANKED,
  /** Nothing passed cooldown and the similarity floor. */
  NO_CANDIDATES,
  /** The similarity store failed or timed out; treated as an empty candidate pool. */
  STORE_UNAVAILABLE,
  /** The query text could not be embedded. */
  EMBEDDING_UNAVAILABLE,
  /** The composer returned no groups. */
  NO_GROUPS,
  /** The calling thread was interrupted before the result was committed. */
  ABANDONED
}
