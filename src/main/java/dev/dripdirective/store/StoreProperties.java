package dev.dripdirective.store;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Similarity store settings, bound from {@code dripdirective.store.*}.
 *
 * <p>{@code dripdirective.store.backend} selects the implementation in {@link
 * SimilarityStoreConfig} and {@code dripdirective.store.retry.*} drives the {@code @Retryable}
 * policy of {@link PgVectorSimilarityStore}; both are read as placeholders, not bound here.
 *
 * @param dimension embedding dimensionality of the deployed model
 */
@ConfigurationProperties(prefix = "dripdirective.store")
public record StoreProperties(int dimension) {}
