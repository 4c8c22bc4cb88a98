package dev.dripdirective.store;

import dev.langchain4j.data.embedding.Embedding;

/**
 * An item id with its stored vector, as returned by {@link SimilarityStore#recent}.
 *
 * @param itemId the caller's item identifier
 * @param embedding the stored vector
 */
public record StoredVector(String itemId, Embedding embedding) {}
