package dev.dripdirective.store;

import dev.langchain4j.data.embedding.Embedding;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Pluggable vector backend holding (id, embedding, metadata) tuples, partitioned per tenant and
 * item class. No operation ever reads or writes outside the partition it is given.
 *
 * <p>Backend connectivity failures surface as {@link SimilarityStoreUnavailableException}; argument
 * errors as {@link IllegalArgumentException}.
 *
 * @see PgVectorSimilarityStore
 * @see InMemorySimilarityStore
 * @see DisabledSimilarityStore
 */
public interface SimilarityStore {

  /**
   * Inserts or replaces an item. Idempotent: repeating the call leaves one entry.
   *
   * @param partition the target partition
   * @param itemId the caller's item identifier
   * @param embedding the item vector
   * @param metadata opaque tags (class, type, color); not interpreted by the store
   */
  void upsert(
      PartitionKey partition, String itemId, Embedding embedding, Map<String, String> metadata);

  /**
   * Nearest-neighbour search by cosine similarity.
   *
   * <p>No similarity floor is applied here; the caller filters by its configured minimum.
   *
   * @param partition the partition to search
   * @param queryEmbedding the query vector
   * @param limit maximum number of results
   * @param excludeIds item ids that must never appear in the result
   * @return up to {@code limit} matches in strictly non-increasing similarity order; empty if the
   *     partition is empty
   */
  List<SimilarityMatch> search(
      PartitionKey partition,
      Embedding queryEmbedding,
      int limit,
      Collection<String> excludeIds);

  /**
   * Most recently inserted (or replaced) items, newest first.
   *
   * @param partition the partition to read
   * @param limit maximum number of items
   * @return at most {@code limit} items, never the full partition
   */
  List<StoredVector> recent(PartitionKey partition, int limit);

  /** Removes one item. Removing an unknown id is a no-op. */
  void delete(PartitionKey partition, String itemId);

  /** Number of items in the partition. */
  long count(PartitionKey partition);
}
