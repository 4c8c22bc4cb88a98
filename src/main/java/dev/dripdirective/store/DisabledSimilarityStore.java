package dev.dripdirective.store;

import dev.langchain4j.data.embedding.Embedding;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SimilarityStore} used when vector search is switched off ({@code
 * dripdirective.store.backend=none}). Writes are dropped and every read is empty, so the pipeline
 * reports "no candidates" rather than failing.
 */
public class DisabledSimilarityStore implements SimilarityStore {

  private static final Logger log = LoggerFactory.getLogger(DisabledSimilarityStore.class);

  public DisabledSimilarityStore() {
    log.warn("Similarity store disabled (dripdirective.store.backend=none); searches return empty");
  }

  @Override
  public void upsert(
      PartitionKey partition, String itemId, Embedding embedding, Map<String, String> metadata) {
    log.debug("Dropping upsert of {} into {} (store disabled)", itemId, partition);
  }

  @Override
  public List<SimilarityMatch> search(
      PartitionKey partition, Embedding queryEmbedding, int limit, Collection<String> excludeIds) {
    return List.of();
  }

  @Override
  public List<StoredVector> recent(PartitionKey partition, int limit) {
    return List.of();
  }

  @Override
  public void delete(PartitionKey partition, String itemId) {
    // nothing stored
  }

  @Override
  public long count(PartitionKey partition) {
    return 0;
  }
}
