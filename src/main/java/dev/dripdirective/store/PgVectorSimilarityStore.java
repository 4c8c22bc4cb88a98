package dev.dripdirective.store;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import dev.dripdirective.embedding.EmbeddingMath;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.filter.Filter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;

/**
 * Production {@link SimilarityStore} on PostgreSQL + pgvector via LangChain4j's {@link
 * EmbeddingStore}.
 *
 * <p>All tenants and item classes share the {@code item_vectors} table; partitions are enforced by
 * metadata filters on {@value #TENANT_KEY} and {@value #CLASS_KEY}. Row ids are name-based UUIDs of
 * (tenant, class, item id), which makes upsert idempotent and keeps equal item ids of different
 * tenants apart.
 *
 * <p>Similarity conversion: LangChain4j reports pgvector matches as relevance {@code (2 - d) / 2}
 * where {@code d} is the native cosine distance ({@code <=>}). The distance is recovered as {@code
 * 2 * (1 - relevance)} and converted with {@link EmbeddingMath#similarityFromCosineDistance}, so
 * callers always see plain cosine similarity in [-1, 1].
 *
 * <p>Any backend exception is wrapped in {@link SimilarityStoreUnavailableException} and retried
 * with exponential backoff before reaching the caller.
 */
public class PgVectorSimilarityStore implements SimilarityStore {

  private static final Logger log = LoggerFactory.getLogger(PgVectorSimilarityStore.class);

  static final String TENANT_KEY = "tenant_id";
  static final String CLASS_KEY = "item_class";
  static final String ITEM_ID_KEY = "item_id";

  private static final Set<String> RESERVED_KEYS = Set.of(TENANT_KEY, CLASS_KEY, ITEM_ID_KEY);

  private final EmbeddingStore<TextSegment> embeddingStore;
  private final ItemVectorRepository itemVectorRepository;
  private final int dimension;

  public PgVectorSimilarityStore(
      EmbeddingStore<TextSegment> embeddingStore,
      ItemVectorRepository itemVectorRepository,
      int dimension) {
    this.embeddingStore = embeddingStore;
    this.itemVectorRepository = itemVectorRepository;
    this.dimension = dimension;
  }

  @Override
  @Retryable(
      retryFor = SimilarityStoreUnavailableException.class,
      maxAttemptsExpression = "${dripdirective.store.retry.max-attempts}",
      backoff =
          @Backoff(
              delayExpression = "${dripdirective.store.retry.delay-ms}",
              multiplierExpression = "${dripdirective.store.retry.multiplier}"))
  public void upsert(
      PartitionKey partition, String itemId, Embedding embedding, Map<String, String> metadata) {
    if (itemId == null || itemId.isBlank()) {
      throw new IllegalArgumentException("itemId must not be blank");
    }
    if (embedding == null || embedding.vector().length != dimension) {
      throw new IllegalArgumentException(
          "embedding must have "
              + dimension
              + " dimensions, got "
              + (embedding == null ? 0 : embedding.vector().length));
    }

    Map<String, Object> stored = new HashMap<>();
    if (metadata != null) {
      metadata.forEach(
          (key, value) -> {
            if (!RESERVED_KEYS.contains(key) && value != null) {
              stored.put(key, value);
            }
          });
    }
    stored.put(TENANT_KEY, partition.tenantId());
    stored.put(CLASS_KEY, partition.itemClass().name());
    stored.put(ITEM_ID_KEY, itemId);

    try {
      embeddingStore.addAll(
          List.of(rowId(partition, itemId).toString()),
          List.of(embedding),
          List.of(TextSegment.from(itemId, Metadata.from(stored))));
    } catch (RuntimeException e) {
      throw new SimilarityStoreUnavailableException(partition, "pgvector upsert failed", e);
    }
  }

  @Override
  @Retryable(
      retryFor = SimilarityStoreUnavailableException.class,
      maxAttemptsExpression = "${dripdirective.store.retry.max-attempts}",
      backoff =
          @Backoff(
              delayExpression = "${dripdirective.store.retry.delay-ms}",
              multiplierExpression = "${dripdirective.store.retry.multiplier}"))
  public List<SimilarityMatch> search(
      PartitionKey partition, Embedding queryEmbedding, int limit, Collection<String> excludeIds) {
    if (limit < 0) {
      throw new IllegalArgumentException("limit must not be negative");
    }
    if (limit == 0) {
      return List.of();
    }
    if (queryEmbedding == null || queryEmbedding.vector().length != dimension) {
      log.warn(
          "Query embedding has {} dimensions, store expects {}; treating as zero similarity",
          queryEmbedding == null ? 0 : queryEmbedding.vector().length,
          dimension);
      return List.of();
    }
    Set<String> excluded = excludeIds == null ? Set.of() : Set.copyOf(excludeIds);

    EmbeddingSearchRequest request =
        EmbeddingSearchRequest.builder()
            .queryEmbedding(queryEmbedding)
            // over-fetch so excluded ids do not eat into the limit
            .maxResults(limit + excluded.size())
            .minScore(0.0)
            .filter(partitionFilter(partition))
            .build();

    List<EmbeddingMatch<TextSegment>> matches;
    try {
      matches = embeddingStore.search(request).matches();
    } catch (RuntimeException e) {
      throw new SimilarityStoreUnavailableException(partition, "pgvector search failed", e);
    }

    List<SimilarityMatch> results = new ArrayList<>(Math.min(limit, matches.size()));
    for (EmbeddingMatch<TextSegment> match : matches) {
      TextSegment segment = match.embedded();
      String itemId = segment == null ? null : segment.metadata().getString(ITEM_ID_KEY);
      if (segment == null || itemId == null) {
        log.debug("Skipping row {} without {} metadata", match.embeddingId(), ITEM_ID_KEY);
        continue;
      }
      if (excluded.contains(itemId)) {
        continue;
      }
      double cosineDistance = 2.0 * (1.0 - match.score());
      results.add(
          new SimilarityMatch(
              itemId,
              EmbeddingMath.similarityFromCosineDistance(cosineDistance),
              match.embedding(),
              tags(segment.metadata())));
    }
    // pgvector already orders by distance; re-sort (stable) so the contract does not depend on it
    results.sort(Comparator.comparingDouble(SimilarityMatch::similarity).reversed());
    return results.size() <= limit ? results : List.copyOf(results.subList(0, limit));
  }

  @Override
  public List<StoredVector> recent(PartitionKey partition, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    List<Object[]> rows;
    try {
      rows =
          itemVectorRepository.findRecentInPartition(
              partition.tenantId(), partition.itemClass().name(), limit);
    } catch (RuntimeException e) {
      throw new SimilarityStoreUnavailableException(partition, "pgvector recency query failed", e);
    }

    List<StoredVector> result = new ArrayList<>(rows.size());
    for (Object[] row : rows) {
      String itemId = (String) row[0];
      String raw = (String) row[1];
      EmbeddingMath.parseEmbedding(raw)
          .ifPresentOrElse(
              embedding -> result.add(new StoredVector(itemId, embedding)),
              () -> log.debug("Skipping unparsable vector for {} in {}", itemId, partition));
    }
    return result;
  }

  @Override
  public void delete(PartitionKey partition, String itemId) {
    try {
      embeddingStore.remove(rowId(partition, itemId).toString());
    } catch (RuntimeException e) {
      throw new SimilarityStoreUnavailableException(partition, "pgvector delete failed", e);
    }
  }

  @Override
  public long count(PartitionKey partition) {
    try {
      return itemVectorRepository.countInPartition(
          partition.tenantId(), partition.itemClass().name());
    } catch (RuntimeException e) {
      throw new SimilarityStoreUnavailableException(partition, "pgvector count failed", e);
    }
  }

  /** Deterministic row id for an item within a partition. */
  static UUID rowId(PartitionKey partition, String itemId) {
    String name =
        partition.tenantId() + '\0' + partition.itemClass().name() + '\0' + itemId;
    return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8));
  }

  private static Filter partitionFilter(PartitionKey partition) {
    return metadataKey(TENANT_KEY)
        .isEqualTo(partition.tenantId())
        .and(metadataKey(CLASS_KEY).isEqualTo(partition.itemClass().name()));
  }

  private static Map<String, String> tags(Metadata metadata) {
    Map<String, String> tags = new HashMap<>();
    metadata
        .toMap()
        .forEach(
            (key, value) -> {
              if (!RESERVED_KEYS.contains(key) && value != null) {
                tags.put(key, String.valueOf(value));
              }
            });
    return tags;
  }
}
