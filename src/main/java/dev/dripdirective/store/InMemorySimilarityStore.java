package dev.dripdirective.store;

import dev.dripdirective.embedding.EmbeddingMath;
import dev.langchain4j.data.embedding.Embedding;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Exact, in-process {@link SimilarityStore}. Every search is a brute-force cosine scan of one
 * partition, which is fine for per-user wardrobes of a few hundred items.
 *
 * <p>Thread-safe: partitions live in a {@link ConcurrentHashMap} and each partition is guarded by
 * its own monitor, so requests for different tenants never contend. Insertion order doubles as the
 * recency order; replacing an item moves it to the newest position.
 */
public class InMemorySimilarityStore implements SimilarityStore {

  private final ConcurrentHashMap<PartitionKey, Partition> partitions = new ConcurrentHashMap<>();

  @Override
  public void upsert(
      PartitionKey partition, String itemId, Embedding embedding, Map<String, String> metadata) {
    requireItemId(itemId);
    if (embedding == null || embedding.vector().length == 0) {
      throw new IllegalArgumentException("embedding must not be empty");
    }
    partitions
        .computeIfAbsent(partition, key -> new Partition())
        .put(new Entry(itemId, embedding, metadata == null ? Map.of() : Map.copyOf(metadata)));
  }

  @Override
  public List<SimilarityMatch> search(
      PartitionKey partition, Embedding queryEmbedding, int limit, Collection<String> excludeIds) {
    if (limit < 0) {
      throw new IllegalArgumentException("limit must not be negative");
    }
    Partition p = partitions.get(partition);
    if (p == null || limit == 0) {
      return List.of();
    }
    Set<String> excluded = excludeIds == null ? Set.of() : Set.copyOf(excludeIds);

    // List.sort is stable, so equal similarities keep insertion order
    List<SimilarityMatch> scored = new ArrayList<>();
    for (Entry entry : p.snapshot()) {
      if (excluded.contains(entry.itemId())) {
        continue;
      }
      double similarity = EmbeddingMath.cosineSimilarity(queryEmbedding, entry.embedding());
      scored.add(
          new SimilarityMatch(entry.itemId(), similarity, entry.embedding(), entry.metadata()));
    }
    scored.sort(Comparator.comparingDouble(SimilarityMatch::similarity).reversed());
    return scored.size() <= limit ? scored : List.copyOf(scored.subList(0, limit));
  }

  @Override
  public List<StoredVector> recent(PartitionKey partition, int limit) {
    Partition p = partitions.get(partition);
    if (p == null || limit <= 0) {
      return List.of();
    }
    List<Entry> entries = p.snapshot();
    List<StoredVector> result = new ArrayList<>(Math.min(limit, entries.size()));
    for (int i = entries.size() - 1; i >= 0 && result.size() < limit; i--) {
      Entry entry = entries.get(i);
      result.add(new StoredVector(entry.itemId(), entry.embedding()));
    }
    return result;
  }

  @Override
  public void delete(PartitionKey partition, String itemId) {
    Partition p = partitions.get(partition);
    if (p != null) {
      p.remove(itemId);
    }
  }

  @Override
  public long count(PartitionKey partition) {
    Partition p = partitions.get(partition);
    return p == null ? 0 : p.size();
  }

  private static void requireItemId(String itemId) {
    if (itemId == null || itemId.isBlank()) {
      throw new IllegalArgumentException("itemId must not be blank");
    }
  }

  private record Entry(String itemId, Embedding embedding, Map<String, String> metadata) {}

  private static final class Partition {

    private final LinkedHashMap<String, Entry> entries = new LinkedHashMap<>();

    synchronized void put(Entry entry) {
      entries.remove(entry.itemId());
      entries.put(entry.itemId(), entry);
    }

    synchronized void remove(String itemId) {
      entries.remove(itemId);
    }

    synchronized int size() {
      return entries.size();
    }

    synchronized List<Entry> snapshot() {
      return new ArrayList<>(entries.values());
    }
  }
}
