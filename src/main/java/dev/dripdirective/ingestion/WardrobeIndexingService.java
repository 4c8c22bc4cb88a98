package dev.dripdirective.ingestion;

import dev.dripdirective.embedding.QueryEmbedder;
import dev.dripdirective.store.PartitionKey;
import dev.dripdirective.store.SimilarityStore;
import dev.dripdirective.store.SimilarityStoreUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Indexes wardrobe items and user style profiles into the similarity store: build text ->
 * embed as a document -> upsert into the tenant's partition.
 *
 * <p>Indexing is best-effort. An embedding failure or an unavailable store is logged and
 * reported as {@code false}; the caller decides whether to retry. Re-indexing the same id
 * replaces the previous vector.
 */
@Service
public class WardrobeIndexingService {

    private static final Logger log = LoggerFactory.getLogger(WardrobeIndexingService.class);

    private final SimilarityStore similarityStore;
    private final QueryEmbedder embedder;

    public WardrobeIndexingService(SimilarityStore similarityStore, QueryEmbedder embedder) {
        this.similarityStore = similarityStore;
        this.embedder = embedder;
    }

    /**
     * Embeds and stores one wardrobe item in the tenant's item partition.
     *
     * @param tenantId the owning tenant
     * @param item     the classified item
     * @return true if the item is now searchable
     */
    public boolean indexItem(String tenantId, WardrobeItemDescription item) {
        PartitionKey partition = PartitionKey.items(tenantId);
        return embedAndStore(partition, item.itemId(), item.embeddingText(), item.metadata());
    }

    /**
     * Embeds and stores a user's style profile in the tenant's profile partition.
     *
     * @param tenantId      the owning tenant
     * @param userId        the profile owner
     * @param summaryPoints profile summary points, joined with blank lines before embedding
     * @return true if the profile was stored
     */
    public boolean indexProfile(String tenantId, String userId, List<String> summaryPoints) {
        String summary = String.join("\n\n", summaryPoints);
        if (summary.isBlank()) {
            log.info("Profile {} of tenant {} has no summary; not indexed", userId, tenantId);
            return false;
        }
        Map<String, String> metadata = Map.of(
                "user_id", userId,
                "summary_text", WardrobeItemDescription.truncate(summary));
        return embedAndStore(PartitionKey.profiles(tenantId), userId, summary, metadata);
    }

    /**
     * Removes one wardrobe item from the tenant's item partition.
     *
     * @return true if the store accepted the delete (also for unknown ids)
     */
    public boolean removeItem(String tenantId, String itemId) {
        PartitionKey partition = PartitionKey.items(tenantId);
        try {
            similarityStore.delete(partition, itemId);
            log.info("Removed item {} from {}", itemId, partition);
            return true;
        } catch (SimilarityStoreUnavailableException e) {
            log.warn("Similarity store unavailable; item {} not removed from {}",
                    itemId, partition, e);
            return false;
        }
    }

    private boolean embedAndStore(PartitionKey partition, String id, String text,
                                  Map<String, String> metadata) {
        Optional<Embedding> embedding = embedder.embedDocument(text);
        if (embedding.isEmpty()) {
            log.warn("Embedding unavailable; {} not indexed into {}", id, partition);
            return false;
        }
        try {
            similarityStore.upsert(partition, id, embedding.get(), metadata);
        } catch (SimilarityStoreUnavailableException e) {
            log.warn("Similarity store unavailable; {} not indexed into {}", id, partition, e);
            return false;
        }
        log.debug("Indexed {} into {} ({} chars)", id, partition, text.length());
        return true;
    }
}
