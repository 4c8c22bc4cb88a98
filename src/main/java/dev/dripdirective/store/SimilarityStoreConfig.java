package dev.dripdirective.store;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires exactly one {@link SimilarityStore} according to {@code dripdirective.store.backend}:
 * {@code pgvector} (default), {@code memory} or {@code none}.
 */
@Configuration
public class SimilarityStoreConfig {

  @Bean
  @ConditionalOnProperty(
      name = "dripdirective.store.backend",
      havingValue = "pgvector",
      matchIfMissing = true)
  public SimilarityStore pgVectorSimilarityStore(
      EmbeddingStore<TextSegment> embeddingStore,
      ItemVectorRepository itemVectorRepository,
      StoreProperties properties) {
    return new PgVectorSimilarityStore(
        embeddingStore, itemVectorRepository, properties.dimension());
  }

  @Bean
  @ConditionalOnProperty(name = "dripdirective.store.backend", havingValue = "memory")
  public SimilarityStore inMemorySimilarityStore() {
    return new InMemorySimilarityStore();
  }

  @Bean
  @ConditionalOnProperty(name = "dripdirective.store.backend", havingValue = "none")
  public SimilarityStore disabledSimilarityStore() {
    return new DisabledSimilarityStore();
  }
}
