package dev.dripdirective.config;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.DefaultMetadataStorageConfig;
import dev.langchain4j.store.embedding.pgvector.MetadataStorageMode;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.util.List;

/**
 * Configures the embedding model and the pgvector embedding store.
 *
 * <p>Uses the ONNX-based bge-small-en-v1.5 quantized model (384 dimensions) running
 * in-process, so no external embedding API is involved. The {@link PgVectorEmbeddingStore}
 * shares the application's HikariCP {@link DataSource} and writes to the Flyway-managed
 * {@code item_vectors} table with JSONB metadata, which is what the partition filters and the
 * recency queries rely on.
 */
@Configuration
public class EmbeddingConfig {

    static final String ITEM_VECTORS_TABLE = "item_vectors";

    /**
     * Provides the in-process ONNX embedding model (bge-small-en-v1.5 quantized, 384 dimensions).
     *
     * @return a ready-to-use embedding model requiring no external API
     */
    @Bean
    public EmbeddingModel embeddingModel() {
        return new BgeSmallEnV15QuantizedEmbeddingModel();
    }

    /**
     * Configures the pgvector embedding store. Only created for the {@code pgvector} backend.
     *
     * <p>Schema, trigger and HNSW index are managed by Flyway; {@code createTable} and
     * {@code useIndex} are disabled to avoid conflicts.
     *
     * @param dataSource the shared HikariCP data source (no duplicate pool)
     * @param dimension  embedding dimensionality, must match the {@code vector(n)} column
     * @return an embedding store backed by pgvector
     */
    @Bean
    @ConditionalOnProperty(
            name = "dripdirective.store.backend",
            havingValue = "pgvector",
            matchIfMissing = true)
    public EmbeddingStore<TextSegment> embeddingStore(
            DataSource dataSource,
            @Value("${dripdirective.store.dimension:384}") int dimension) {
        return PgVectorEmbeddingStore.datasourceBuilder()
                .datasource(dataSource)
                .table(ITEM_VECTORS_TABLE)
                .dimension(dimension)
                .createTable(false)  // Schema managed by Flyway migrations
                .useIndex(false)     // HNSW index managed by Flyway V1
                .metadataStorageConfig(DefaultMetadataStorageConfig.builder()
                        .storageMode(MetadataStorageMode.COMBINED_JSONB)
                        .columnDefinitions(List.of("metadata JSONB NULL"))
                        .build())
                .build();
    }
}
