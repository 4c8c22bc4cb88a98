package dev.dripdirective.store;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Read-only JPA view of one row in the {@code item_vectors} table.
 *
 * <p>Rows are written by LangChain4j's {@code PgVectorEmbeddingStore}; the {@code embedding} column
 * is not mapped. This entity exists so {@link ItemVectorRepository} can run the
 * partition-scoped native queries the embedding store API does not offer (recency, counts).
 * {@code inserted_at} is maintained by a database trigger on insert and on upsert.
 *
 * <p>Maps to the {@code item_vectors} table managed by Flyway migrations.
 */
@Entity
@Table(name = "item_vectors")
public class ItemVector {

    @Id
    @Column(name = "embedding_id")
    private UUID id;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String text;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "JSONB")
    private String metadata;

    @Column(name = "inserted_at", nullable = false, insertable = false, updatable = false)
    private Instant insertedAt;

    protected ItemVector() {
        // JPA requires no-arg constructor
    }

    public UUID getId() {
        return id;
    }

    public String getText() {
        return text;
    }

    public String getMetadata() {
        return metadata;
    }

    public Instant getInsertedAt() {
        return insertedAt;
    }
}
