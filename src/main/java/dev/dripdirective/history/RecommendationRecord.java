package dev.dripdirective.history;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * One finalized recommendation for a tenant: the item-id groups that were handed out (one group
 * per outfit) plus the digest embedding used for future diversity penalties.
 *
 * <p>Records are append-only. Only the most recent few per tenant are ever read; archival is
 * somebody else's job.
 *
 * <p>Maps to the {@code recommendation_history} table managed by Flyway migrations.
 *
 * @see OutputHistoryService
 */
@Entity
@Table(name = "recommendation_history")
public class RecommendationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String query;

    /** JSON array of arrays of item ids, e.g. {@code [["12","7"],["3"]]}. */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "item_groups", nullable = false, columnDefinition = "JSONB")
    private String itemGroups;

    /** Digest embedding as a JSON array, or null if the digest could not be embedded. */
    @Column(name = "digest_embedding", columnDefinition = "TEXT")
    private String digestEmbedding;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected RecommendationRecord() {
        // JPA requires no-arg constructor
    }

    /**
     * Creates a new history record.
     *
     * @param tenantId        the owning tenant
     * @param query           the user request that produced the recommendation
     * @param itemGroups      item-id groups as JSON
     * @param digestEmbedding digest embedding as JSON, or {@code null}
     * @param createdAt       commit time
     */
    public RecommendationRecord(String tenantId, String query, String itemGroups,
                                String digestEmbedding, Instant createdAt) {
        this.tenantId = tenantId;
        this.query = query;
        this.itemGroups = itemGroups;
        this.digestEmbedding = digestEmbedding;
        this.createdAt = createdAt;
    }

    public Long getId() {
        return id;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getQuery() {
        return query;
    }

    public String getItemGroups() {
        return itemGroups;
    }

    public String getDigestEmbedding() {
        return digestEmbedding;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
