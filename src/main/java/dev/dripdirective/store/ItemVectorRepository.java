package dev.dripdirective.store;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/** Spring Data repository for partition-scoped reads on {@link ItemVector} rows. */
public interface ItemVectorRepository extends JpaRepository<ItemVector, UUID> {

  /**
   * Most recently inserted rows of one partition, newest first. Ties on {@code inserted_at} are
   * broken by row id so the subset is deterministic.
   *
   * @param tenantId the tenant
   * @param itemClass the {@link ItemClass} name
   * @param limit maximum rows
   * @return list of [item_id, embedding as pgvector text] pairs
   */
  @Query(
      value =
          """
            SELECT metadata->>'item_id' AS item_id, CAST(embedding AS TEXT) AS embedding_text
            FROM item_vectors
            WHERE metadata->>'tenant_id' = :tenantId
              AND metadata->>'item_class' = :itemClass
            ORDER BY inserted_at DESC, embedding_id
            LIMIT :limit
            """,
      nativeQuery = true)
  List<Object[]> findRecentInPartition(
      @Param("tenantId") String tenantId,
      @Param("itemClass") String itemClass,
      @Param("limit") int limit);

  /**
   * Counts rows in one partition.
   *
   * @param tenantId the tenant
   * @param itemClass the {@link ItemClass} name
   * @return row count
   */
  @Query(
      value =
          """
            SELECT COUNT(*) FROM item_vectors
            WHERE metadata->>'tenant_id' = :tenantId
              AND metadata->>'item_class' = :itemClass
            """,
      nativeQuery = true)
  long countInPartition(@Param("tenantId") String tenantId, @Param("itemClass") String itemClass);
}
