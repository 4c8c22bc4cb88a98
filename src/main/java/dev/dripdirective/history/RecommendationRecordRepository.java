package dev.dripdirective.history;

import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link RecommendationRecord} entities. */
public interface RecommendationRecordRepository extends JpaRepository<RecommendationRecord, Long> {

  /** Newest records of a tenant first; id breaks ties between equal timestamps. */
  List<RecommendationRecord> findByTenantIdOrderByCreatedAtDescIdDesc(
      String tenantId, Pageable pageable);

  Optional<RecommendationRecord> findByIdAndTenantId(Long id, String tenantId);
}
