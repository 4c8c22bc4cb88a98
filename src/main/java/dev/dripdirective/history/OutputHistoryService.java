package dev.dripdirective.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.dripdirective.embedding.EmbeddingMath;
import dev.langchain4j.data.embedding.Embedding;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only per-tenant log of finalized recommendations.
 *
 * <p>{@link #append} is the single commit point of a recommendation request: it runs in one
 * transaction and is only called once a ranked result exists, so an abandoned request leaves no
 * trace. Reads decode the stored JSON; a record whose item groups cannot be decoded is skipped (and
 * logged), not fatal.
 */
@Service
public class OutputHistoryService {

  private static final Logger log = LoggerFactory.getLogger(OutputHistoryService.class);

  private final RecommendationRecordRepository repository;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public OutputHistoryService(
      RecommendationRecordRepository repository, ObjectMapper objectMapper, Clock clock) {
    this.repository = repository;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /**
   * Records a finalized recommendation.
   *
   * @param tenantId the tenant
   * @param query the request text
   * @param itemGroups item ids per outfit, in ranked order
   * @param digestEmbedding embedding of the recommendation digest, or null
   * @return the stored record, decoded
   */
  @Transactional
  public RecentOutput append(
      String tenantId,
      String query,
      List<List<String>> itemGroups,
      @Nullable Embedding digestEmbedding) {
    if (tenantId == null || tenantId.isBlank()) {
      throw new IllegalArgumentException("tenantId must not be blank");
    }
    String groupsJson;
    try {
      groupsJson = objectMapper.writeValueAsString(itemGroups);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Item groups are not serializable", e);
    }
    String digestJson =
        digestEmbedding == null ? null : EmbeddingMath.formatEmbedding(digestEmbedding);
    Instant now = clock.instant();

    RecommendationRecord saved =
        repository.save(new RecommendationRecord(tenantId, query, groupsJson, digestJson, now));
    log.info(
        "Recorded recommendation {} for tenant {} ({} groups)",
        saved.getId(),
        tenantId,
        itemGroups.size());
    return new RecentOutput(saved.getId(), query, itemGroups, digestEmbedding, now);
  }

  /**
   * The tenant's most recent records, newest first.
   *
   * @param tenantId the tenant
   * @param limit how many records to look at
   * @return decoded records; undecodable ones are left out, so the list may be shorter than
   *     {@code limit}
   */
  @Transactional(readOnly = true)
  public List<RecentOutput> latest(String tenantId, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    List<RecommendationRecord> records =
        repository.findByTenantIdOrderByCreatedAtDescIdDesc(tenantId, PageRequest.of(0, limit));
    List<RecentOutput> decoded = new ArrayList<>(records.size());
    for (RecommendationRecord record : records) {
      decode(record).ifPresent(decoded::add);
    }
    return decoded;
  }

  /** A single record, scoped to its tenant. */
  @Transactional(readOnly = true)
  public Optional<RecentOutput> find(String tenantId, long recordId) {
    return repository.findByIdAndTenantId(recordId, tenantId).flatMap(this::decode);
  }

  private Optional<RecentOutput> decode(RecommendationRecord record) {
    Optional<List<List<String>>> groups = parseGroups(record.getItemGroups());
    if (groups.isEmpty()) {
      log.debug("Skipping history record {} with unreadable item groups", record.getId());
      return Optional.empty();
    }
    Embedding digest = EmbeddingMath.parseEmbedding(record.getDigestEmbedding()).orElse(null);
    return Optional.of(
        new RecentOutput(
            record.getId(), record.getQuery(), groups.get(), digest, record.getCreatedAt()));
  }

  /** Reads {@code [[id, ...], ...]}; non-array entries are ignored, ids are taken as text. */
  Optional<List<List<String>>> parseGroups(@Nullable String json) {
    if (json == null || json.isBlank()) {
      return Optional.empty();
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      return Optional.empty();
    }
    if (root == null || !root.isArray()) {
      return Optional.empty();
    }
    List<List<String>> groups = new ArrayList<>();
    for (JsonNode group : root) {
      if (!group.isArray()) {
        continue;
      }
      List<String> ids = new ArrayList<>();
      for (JsonNode id : group) {
        if (id.isValueNode() && !id.isNull()) {
          ids.add(id.asText());
        }
      }
      groups.add(ids);
    }
    return Optional.of(groups);
  }
}
