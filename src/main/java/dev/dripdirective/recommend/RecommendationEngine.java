package dev.dripdirective.recommend;

import dev.dripdirective.cooldown.CooldownTracker;
import dev.dripdirective.diversify.Candidate;
import dev.dripdirective.diversify.MmrSelector;
import dev.dripdirective.embedding.QueryEmbedder;
import dev.dripdirective.history.OutputHistoryService;
import dev.dripdirective.history.RecentOutput;
import dev.dripdirective.ranking.ComposedGroup;
import dev.dripdirective.ranking.HybridRanker;
import dev.dripdirective.ranking.RankedGroup;
import dev.dripdirective.ranking.RankingProperties;
import dev.dripdirective.store.PartitionKey;
import dev.dripdirective.store.SimilarityMatch;
import dev.dripdirective.store.SimilarityStore;
import dev.dripdirective.store.SimilarityStoreUnavailableException;
import dev.dripdirective.store.StoredVector;
import dev.langchain4j.data.embedding.Embedding;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Recommendation pipeline: cooldown exclusion, similarity search, similarity floor, MMR
 * diversification, composition, hybrid ranking and commit.
 *
 * <p>Pipeline: embed query (if not supplied) -> collect cooldown ids from history -> search the
 * tenant's item partition on the search executor with a timeout -> drop matches below the
 * similarity floor -> load recent recommendation embeddings -> MMR down to {@code diverse-count}
 * -> hand the selection to the composer -> rank the composed groups -> append to history -> store
 * the digest embedding for future diversity penalties.
 *
 * <p>Backend failures of the store or the history, and search timeouts, degrade to {@link
 * RecommendationOutcome#STORE_UNAVAILABLE} (logged at warn) and are reported separately from a
 * genuinely empty pool ({@link RecommendationOutcome#NO_CANDIDATES}, logged at info). History is
 * written only for a ranked result; nothing is written when the request fails or the calling
 * thread is interrupted before the commit.
 */
@Service
public class RecommendationEngine {

  private static final Logger log = LoggerFactory.getLogger(RecommendationEngine.class);

  private final SimilarityStore similarityStore;
  private final CooldownTracker cooldownTracker;
  private final OutputHistoryService historyService;
  private final QueryEmbedder queryEmbedder;
  private final RecommendationProperties properties;
  private final RankingProperties rankingProperties;
  private final Executor searchExecutor;

  public RecommendationEngine(
      SimilarityStore similarityStore,
      CooldownTracker cooldownTracker,
      OutputHistoryService historyService,
      QueryEmbedder queryEmbedder,
      RecommendationProperties properties,
      RankingProperties rankingProperties,
      @Qualifier("similaritySearchExecutor") Executor searchExecutor) {
    this.similarityStore = similarityStore;
    this.cooldownTracker = cooldownTracker;
    this.historyService = historyService;
    this.queryEmbedder = queryEmbedder;
    this.properties = properties;
    this.rankingProperties = rankingProperties;
    this.searchExecutor = searchExecutor;
  }

  /**
   * Runs the full pipeline for one request.
   *
   * @param request the request
   * @param composer the external outfit composer
   * @return the ranked result, or an empty result with the reason in {@code outcome}
   */
  public RecommendationResult recommend(RecommendationRequest request, OutfitComposer composer) {
    String tenantId = request.tenantId();

    Optional<Embedding> queryEmbedding = resolveQueryEmbedding(request);
    if (queryEmbedding.isEmpty()) {
      log.warn("Query embedding unavailable for tenant {}", tenantId);
      return RecommendationResult.empty(RecommendationOutcome.EMBEDDING_UNAVAILABLE, List.of());
    }

    Set<String> exclusions = new LinkedHashSet<>();
    try {
      exclusions.addAll(
          cooldownTracker.recentlyUsedIds(
              tenantId, properties.getCooldownLookback(), properties.getCooldownMaxIds()));
    } catch (DataAccessException e) {
      log.warn("Recommendation history unavailable for tenant {}", tenantId, e);
      return RecommendationResult.empty(RecommendationOutcome.STORE_UNAVAILABLE, List.of());
    }
    exclusions.addAll(request.excludeIds());

    Optional<List<SimilarityMatch>> matches =
        searchWithTimeout(PartitionKey.items(tenantId), queryEmbedding.get(), exclusions);
    if (matches.isEmpty()) {
      RecommendationOutcome outcome =
          Thread.currentThread().isInterrupted()
              ? RecommendationOutcome.ABANDONED
              : RecommendationOutcome.STORE_UNAVAILABLE;
      return RecommendationResult.empty(outcome, List.of());
    }

    List<Candidate> candidates = aboveFloor(matches.get());
    if (candidates.isEmpty()) {
      log.info(
          "Tenant {}: no candidates above similarity {} ({} raw, {} excluded)",
          tenantId,
          properties.getMinSimilarity(),
          matches.get().size(),
          exclusions.size());
      return RecommendationResult.empty(RecommendationOutcome.NO_CANDIDATES, List.of());
    }

    List<Embedding> recent = recentEmbeddings(tenantId);
    List<Candidate> selected =
        MmrSelector.select(
            candidates,
            queryEmbedding.get(),
            recent,
            properties.getDiverseCount(),
            properties.getLambda());
    log.info(
        "Tenant {}: {} candidates, {} selected by MMR against {} recent recommendation(s)",
        tenantId,
        candidates.size(),
        selected.size(),
        recent.size());
    if (selected.isEmpty()) {
      return RecommendationResult.empty(RecommendationOutcome.NO_CANDIDATES, List.of());
    }

    List<ComposedGroup> composed = compose(composer, request.query(), selected, tenantId);
    if (composed.isEmpty()) {
      log.info("Tenant {}: composer returned no groups", tenantId);
      return RecommendationResult.empty(RecommendationOutcome.NO_GROUPS, selected);
    }

    List<RankedGroup> ranked =
        HybridRanker.rank(composed, relevanceByItemId(candidates), rankingProperties.toWeights());
    log.info(
        "Tenant {}: ranked {} group(s), order {}",
        tenantId,
        ranked.size(),
        ranked.stream().map(RankedGroup::name).toList());

    if (Thread.currentThread().isInterrupted()) {
      log.info("Tenant {}: request abandoned before commit, nothing recorded", tenantId);
      return RecommendationResult.empty(RecommendationOutcome.ABANDONED, selected);
    }
    return commit(tenantId, request.query(), ranked, selected);
  }

  private Optional<Embedding> resolveQueryEmbedding(RecommendationRequest request) {
    if (request.queryEmbedding() != null) {
      return Optional.of(request.queryEmbedding());
    }
    return queryEmbedder.embedQuery(QueryContext.of(request.query(), request.profileSummary()));
  }

  /**
   * Runs the store search on the search executor; empty means unavailable or timed out. A search
   * that outlives the timeout is cancelled with an interrupt so it releases its executor thread.
   */
  Optional<List<SimilarityMatch>> searchWithTimeout(
      PartitionKey partition, Embedding queryEmbedding, Set<String> exclusions) {
    FutureTask<List<SimilarityMatch>> future =
        new FutureTask<>(
            () ->
                similarityStore.search(
                    partition, queryEmbedding, properties.getCandidateLimit(), exclusions));
    try {
      searchExecutor.execute(future);
    } catch (RejectedExecutionException e) {
      log.warn("Similarity store unavailable for {}: search executor saturated", partition);
      return Optional.empty();
    }

    try {
      return Optional.of(future.get(properties.getSearchTimeoutMs(), TimeUnit.MILLISECONDS));
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn(
          "Similarity store unavailable for {}: search timed out after {} ms",
          partition,
          properties.getSearchTimeoutMs());
      return Optional.empty();
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      log.warn("Similarity search for {} interrupted", partition);
      return Optional.empty();
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof SimilarityStoreUnavailableException unavailable) {
        log.warn("Similarity store unavailable for {}", partition, unavailable);
        return Optional.empty();
      }
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new IllegalStateException("Similarity search failed for " + partition, cause);
    }
  }

  private List<Candidate> aboveFloor(List<SimilarityMatch> matches) {
    List<Candidate> candidates = new ArrayList<>(matches.size());
    for (SimilarityMatch match : matches) {
      if (match.similarity() >= properties.getMinSimilarity()) {
        double relevance = Math.max(0.0, match.similarity());
        candidates.add(
            new Candidate(match.itemId(), match.embedding(), relevance, match.metadata()));
      }
    }
    return candidates;
  }

  /** Recent recommendation embeddings from the store, or from history digests as a fallback. */
  List<Embedding> recentEmbeddings(String tenantId) {
    int limit = properties.getRecentRecommendations();
    if (limit == 0) {
      return List.of();
    }
    try {
      return similarityStore.recent(PartitionKey.recommendations(tenantId), limit).stream()
          .map(StoredVector::embedding)
          .toList();
    } catch (SimilarityStoreUnavailableException e) {
      log.warn(
          "Similarity store unavailable reading recent recommendations for tenant {}; "
              + "using history digests",
          tenantId,
          e);
    }
    List<RecentOutput> latest;
    try {
      latest = historyService.latest(tenantId, limit);
    } catch (DataAccessException e) {
      log.warn(
          "Recommendation history unavailable for tenant {}; no recent-output penalty",
          tenantId,
          e);
      return List.of();
    }
    List<Embedding> fromHistory = new ArrayList<>();
    for (RecentOutput output : latest) {
      if (output.digestEmbedding() != null) {
        fromHistory.add(output.digestEmbedding());
      }
    }
    return fromHistory;
  }

  private List<ComposedGroup> compose(
      OutfitComposer composer, String query, List<Candidate> selected, String tenantId) {
    try {
      return composer.compose(query, selected).orElse(List.of());
    } catch (RuntimeException e) {
      log.warn("Composer failed for tenant {}", tenantId, e);
      return List.of();
    }
  }

  private static Map<String, Double> relevanceByItemId(List<Candidate> candidates) {
    Map<String, Double> relevance = new LinkedHashMap<>();
    for (Candidate candidate : candidates) {
      relevance.put(candidate.itemId(), candidate.relevanceOrZero());
    }
    return relevance;
  }

  private RecommendationResult commit(
      String tenantId, String query, List<RankedGroup> ranked, List<Candidate> selected) {
    String digest = RecommendationDigest.text(query, ranked);
    Embedding digestEmbedding = queryEmbedder.embedDocument(digest).orElse(null);

    List<List<String>> itemGroups = ranked.stream().map(RankedGroup::itemIds).toList();
    RecentOutput record;
    try {
      record = historyService.append(tenantId, query, itemGroups, digestEmbedding);
    } catch (DataAccessException e) {
      log.warn("Recommendation history unavailable for tenant {}; nothing recorded", tenantId, e);
      return RecommendationResult.empty(RecommendationOutcome.STORE_UNAVAILABLE, selected);
    }

    if (digestEmbedding != null) {
      storeDigest(tenantId, record, digestEmbedding);
    } else {
      log.warn("Digest embedding unavailable for record {}; not stored", record.recordId());
    }
    return new RecommendationResult(
        RecommendationOutcome.RANKED, ranked, selected, record.recordId());
  }

  private void storeDigest(String tenantId, RecentOutput record, Embedding digestEmbedding) {
    Instant createdAt = record.createdAt();
    try {
      similarityStore.upsert(
          PartitionKey.recommendations(tenantId),
          String.valueOf(record.recordId()),
          digestEmbedding,
          Map.of("query", record.query(), "created_at", createdAt.toString()));
    } catch (SimilarityStoreUnavailableException e) {
      log.warn(
          "Similarity store unavailable storing digest of record {} for tenant {}",
          record.recordId(),
          tenantId,
          e);
    }
  }
}
