package dev.dripdirective.recommend;

import static dev.dripdirective.fixture.Vectors.atCosine;
import static dev.dripdirective.fixture.Vectors.query2d;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.dripdirective.cooldown.CooldownTracker;
import dev.dripdirective.diversify.Candidate;
import dev.dripdirective.embedding.QueryEmbedder;
import dev.dripdirective.history.OutputHistoryService;
import dev.dripdirective.history.RecentOutput;
import dev.dripdirective.ranking.ComposedGroup;
import dev.dripdirective.ranking.RankedGroup;
import dev.dripdirective.ranking.RankingProperties;
import dev.dripdirective.store.InMemorySimilarityStore;
import dev.dripdirective.store.PartitionKey;
import dev.dripdirective.store.SimilarityStore;
import dev.dripdirective.store.SimilarityStoreUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class RecommendationEngineTest {

  private static final String TENANT = "alice";
  private static final String QUERY = "date night";
  private static final Executor DIRECT = Runnable::run;

  @Mock CooldownTracker cooldownTracker;

  @Mock OutputHistoryService historyService;

  @Mock QueryEmbedder queryEmbedder;

  private InMemorySimilarityStore store;
  private RecommendationProperties properties;

  @BeforeEach
  void setUp() {
    store = new InMemorySimilarityStore();
    properties = new RecommendationProperties();
    properties.setCandidateLimit(4);
    properties.setMinSimilarity(0.3);
  }

  private RecommendationEngine engine(SimilarityStore similarityStore, Executor executor) {
    return new RecommendationEngine(
        similarityStore,
        cooldownTracker,
        historyService,
        queryEmbedder,
        properties,
        new RankingProperties(),
        executor);
  }

  /** Five wardrobe items with known similarity to the query. */
  private void seedWardrobe() {
    PartitionKey items = PartitionKey.items(TENANT);
    store.upsert(items, "i95", atCosine(0.95), Map.of("type", "blazer"));
    store.upsert(items, "i85", atCosine(0.85), Map.of("type", "shirt"));
    store.upsert(items, "i80", atCosine(0.80), Map.of("type", "trousers"));
    store.upsert(items, "i40", atCosine(0.40), Map.of("type", "sneakers"));
    store.upsert(items, "i10", atCosine(0.10), Map.of("type", "scarf"));
  }

  private void acceptCommit() {
    when(queryEmbedder.embedDocument(anyString())).thenReturn(Optional.of(atCosine(0.5)));
    when(historyService.append(eq(TENANT), eq(QUERY), anyList(), any()))
        .thenReturn(new RecentOutput(5L, QUERY, List.of(), null, Instant.EPOCH));
  }

  /** Composes one outfit from the first two candidates it is given and remembers its input. */
  private static final class RecordingComposer implements OutfitComposer {

    final List<Candidate> seen = new ArrayList<>();

    @Override
    public Optional<List<ComposedGroup>> compose(String query, List<Candidate> candidates) {
      seen.addAll(candidates);
      List<String> ids = candidates.stream().limit(2).map(Candidate::itemId).toList();
      return Optional.of(List.of(new ComposedGroup(1, "Evening", ids, 0.8, "Sharp and easy")));
    }

    List<String> seenIds() {
      return seen.stream().map(Candidate::itemId).toList();
    }
  }

  private static RecommendationRequest request() {
    return RecommendationRequest.ofEmbedding(TENANT, QUERY, query2d());
  }

  // --- Happy path ---

  @Test
  void floor_drops_low_similarity_and_limit_caps_the_pool() {
    seedWardrobe();
    acceptCommit();
    RecordingComposer composer = new RecordingComposer();

    RecommendationResult result = engine(store, DIRECT).recommend(request(), composer);

    assertThat(result.outcome()).isEqualTo(RecommendationOutcome.RANKED);
    assertThat(composer.seenIds()).containsExactlyInAnyOrder("i95", "i85", "i80", "i40");
    assertThat(composer.seenIds()).doesNotContain("i10");
    assertThat(result.groups()).singleElement().satisfies(g -> {
      assertThat(g.rank()).isEqualTo(1);
      assertThat(g.id()).isEqualTo(1);
    });
    assertThat(result.recordId()).isEqualTo(5L);
    assertThat(result.userMessage()).isEmpty();
  }

  @Test
  void higher_floor_leaves_the_top_three() {
    seedWardrobe();
    acceptCommit();
    properties.setMinSimilarity(0.5);
    RecordingComposer composer = new RecordingComposer();

    engine(store, DIRECT).recommend(request(), composer);

    assertThat(composer.seenIds()).containsExactlyInAnyOrder("i95", "i85", "i80");
  }

  @Test
  void most_relevant_item_is_offered_first() {
    seedWardrobe();
    acceptCommit();
    RecordingComposer composer = new RecordingComposer();

    engine(store, DIRECT).recommend(request(), composer);

    assertThat(composer.seenIds().get(0)).isEqualTo("i95");
    assertThat(composer.seen.get(0).metadata()).containsEntry("type", "blazer");
  }

  @Test
  void ranked_result_is_recorded_and_digest_stored() {
    seedWardrobe();
    acceptCommit();

    RecommendationResult result =
        engine(store, DIRECT).recommend(request(), new RecordingComposer());

    List<String> rankedIds = result.groups().get(0).itemIds();
    verify(historyService).append(eq(TENANT), eq(QUERY), eq(List.of(rankedIds)), any());
    verify(queryEmbedder).embedDocument(RecommendationDigest.text(QUERY, result.groups()));
    assertThat(store.count(PartitionKey.recommendations(TENANT))).isEqualTo(1);
    assertThat(store.recent(PartitionKey.recommendations(TENANT), 1))
        .singleElement()
        .satisfies(v -> assertThat(v.itemId()).isEqualTo("5"));
  }

  @Test
  void cooldown_and_explicit_exclusions_are_both_applied() {
    seedWardrobe();
    acceptCommit();
    when(cooldownTracker.recentlyUsedIds(TENANT, 3, 15)).thenReturn(Set.of("i95"));
    RecordingComposer composer = new RecordingComposer();

    engine(store, DIRECT).recommend(request().excluding(Set.of("i85")), composer);

    assertThat(composer.seenIds()).containsExactlyInAnyOrder("i80", "i40");
  }

  @Test
  void text_request_embeds_query_with_profile_context() {
    seedWardrobe();
    acceptCommit();
    String context = QueryContext.of(QUERY, "Minimalist, earth tones");
    when(queryEmbedder.embedQuery(context)).thenReturn(Optional.of(query2d()));

    RecommendationResult result =
        engine(store, DIRECT)
            .recommend(
                RecommendationRequest.ofText(TENANT, QUERY, "Minimalist, earth tones"),
                new RecordingComposer());

    assertThat(result.isRanked()).isTrue();
  }

  // --- Degraded paths: nothing is committed ---

  @Test
  void empty_pool_reports_no_candidates_and_skips_composer() {
    RecordingComposer composer = new RecordingComposer();

    RecommendationResult result = engine(store, DIRECT).recommend(request(), composer);

    assertThat(result.outcome()).isEqualTo(RecommendationOutcome.NO_CANDIDATES);
    assertThat(result.userMessage())
        .hasValueSatisfying(m -> assertThat(m).contains("Insufficient"));
    assertThat(composer.seen).isEmpty();
    verify(historyService, never()).append(anyString(), anyString(), anyList(), any());
  }

  @Test
  void unavailable_store_degrades_to_empty_result() {
    SimilarityStore failing = mock(SimilarityStore.class);
    when(failing.search(any(), any(), anyInt(), anyCollection()))
        .thenThrow(
            new SimilarityStoreUnavailableException(
                PartitionKey.items(TENANT), "down", new IllegalStateException("refused")));

    RecommendationResult result =
        engine(failing, DIRECT).recommend(request(), new RecordingComposer());

    assertThat(result.outcome()).isEqualTo(RecommendationOutcome.STORE_UNAVAILABLE);
    assertThat(result.groups()).isEmpty();
    assertThat(result.userMessage()).isPresent();
    verify(historyService, never()).append(anyString(), anyString(), anyList(), any());
  }

  @Test
  void slow_store_times_out_and_interrupts_the_search() throws InterruptedException {
    properties.setSearchTimeoutMs(50);
    CountDownLatch searchInterrupted = new CountDownLatch(1);
    SimilarityStore slow = mock(SimilarityStore.class);
    when(slow.search(any(), any(), anyInt(), anyCollection()))
        .thenAnswer(
            invocation -> {
              try {
                Thread.sleep(5_000);
              } catch (InterruptedException e) {
                searchInterrupted.countDown();
                throw e;
              }
              return List.of();
            });
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      RecommendationResult result =
          engine(slow, executor).recommend(request(), new RecordingComposer());

      assertThat(result.outcome()).isEqualTo(RecommendationOutcome.STORE_UNAVAILABLE);
      assertThat(searchInterrupted.await(2, TimeUnit.SECONDS)).isTrue();
      verify(historyService, never()).append(anyString(), anyString(), anyList(), any());
    } finally {
      executor.shutdownNow();
    }
  }

  // --- History outages ---

  @Test
  void history_outage_while_reading_cooldown_reports_store_unavailable() {
    seedWardrobe();
    when(cooldownTracker.recentlyUsedIds(eq(TENANT), anyInt(), anyInt()))
        .thenThrow(new DataAccessResourceFailureException("connection refused"));
    RecordingComposer composer = new RecordingComposer();

    RecommendationResult result = engine(store, DIRECT).recommend(request(), composer);

    assertThat(result.outcome()).isEqualTo(RecommendationOutcome.STORE_UNAVAILABLE);
    assertThat(result.userMessage()).isPresent();
    assertThat(composer.seen).isEmpty();
  }

  @Test
  void history_outage_at_commit_records_nothing() {
    seedWardrobe();
    when(queryEmbedder.embedDocument(anyString())).thenReturn(Optional.of(atCosine(0.5)));
    when(historyService.append(eq(TENANT), eq(QUERY), anyList(), any()))
        .thenThrow(new DataAccessResourceFailureException("connection refused"));

    RecommendationResult result =
        engine(store, DIRECT).recommend(request(), new RecordingComposer());

    assertThat(result.outcome()).isEqualTo(RecommendationOutcome.STORE_UNAVAILABLE);
    assertThat(result.groups()).isEmpty();
    assertThat(result.recordId()).isNull();
    assertThat(store.count(PartitionKey.recommendations(TENANT))).isZero();
  }

  @Test
  void missing_query_embedding_is_reported() {
    when(queryEmbedder.embedQuery(anyString())).thenReturn(Optional.empty());

    RecommendationResult result =
        engine(store, DIRECT)
            .recommend(RecommendationRequest.ofText(TENANT, QUERY, null), new RecordingComposer());

    assertThat(result.outcome()).isEqualTo(RecommendationOutcome.EMBEDDING_UNAVAILABLE);
  }

  @Test
  void composer_without_groups_commits_nothing() {
    seedWardrobe();

    RecommendationResult result =
        engine(store, DIRECT).recommend(request(), (query, candidates) -> Optional.empty());

    assertThat(result.outcome()).isEqualTo(RecommendationOutcome.NO_GROUPS);
    assertThat(result.groups()).isEmpty();
    assertThat(result.selected()).isNotEmpty();
    verify(historyService, never()).append(anyString(), anyString(), anyList(), any());
    assertThat(store.count(PartitionKey.recommendations(TENANT))).isZero();
  }

  @Test
  void composer_failure_is_treated_as_no_groups() {
    seedWardrobe();

    RecommendationResult result =
        engine(store, DIRECT)
            .recommend(
                request(),
                (query, candidates) -> {
                  throw new IllegalStateException("model overloaded");
                });

    assertThat(result.outcome()).isEqualTo(RecommendationOutcome.NO_GROUPS);
  }

  @Test
  void interrupted_request_is_not_committed() {
    seedWardrobe();
    Thread.currentThread().interrupt();
    try {
      RecommendationResult result =
          engine(store, DIRECT).recommend(request(), new RecordingComposer());

      assertThat(result.outcome()).isEqualTo(RecommendationOutcome.ABANDONED);
      verify(historyService, never()).append(anyString(), anyString(), anyList(), any());
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  void digest_upsert_failure_keeps_the_ranked_result() {
    seedWardrobe();
    SimilarityStore flaky = mock(SimilarityStore.class);
    when(flaky.search(any(), any(), anyInt(), anyCollection()))
        .thenReturn(store.search(PartitionKey.items(TENANT), query2d(), 4, List.of()));
    acceptCommit();
    doThrow(
            new SimilarityStoreUnavailableException(
                PartitionKey.recommendations(TENANT), "down", new IllegalStateException()))
        .when(flaky)
        .upsert(any(), anyString(), any(), anyMap());

    RecommendationResult result =
        engine(flaky, DIRECT).recommend(request(), new RecordingComposer());

    assertThat(result.outcome()).isEqualTo(RecommendationOutcome.RANKED);
    assertThat(result.groups()).extracting(RankedGroup::rank).containsExactly(1);
  }

  // --- Recent embeddings ---

  @Test
  void recent_embeddings_fall_back_to_history_digests() {
    SimilarityStore failing = mock(SimilarityStore.class);
    when(failing.recent(PartitionKey.recommendations(TENANT), 5))
        .thenThrow(
            new SimilarityStoreUnavailableException(
                PartitionKey.recommendations(TENANT), "down", new IllegalStateException()));
    Embedding digest = atCosine(0.3);
    when(historyService.latest(TENANT, 5))
        .thenReturn(
            List.of(
                new RecentOutput(2L, "q", List.of(), digest, Instant.EPOCH),
                new RecentOutput(1L, "q", List.of(), null, Instant.EPOCH)));

    List<Embedding> recent = engine(failing, DIRECT).recentEmbeddings(TENANT);

    assertThat(recent).containsExactly(digest);
  }

  @Test
  void recent_embeddings_are_empty_when_store_and_history_are_both_down() {
    SimilarityStore failing = mock(SimilarityStore.class);
    when(failing.recent(PartitionKey.recommendations(TENANT), 5))
        .thenThrow(
            new SimilarityStoreUnavailableException(
                PartitionKey.recommendations(TENANT), "down", new IllegalStateException()));
    when(historyService.latest(TENANT, 5))
        .thenThrow(new DataAccessResourceFailureException("connection refused"));

    assertThat(engine(failing, DIRECT).recentEmbeddings(TENANT)).isEmpty();
  }

  @Test
  void recent_embeddings_come_from_the_recommendation_partition() {
    Embedding past = atCosine(0.7);
    store.upsert(PartitionKey.recommendations(TENANT), "1", past, Map.of());
    store.upsert(PartitionKey.items(TENANT), "not-a-recommendation", atCosine(0.2), Map.of());

    assertThat(engine(store, DIRECT).recentEmbeddings(TENANT)).containsExactly(past);
  }
}
