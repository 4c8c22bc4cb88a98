package dev.dripdirective.recommend;

import static dev.dripdirective.fixture.WardrobeItemBuilder.aWardrobeItem;
import static org.assertj.core.api.Assertions.assertThat;

import dev.dripdirective.BaseIntegrationTest;
import dev.dripdirective.diversify.Candidate;
import dev.dripdirective.history.OutputHistoryService;
import dev.dripdirective.ingestion.WardrobeIndexingService;
import dev.dripdirective.ranking.ComposedGroup;
import dev.dripdirective.store.PartitionKey;
import dev.dripdirective.store.SimilarityStore;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class RecommendationEngineIT extends BaseIntegrationTest {

  private static final String TENANT = "alice";

  @Autowired RecommendationEngine engine;

  @Autowired WardrobeIndexingService indexingService;

  @Autowired OutputHistoryService historyService;

  @Autowired SimilarityStore similarityStore;

  /** Puts the two best candidates into one outfit. */
  private static final OutfitComposer TOP_PAIR =
      (query, candidates) ->
          Optional.of(
              List.of(
                  new ComposedGroup(
                      1,
                      "Pair",
                      candidates.stream().limit(2).map(Candidate::itemId).toList(),
                      0.7,
                      "Two pieces that work together")));

  @BeforeEach
  void indexWardrobe() {
    index("1", "blazer", "formal", "navy", "office", "meeting");
    index("2", "dress shirt", "formal", "white", "office");
    index("3", "chinos", "smart casual", "beige", "office", "weekend");
    index("4", "oxford shoes", "formal", "brown", "office", "wedding");
  }

  private void index(
      String itemId, String garmentType, String style, String color, String... occasions) {
    indexingService.indexItem(
        TENANT,
        aWardrobeItem()
            .itemId(itemId)
            .garmentType(garmentType)
            .style(style)
            .primaryColor(color)
            .occasions(occasions)
            .build());
  }

  @Test
  void ranked_recommendation_is_recorded_and_digest_indexed() {
    RecommendationResult result =
        engine.recommend(
            RecommendationRequest.ofText(TENANT, "outfit for an office meeting", null), TOP_PAIR);

    assertThat(result.outcome()).isEqualTo(RecommendationOutcome.RANKED);
    assertThat(result.groups()).singleElement().satisfies(g -> assertThat(g.itemIds()).hasSize(2));
    assertThat(historyService.latest(TENANT, 1)).hasSize(1);
    assertThat(similarityStore.count(PartitionKey.recommendations(TENANT))).isEqualTo(1);
  }

  @Test
  void items_from_the_last_recommendation_cool_down() {
    RecommendationRequest request =
        RecommendationRequest.ofText(TENANT, "outfit for an office meeting", null);
    RecommendationResult first = engine.recommend(request, TOP_PAIR);
    List<String> used = first.groups().get(0).itemIds();

    RecommendationResult second = engine.recommend(request, TOP_PAIR);

    assertThat(second.selected()).extracting(Candidate::itemId).doesNotContainAnyElementsOf(used);
  }

  @Test
  void unknown_tenant_has_no_candidates_and_nothing_is_recorded() {
    RecommendationResult result =
        engine.recommend(RecommendationRequest.ofText("nobody", "anything", null), TOP_PAIR);

    assertThat(result.outcome()).isEqualTo(RecommendationOutcome.NO_CANDIDATES);
    assertThat(historyService.latest("nobody", 5)).isEmpty();
  }
}
