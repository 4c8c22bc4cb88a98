package dev.dripdirective.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.dripdirective.BaseIntegrationTest;
import dev.langchain4j.data.embedding.Embedding;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class PgVectorSimilarityStoreIT extends BaseIntegrationTest {

  private static final int DIMENSION = 384;
  private static final PartitionKey ALICE = PartitionKey.items("alice");
  private static final PartitionKey BOB = PartitionKey.items("bob");

  @Autowired SimilarityStore similarityStore;

  /** Unit vector in the plane of the first two axes with the given cosine to axis 0. */
  private static Embedding atCosine(double cosine) {
    float[] vector = new float[DIMENSION];
    vector[0] = (float) cosine;
    vector[1] = (float) Math.sqrt(1.0 - cosine * cosine);
    return Embedding.from(vector);
  }

  private static Embedding query() {
    return atCosine(1.0);
  }

  @Test
  void search_returns_cosine_similarity_in_descending_order() {
    similarityStore.upsert(ALICE, "low", atCosine(0.2), Map.of());
    similarityStore.upsert(ALICE, "high", atCosine(0.9), Map.of("color", "navy"));
    similarityStore.upsert(ALICE, "mid", atCosine(0.5), Map.of());

    List<SimilarityMatch> result = similarityStore.search(ALICE, query(), 2, List.of());

    assertThat(result).extracting(SimilarityMatch::itemId).containsExactly("high", "mid");
    assertThat(result.get(0).similarity()).isCloseTo(0.9, within(1e-4));
    assertThat(result.get(1).similarity()).isCloseTo(0.5, within(1e-4));
    assertThat(result.get(0).metadata()).containsEntry("color", "navy");
  }

  @Test
  void excluded_ids_do_not_reduce_the_result_count() {
    similarityStore.upsert(ALICE, "a", atCosine(0.9), Map.of());
    similarityStore.upsert(ALICE, "b", atCosine(0.8), Map.of());
    similarityStore.upsert(ALICE, "c", atCosine(0.7), Map.of());

    List<SimilarityMatch> result = similarityStore.search(ALICE, query(), 2, Set.of("a"));

    assertThat(result).extracting(SimilarityMatch::itemId).containsExactly("b", "c");
  }

  @Test
  void same_item_id_in_two_tenants_stays_separate() {
    similarityStore.upsert(ALICE, "42", atCosine(0.9), Map.of());
    similarityStore.upsert(BOB, "42", atCosine(0.1), Map.of());

    assertThat(similarityStore.count(ALICE)).isEqualTo(1);
    assertThat(similarityStore.count(BOB)).isEqualTo(1);
    assertThat(similarityStore.search(BOB, query(), 5, List.of()))
        .singleElement()
        .satisfies(m -> assertThat(m.similarity()).isCloseTo(0.1, within(1e-4)));
  }

  @Test
  void upsert_replaces_and_moves_item_to_most_recent() {
    similarityStore.upsert(ALICE, "a", atCosine(0.1), Map.of());
    similarityStore.upsert(ALICE, "b", atCosine(0.2), Map.of());
    similarityStore.upsert(ALICE, "a", atCosine(0.9), Map.of());

    assertThat(similarityStore.count(ALICE)).isEqualTo(2);
    assertThat(similarityStore.recent(ALICE, 5))
        .extracting(StoredVector::itemId)
        .containsExactly("a", "b");
    assertThat(similarityStore.recent(ALICE, 1).get(0).embedding().vector()[0])
        .isCloseTo(0.9f, within(1e-4f));
  }

  @Test
  void delete_removes_only_the_named_partition_row() {
    similarityStore.upsert(ALICE, "a", atCosine(0.5), Map.of());
    similarityStore.upsert(BOB, "a", atCosine(0.5), Map.of());

    similarityStore.delete(ALICE, "a");

    assertThat(similarityStore.count(ALICE)).isZero();
    assertThat(similarityStore.count(BOB)).isEqualTo(1);
  }

  @Test
  void empty_partition_searches_to_empty_list() {
    assertThat(similarityStore.search(PartitionKey.profiles("nobody"), query(), 5, List.of()))
        .isEmpty();
  }
}
