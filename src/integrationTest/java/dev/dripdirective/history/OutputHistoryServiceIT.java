package dev.dripdirective.history;

import static org.assertj.core.api.Assertions.assertThat;

import dev.dripdirective.BaseIntegrationTest;
import dev.langchain4j.data.embedding.Embedding;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class OutputHistoryServiceIT extends BaseIntegrationTest {

  @Autowired OutputHistoryService historyService;

  @Test
  void appended_records_read_back_newest_first() {
    historyService.append("alice", "first", List.of(List.of("1", "2")), null);
    historyService.append(
        "alice", "second", List.of(List.of("3"), List.of("4")), Embedding.from(new float[] {1f}));

    List<RecentOutput> latest = historyService.latest("alice", 5);

    assertThat(latest).extracting(RecentOutput::query).containsExactly("second", "first");
    assertThat(latest.get(0).itemGroups()).containsExactly(List.of("3"), List.of("4"));
    assertThat(latest.get(0).digestEmbedding()).isNotNull();
    assertThat(latest.get(1).digestEmbedding()).isNull();
  }

  @Test
  void records_are_scoped_per_tenant() {
    RecentOutput aliceRecord = historyService.append("alice", "q", List.of(List.of("1")), null);
    historyService.append("bob", "q", List.of(List.of("9")), null);

    assertThat(historyService.latest("alice", 5)).hasSize(1);
    assertThat(historyService.find("bob", aliceRecord.recordId())).isEmpty();
    assertThat(historyService.find("alice", aliceRecord.recordId())).isPresent();
  }

  @Test
  void latest_is_bounded_by_limit() {
    for (int i = 0; i < 4; i++) {
      historyService.append("alice", "q" + i, List.of(List.of(String.valueOf(i))), null);
    }

    assertThat(historyService.latest("alice", 2))
        .extracting(RecentOutput::query)
        .containsExactly("q3", "q2");
  }
}
