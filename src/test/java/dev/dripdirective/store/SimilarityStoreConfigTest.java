package dev.dripdirective.store;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class SimilarityStoreConfigTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(SimilarityStoreConfig.class);

  @Test
  void memory_backend_wires_the_in_memory_store() {
    contextRunner
        .withPropertyValues("dripdirective.store.backend=memory")
        .run(
            context -> {
              assertThat(context).hasSingleBean(SimilarityStore.class);
              assertThat(context.getBean(SimilarityStore.class))
                  .isInstanceOf(InMemorySimilarityStore.class);
            });
  }

  @Test
  void none_backend_wires_the_disabled_store() {
    contextRunner
        .withPropertyValues("dripdirective.store.backend=none")
        .run(
            context -> {
              assertThat(context).hasSingleBean(SimilarityStore.class);
              assertThat(context.getBean(SimilarityStore.class))
                  .isInstanceOf(DisabledSimilarityStore.class);
            });
  }
}
