package dev.dripdirective.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded executor for similarity-store calls. Running the backend call off the request thread lets
 * the pipeline enforce {@code dripdirective.recommendation.search-timeout-ms} and degrade to an
 * empty candidate list instead of waiting indefinitely.
 */
@Configuration
public class SearchExecutorConfig {

  @Bean(name = "similaritySearchExecutor")
  public ThreadPoolTaskExecutor similaritySearchExecutor(
      @Value("${dripdirective.search-executor.pool-size:8}") int poolSize,
      @Value("${dripdirective.search-executor.queue-capacity:100}") int queueCapacity) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(poolSize);
    executor.setMaxPoolSize(poolSize);
    executor.setQueueCapacity(queueCapacity);
    executor.setThreadNamePrefix("similarity-search-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(5);
    executor.initialize();
    return executor;
  }
}
