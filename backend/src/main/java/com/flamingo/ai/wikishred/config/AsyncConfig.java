package com.flamingo.ai.wikishred.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for the article ingestion worker pool. */
@Configuration
public class AsyncConfig {

  /**
   * Pool running one independent task per article.
   *
   * <p>When the queue is full the submitting thread runs the task itself, so a large batch slows
   * down instead of being rejected.
   */
  @Bean(name = "ingestionExecutor")
  public Executor ingestionExecutor(WikiConfig wikiConfig) {
    WikiConfig.Ingestion ingestion = wikiConfig.getIngestion();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(ingestion.getCorePoolSize());
    executor.setMaxPoolSize(ingestion.getMaxPoolSize());
    executor.setQueueCapacity(ingestion.getQueueCapacity());
    executor.setThreadNamePrefix("article-ingest-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.initialize();
    return executor;
  }
}
