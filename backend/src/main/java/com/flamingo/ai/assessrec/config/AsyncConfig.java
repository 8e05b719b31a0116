package com.flamingo.ai.assessrec.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors for bounded remote calls. Embedding (queries, health probes) and reranking get their
 * own pools. Neither queues: a call starts on a new thread up to the pool maximum and is rejected
 * beyond it, which the caller treats as the dependency being unavailable.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "embeddingExecutor")
  public AsyncTaskExecutor embeddingExecutor() {
    return directHandoff("embed-", 4, 32);
  }

  @Bean(name = "rerankExecutor")
  public AsyncTaskExecutor rerankExecutor() {
    return directHandoff("rerank-", 2, 16);
  }

  private static ThreadPoolTaskExecutor directHandoff(String prefix, int core, int max) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(core);
    executor.setMaxPoolSize(max);
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix(prefix);
    executor.initialize();
    return executor;
  }
}
