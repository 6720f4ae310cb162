package com.scholary.dubber.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async task execution.
 *
 * <p>Sets up two bounded thread pools: one running whole dubbing jobs, one running the target
 * languages of a job in parallel. A job thread blocks while its languages run, so the two must not
 * share a pool.
 */
@Configuration
public class AsyncConfig {

  public static final String JOB_EXECUTOR = "jobExecutor";
  public static final String LANGUAGE_EXECUTOR = "languageExecutor";

  @Bean(name = JOB_EXECUTOR)
  public Executor jobExecutor(DubbingProperties properties) {
    DubbingProperties.Concurrency concurrency = properties.concurrency();
    return boundedExecutor(
        concurrency.maxConcurrentJobs(), concurrency.queueCapacity(), "dubbing-job-");
  }

  @Bean(name = LANGUAGE_EXECUTOR)
  public Executor languageExecutor(DubbingProperties properties) {
    DubbingProperties.Concurrency concurrency = properties.concurrency();
    return boundedExecutor(
        concurrency.maxConcurrentLanguages(), concurrency.queueCapacity(), "dubbing-lang-");
  }

  private static ThreadPoolTaskExecutor boundedExecutor(
      int threads, int queueSize, String threadNamePrefix) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueSize);
    executor.setThreadNamePrefix(threadNamePrefix);
    executor.initialize();
    return executor;
  }
}
