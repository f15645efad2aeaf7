package com.scholary.vocab.config;

import com.scholary.vocab.logging.MdcTaskDecorator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async task execution.
 *
 * <p>Two bounded pools: {@code runExecutor} drives whole pipeline runs started over REST, {@code
 * termExecutor} resolves individual terms. The term pool size caps the number of concurrent
 * service calls, which keeps the pipeline inside the services' rate limits. The orchestrator holds
 * one permit per term thread, so terms wait for a free worker before they reach the queue.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "runExecutor")
  public ThreadPoolTaskExecutor runExecutor(
      @Value("${pipeline.runExecutorThreads:2}") int threads,
      @Value("${pipeline.runExecutorQueueSize:10}") int queueSize) {

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueSize);
    executor.setThreadNamePrefix("vocab-run-");
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.initialize();
    return executor;
  }

  @Bean(name = "termExecutor")
  public ThreadPoolTaskExecutor termExecutor(
      @Value("${pipeline.workerThreads}") int threads,
      @Value("${pipeline.workerQueueSize}") int queueSize) {

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueSize);
    executor.setThreadNamePrefix("vocab-term-");
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.initialize();
    return executor;
  }
}
