package com.ospicorp.anomalyapi.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Two bounded pools: one that runs model-store reads for cache misses, and one that writes
 * prediction logs. Both reject rather than queue without limit.
 */
@Configuration
@EnableAsync
public class ExecutorConfig {

  @Bean(name = "storeLoaderExecutor")
  ThreadPoolTaskExecutor storeLoaderExecutor(
      @Value("${anomaly.inference.loader-threads:8}") int threads,
      @Value("${anomaly.inference.loader-queue:256}") int queueCapacity) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix("model-loader-");
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueCapacity);
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(false);
    return executor;
  }

  @Bean(name = "telemetryExecutor")
  ThreadPoolTaskExecutor telemetryExecutor(
      @Value("${anomaly.telemetry.threads:2}") int threads,
      @Value("${anomaly.telemetry.queue:10000}") int queueCapacity) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix("telemetry-");
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueCapacity);
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(5);
    return executor;
  }
}
