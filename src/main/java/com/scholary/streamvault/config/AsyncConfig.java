package com.scholary.streamvault.config;

import java.time.Clock;
import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async task execution.
 *
 * <p>Sets up a bounded pool for download workers, sized to the highest {@code maxDownloads} the
 * service accepts, and a small pool for metadata probes that run after submission.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "downloadExecutor")
  public Executor downloadExecutor(DownloadProperties properties) {
    int threads = properties.maxConcurrencyLimit();

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(threads);
    executor.setThreadNamePrefix("download-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "metadataExecutor")
  public Executor metadataExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(2);
    executor.setQueueCapacity(500);
    executor.setThreadNamePrefix("metadata-");
    executor.initialize();
    return executor;
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
