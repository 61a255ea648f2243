package com.scholary.streamvault.config;

import com.scholary.streamvault.dispatch.DownloadDispatcher;
import com.scholary.streamvault.dispatch.RetryPolicy;
import com.scholary.streamvault.extractor.Extractor;
import com.scholary.streamvault.job.JobStore;
import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for the dispatch loop and its retry policy. */
@Configuration
public class DispatchConfig {

  @Bean
  public RetryPolicy retryPolicy(DownloadProperties properties) {
    DownloadProperties.RetryProperties retry = properties.retry();
    return new RetryPolicy(
        retry.enabled(),
        retry.maxRetries(),
        retry.initialBackoffMs(),
        retry.multiplier(),
        retry.maxBackoffMs());
  }

  @Bean(destroyMethod = "shutdown")
  public DownloadDispatcher downloadDispatcher(
      JobStore jobStore,
      Extractor extractor,
      @Qualifier("downloadExecutor") Executor downloadExecutor,
      RetryPolicy retryPolicy,
      DownloadProperties properties) {
    return new DownloadDispatcher(
        jobStore, extractor, downloadExecutor, retryPolicy, properties.maxDownloads());
  }
}
