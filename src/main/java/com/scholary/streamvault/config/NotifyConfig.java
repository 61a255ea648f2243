package com.scholary.streamvault.config;

import com.scholary.streamvault.job.JobStore;
import com.scholary.streamvault.notify.UpdateBroadcaster;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the update broadcaster.
 *
 * <p>The broadcaster subscribes to every job store change and runs its own publisher thread.
 */
@Configuration
public class NotifyConfig {

  @Bean(initMethod = "start", destroyMethod = "shutdown")
  public UpdateBroadcaster updateBroadcaster(
      JobStore jobStore, Clock clock, DownloadProperties properties) {
    DownloadProperties.NotifyProperties settings = properties.notifications();
    UpdateBroadcaster broadcaster =
        new UpdateBroadcaster(
            jobStore, clock, settings.progressIntervalMs(), settings.heartbeatIntervalMs());
    jobStore.addListener(broadcaster);
    return broadcaster;
  }
}
