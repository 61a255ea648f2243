package com.scholary.streamvault.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.streamvault.job.DownloadJob;
import com.scholary.streamvault.job.InMemoryRecordStore;
import com.scholary.streamvault.job.JobStore;
import com.scholary.streamvault.job.JsonFileRecordStore;
import com.scholary.streamvault.job.RecordStore;
import com.scholary.streamvault.job.ScheduleEntry;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for job persistence.
 *
 * <p>Jobs and schedule entries are kept in two JSON files under {@code downloads.store.directory},
 * or only in memory when {@code downloads.store.type=memory}.
 */
@Configuration
@EnableConfigurationProperties(DownloadProperties.class)
public class JobStoreConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobStoreConfig.class);

  @Bean
  public JobStore jobStore(DownloadProperties properties, ObjectMapper objectMapper, Clock clock) {
    DownloadProperties.StoreProperties store = properties.store();
    RecordStore<DownloadJob> jobRecords;
    RecordStore<ScheduleEntry> scheduleRecords;
    if (store.type() == DownloadProperties.StoreType.MEMORY) {
      jobRecords = new InMemoryRecordStore<>();
      scheduleRecords = new InMemoryRecordStore<>();
    } else {
      Path directory = Paths.get(store.directory()).toAbsolutePath();
      jobRecords =
          new JsonFileRecordStore<>(
              directory.resolve("jobs.json"), DownloadJob.class, objectMapper);
      scheduleRecords =
          new JsonFileRecordStore<>(
              directory.resolve("schedules.json"), ScheduleEntry.class, objectMapper);
    }
    LOGGER.info("Job store type: {}", store.type());
    return new JobStore(jobRecords, scheduleRecords, clock);
  }
}
