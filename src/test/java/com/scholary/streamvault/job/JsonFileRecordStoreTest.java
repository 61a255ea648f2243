package com.scholary.streamvault.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileRecordStoreTest {

  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  private final ObjectMapper objectMapper =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

  @TempDir Path tempDir;

  @Test
  void missingFile_startsEmpty() {
    assertThat(reopen(tempDir.resolve("schedules.json")).loadAll()).isEmpty();
  }

  @Test
  void jobsSurviveReopen() {
    Path jobsFile = tempDir.resolve("data/jobs.json");
    JobStore store = openStore(jobsFile);
    DownloadJob job =
        store.create(
            JobSpec.of(
                "https://example.com/a",
                new DownloadOptions(Quality.P720, MediaFormat.MP3, null, null)));
    store.update(job.id(), JobPatch.metadata("A title", "Someone", 42L, null));

    DownloadJob reloaded = openStore(jobsFile).get(job.id()).orElseThrow();

    assertThat(reloaded.title()).isEqualTo("A title");
    assertThat(reloaded.options().quality()).isEqualTo(Quality.P720);
    assertThat(reloaded.options().format()).isEqualTo(MediaFormat.MP3);
    assertThat(reloaded.createdAt()).isEqualTo(NOW);
    assertThat(Files.exists(jobsFile.resolveSibling("jobs.json.tmp"))).isFalse();
  }

  @Test
  void deleteAndClear_areWrittenThrough() {
    Path file = tempDir.resolve("schedules.json");
    JsonFileRecordStore<ScheduleEntry> store = reopen(file);
    store.save("a", new ScheduleEntry("a", NOW.plusSeconds(60), NOW));
    store.save("b", new ScheduleEntry("b", NOW.plusSeconds(120), NOW));

    store.delete("a");
    assertThat(reopen(file).loadAll()).containsOnlyKeys("b");

    store.clear();
    assertThat(reopen(file).loadAll()).isEmpty();
  }

  @Test
  void corruptFile_failsWithStoreError() throws IOException {
    Path file = tempDir.resolve("schedules.json");
    Files.writeString(file, "{not json");

    assertThatThrownBy(() -> reopen(file)).isInstanceOf(JobStoreException.class);
  }

  private JsonFileRecordStore<ScheduleEntry> reopen(Path file) {
    return new JsonFileRecordStore<>(file, ScheduleEntry.class, objectMapper);
  }

  private JobStore openStore(Path jobsFile) {
    return new JobStore(
        new JsonFileRecordStore<>(jobsFile, DownloadJob.class, objectMapper),
        new InMemoryRecordStore<>(),
        Clock.fixed(NOW, ZoneOffset.UTC));
  }
}
