package com.scholary.streamvault.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.streamvault.config.DownloadProperties;
import com.scholary.streamvault.dispatch.DownloadDispatcher;
import com.scholary.streamvault.dispatch.RetryPolicy;
import com.scholary.streamvault.error.ErrorKind;
import com.scholary.streamvault.extractor.MediaProbe;
import com.scholary.streamvault.extractor.PlaylistAnalysis;
import com.scholary.streamvault.extractor.PlaylistEntry;
import com.scholary.streamvault.job.DownloadJob;
import com.scholary.streamvault.job.DownloadOptions;
import com.scholary.streamvault.job.InMemoryRecordStore;
import com.scholary.streamvault.job.JobSpec;
import com.scholary.streamvault.job.JobState;
import com.scholary.streamvault.job.JobStore;
import com.scholary.streamvault.job.MediaFormat;
import com.scholary.streamvault.schedule.DownloadScheduler;
import com.scholary.streamvault.stats.StatisticsAggregator;
import com.scholary.streamvault.support.Await;
import com.scholary.streamvault.support.ScriptedExtractor;
import com.scholary.streamvault.support.ScriptedExtractor.Behavior;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Orchestrator wired to real store, dispatcher and scheduler, with a scripted extractor. */
class DownloadOrchestratorTest {

  private static final String A = "https://example.com/watch?v=a";
  private static final String B = "https://example.com/watch?v=b";
  private static final String C = "https://example.com/watch?v=c";
  private static final String PLAYLIST = "https://example.com/playlist?list=pl";

  @TempDir Path tempDir;

  private JobStore store;
  private ScriptedExtractor extractor;
  private ExecutorService workers;
  private DownloadDispatcher dispatcher;
  private DownloadScheduler scheduler;
  private DownloadOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    Clock clock = Clock.systemUTC();
    store = new JobStore(new InMemoryRecordStore<>(), new InMemoryRecordStore<>(), clock);
    extractor = new ScriptedExtractor(tempDir);
    workers = Executors.newCachedThreadPool();
    dispatcher = new DownloadDispatcher(store, extractor, workers, RetryPolicy.disabled(), 1);
    scheduler = new DownloadScheduler(store, dispatcher, clock);
    DownloadProperties properties =
        new DownloadProperties(
            1,
            4,
            5,
            List.of(),
            new DownloadProperties.RetryProperties(false, 0, 0, 1.0, 0),
            new DownloadProperties.NotifyProperties(1000, 0, 5000, 65536),
            new DownloadProperties.PlaylistProperties(3),
            new DownloadProperties.StoreProperties(DownloadProperties.StoreType.MEMORY, "unused"),
            new DownloadProperties.SchedulerProperties(1000));
    orchestrator =
        new DownloadOrchestrator(
            store,
            dispatcher,
            scheduler,
            extractor,
            new StatisticsAggregator(store),
            Runnable::run,
            clock,
            properties);
  }

  @AfterEach
  void tearDown() {
    dispatcher.shutdown();
    workers.shutdownNow();
  }

  @Test
  void submitSingle_downloadsToCompletion() {
    DownloadJob job = orchestrator.submitSingle(A, null, null);

    assertThat(job.state()).isEqualTo(JobState.QUEUED);
    awaitState(job, JobState.COMPLETED);
    assertThat(orchestrator.getStatistics().doneDownloads()).isEqualTo(1);
  }

  @Test
  void submitSingle_invalidUrl_createsNothing() {
    assertThatThrownBy(() -> orchestrator.submitSingle("ftp://example.com/x", null, null))
        .hasFieldOrPropertyWithValue("kind", ErrorKind.INVALID_URL);
    assertThat(orchestrator.listJobs()).isEmpty();
  }

  @Test
  void submitSingle_withFutureTime_isScheduledWithMetadata() {
    String fireAt = Instant.now().plusSeconds(3600).toString();

    DownloadJob job = orchestrator.submitSingle(A, null, fireAt);

    DownloadJob stored = orchestrator.getJob(job.id());
    assertThat(stored.state()).isEqualTo(JobState.SCHEDULED);
    assertThat(stored.scheduledAt()).isEqualTo(Instant.parse(fireAt));
    assertThat(stored.title()).isEqualTo("Title of " + A);
    assertThat(scheduler.pendingCount()).isEqualTo(1);
  }

  @Test
  void submitSingle_pastTime_rejected() {
    String past = Instant.now().minusSeconds(60).toString();

    assertThatThrownBy(() -> orchestrator.submitSingle(A, null, past))
        .hasFieldOrPropertyWithValue("kind", ErrorKind.INVALID_TIME);
    assertThat(orchestrator.listJobs()).isEmpty();
  }

  @Test
  void submitBulk_dropsDuplicatesAndKeepsOrder() {
    List<DownloadJob> jobs = orchestrator.submitBulk(List.of(A, " " + A + " ", B), null, null);

    assertThat(jobs).extracting(DownloadJob::sourceUrl).containsExactly(A, B);
  }

  @Test
  void submitBulk_oneInvalidUrl_createsNothing() {
    assertThatThrownBy(() -> orchestrator.submitBulk(List.of(A, "nope", B), null, null))
        .hasFieldOrPropertyWithValue("kind", ErrorKind.INVALID_URL)
        .hasMessageContaining("#2");
    assertThat(orchestrator.listJobs()).isEmpty();
  }

  @Test
  void submitBulk_emptyList_createsNothing() {
    assertThat(orchestrator.submitBulk(List.of(), null, null)).isEmpty();
    assertThat(orchestrator.submitBulk(null, null, null)).isEmpty();
  }

  @Test
  void submitBulk_badTemplate_rejected() {
    DownloadOptions options = new DownloadOptions(null, MediaFormat.MP3, "../escape", null);

    assertThatThrownBy(() -> orchestrator.submitBulk(List.of(A), options, null))
        .hasFieldOrPropertyWithValue("kind", ErrorKind.INVALID_REQUEST);
  }

  @Test
  void submitPlaylist_keepsPlaylistOrderAndEntryMetadata() {
    extractor.probeResult(PLAYLIST, playlistOf(5));

    List<DownloadJob> jobs = orchestrator.submitPlaylist(PLAYLIST, null, 2, null);

    assertThat(jobs).extracting(DownloadJob::sourceUrl).containsExactly(entryUrl(1), entryUrl(2));
    assertThat(jobs).extracting(DownloadJob::title).containsExactly("Entry 1", "Entry 2");
  }

  @Test
  void submitPlaylist_requestAboveCap_usesConfiguredMaximum() {
    extractor.probeResult(PLAYLIST, playlistOf(5));

    assertThat(orchestrator.submitPlaylist(PLAYLIST, null, 10, null)).hasSize(3);
  }

  @Test
  void submitPlaylist_nonPositiveMax_rejected() {
    assertThatThrownBy(() -> orchestrator.submitPlaylist(PLAYLIST, null, 0, null))
        .hasFieldOrPropertyWithValue("kind", ErrorKind.INVALID_REQUEST);
  }

  @Test
  void submitPlaylist_singleVideo_unsupported() {
    assertThatThrownBy(() -> orchestrator.submitPlaylist(A, null, null, null))
        .hasFieldOrPropertyWithValue("kind", ErrorKind.UNSUPPORTED);
    assertThat(orchestrator.listJobs()).isEmpty();
  }

  @Test
  void analyze_returnsProbeWithoutCreatingJobs() {
    MediaProbe probe = orchestrator.analyze(A);

    assertThat(probe.type()).isEqualTo(MediaProbe.Type.VIDEO);
    assertThat(probe.video().title()).isEqualTo("Title of " + A);
    assertThat(orchestrator.listJobs()).isEmpty();
  }

  @Test
  void schedule_checksExistenceBeforeTime() {
    assertThatThrownBy(() -> orchestrator.schedule("missing", "yesterday"))
        .hasFieldOrPropertyWithValue("kind", ErrorKind.NOT_FOUND);
  }

  @Test
  void schedule_rejectsPastAndGarbageTimes() throws Exception {
    extractor.script(A, Behavior.BLOCK);
    orchestrator.submitSingle(A, null, null);
    DownloadJob queued = orchestrator.submitSingle(B, null, null);

    assertThatThrownBy(() -> orchestrator.schedule(queued.id(), "soon"))
        .hasFieldOrPropertyWithValue("kind", ErrorKind.INVALID_TIME);
    assertThatThrownBy(
            () -> orchestrator.schedule(queued.id(), Instant.now().minusSeconds(1).toString()))
        .hasFieldOrPropertyWithValue("kind", ErrorKind.INVALID_TIME);
    extractor.release(A);
  }

  @Test
  void schedule_downloadingJob_invalidState() throws Exception {
    extractor.script(A, Behavior.BLOCK);
    DownloadJob job = orchestrator.submitSingle(A, null, null);
    extractor.awaitStarted(A);

    assertThatThrownBy(
            () -> orchestrator.schedule(job.id(), Instant.now().plusSeconds(60).toString()))
        .hasFieldOrPropertyWithValue("kind", ErrorKind.INVALID_STATE);
    extractor.release(A);
  }

  @Test
  void unschedule_queuesJob() {
    DownloadJob job =
        orchestrator.submitSingle(A, null, Instant.now().plusSeconds(3600).toString());

    orchestrator.unschedule(job.id());

    awaitState(job, JobState.COMPLETED);
    assertThat(scheduler.pendingCount()).isZero();
  }

  @Test
  void cancelJob_scheduledJob_isCancelled() {
    DownloadJob job =
        orchestrator.submitSingle(A, null, Instant.now().plusSeconds(3600).toString());

    DownloadJob cancelled = orchestrator.cancelJob(job.id());

    assertThat(cancelled.state()).isEqualTo(JobState.CANCELLED);
    assertThat(store.scheduleEntries()).isEmpty();
  }

  @Test
  void cancelJob_finishedJob_invalidState() {
    DownloadJob job = orchestrator.submitSingle(A, null, null);
    awaitState(job, JobState.COMPLETED);

    assertThatThrownBy(() -> orchestrator.cancelJob(job.id()))
        .hasFieldOrPropertyWithValue("kind", ErrorKind.INVALID_STATE);
  }

  @Test
  void cancelJob_downloading_endsCancelled() throws Exception {
    extractor.script(A, Behavior.BLOCK);
    DownloadJob job = orchestrator.submitSingle(A, null, null);
    extractor.awaitStarted(A);

    orchestrator.cancelJob(job.id());

    awaitState(job, JobState.CANCELLED);
    Await.until(() -> !Files.exists(extractor.workDir(job.id())), "partials removed");
  }

  @Test
  void listJobs_newestFirst() {
    DownloadJob first = orchestrator.submitSingle(A, null, null);
    DownloadJob second = orchestrator.submitSingle(B, null, null);

    assertThat(orchestrator.listJobs())
        .extracting(DownloadJob::id)
        .containsExactly(second.id(), first.id());
  }

  @Test
  void getJob_unknown_notFound() {
    assertThatThrownBy(() -> orchestrator.getJob("missing"))
        .hasFieldOrPropertyWithValue("kind", ErrorKind.NOT_FOUND);
  }

  @Test
  void resolveFile_onlyForCompletedJobs() throws Exception {
    extractor.script(B, Behavior.BLOCK);
    DownloadJob done = orchestrator.submitSingle(A, null, null);
    awaitState(done, JobState.COMPLETED);
    DownloadJob running = orchestrator.submitSingle(B, null, null);
    extractor.awaitStarted(B);

    Path file = orchestrator.resolveFile(done.id());
    assertThat(file).exists();
    assertThatThrownBy(() -> orchestrator.resolveFile(running.id()))
        .hasFieldOrPropertyWithValue("kind", ErrorKind.NOT_FOUND);

    Files.delete(file);
    assertThatThrownBy(() -> orchestrator.resolveFile(done.id()))
        .hasFieldOrPropertyWithValue("kind", ErrorKind.NOT_FOUND);
    extractor.release(B);
  }

  @Test
  void deleteJob_completed_removesFile() {
    DownloadJob job = orchestrator.submitSingle(A, null, null);
    awaitState(job, JobState.COMPLETED);
    Path file = orchestrator.resolveFile(job.id());

    orchestrator.deleteJob(job.id());

    assertThat(file).doesNotExist();
    assertThatThrownBy(() -> orchestrator.getJob(job.id()))
        .hasFieldOrPropertyWithValue("kind", ErrorKind.NOT_FOUND);
  }

  @Test
  void deleteJob_downloading_stopsFetchFirst() throws Exception {
    extractor.script(A, Behavior.BLOCK);
    DownloadJob job = orchestrator.submitSingle(A, null, null);
    extractor.awaitStarted(A);

    orchestrator.deleteJob(job.id());

    assertThat(store.get(job.id())).isEmpty();
    assertThat(extractor.workDir(job.id())).doesNotExist();
    assertThat(orchestrator.getStatistics().activeDownloads()).isZero();
  }

  @Test
  void clearHistory_removesEverything() throws Exception {
    extractor.script(A, Behavior.BLOCK);
    orchestrator.submitSingle(A, null, null);
    orchestrator.submitSingle(B, null, Instant.now().plusSeconds(3600).toString());
    extractor.awaitStarted(A);

    int removed = orchestrator.clearHistory();

    assertThat(removed).isEqualTo(2);
    assertThat(orchestrator.listJobs()).isEmpty();
    assertThat(scheduler.pendingCount()).isZero();
    assertThat(store.scheduleEntries()).isEmpty();
  }

  @Test
  void clearHistory_queuedJobNeverStarts() throws Exception {
    extractor.script(A, Behavior.BLOCK);
    extractor.script(B, Behavior.BLOCK);
    DownloadJob running = orchestrator.submitSingle(A, null, null);
    DownloadJob queued = orchestrator.submitSingle(B, null, null);
    extractor.awaitStarted(A);

    orchestrator.clearHistory();
    DownloadJob after = orchestrator.submitSingle(C, null, null);
    awaitState(after, JobState.COMPLETED);

    assertThat(extractor.fetchOrder()).containsExactly(A, C);
    assertThat(extractor.workDir(running.id())).doesNotExist();
    assertThat(extractor.workDir(queued.id())).doesNotExist();
    assertThat(orchestrator.listJobs()).extracting(DownloadJob::id).containsExactly(after.id());
  }

  @Test
  void deleteJob_queued_neverStarts() throws Exception {
    extractor.script(A, Behavior.BLOCK);
    DownloadJob running = orchestrator.submitSingle(A, null, null);
    DownloadJob queued = orchestrator.submitSingle(B, null, null);
    extractor.awaitStarted(A);

    orchestrator.deleteJob(queued.id());
    extractor.release(A);
    awaitState(running, JobState.COMPLETED);
    DownloadJob after = orchestrator.submitSingle(C, null, null);
    awaitState(after, JobState.COMPLETED);

    assertThat(extractor.fetchOrder()).containsExactly(A, C);
    assertThat(store.get(queued.id())).isEmpty();
  }

  @Test
  void setMaxDownloads_enforcesBounds() {
    assertThatThrownBy(() -> orchestrator.setMaxDownloads(0))
        .hasFieldOrPropertyWithValue("kind", ErrorKind.INVALID_REQUEST);
    assertThatThrownBy(() -> orchestrator.setMaxDownloads(5))
        .hasFieldOrPropertyWithValue("kind", ErrorKind.INVALID_REQUEST);

    assertThat(orchestrator.setMaxDownloads(4)).isEqualTo(4);
    Await.until(() -> orchestrator.getMaxDownloads() == 4, "new limit");
  }

  @Test
  void recover_enqueuesQueuedJobsFromStore() {
    JobStore restored =
        new JobStore(new InMemoryRecordStore<>(), new InMemoryRecordStore<>(), Clock.systemUTC());
    for (String url : Arrays.asList(A, B)) {
      restored.create(JobSpec.of(url, null));
    }
    DownloadDispatcher restoredDispatcher =
        new DownloadDispatcher(restored, extractor, workers, RetryPolicy.disabled(), 2);
    DownloadScheduler restoredScheduler =
        new DownloadScheduler(restored, restoredDispatcher, Clock.systemUTC());
    DownloadOrchestrator restarted =
        new DownloadOrchestrator(
            restored,
            restoredDispatcher,
            restoredScheduler,
            extractor,
            new StatisticsAggregator(restored),
            Runnable::run,
            Clock.systemUTC(),
            new DownloadProperties(
                2,
                4,
                5,
                null,
                new DownloadProperties.RetryProperties(false, 0, 0, 1.0, 0),
                new DownloadProperties.NotifyProperties(1000, 0, 5000, 65536),
                new DownloadProperties.PlaylistProperties(3),
                new DownloadProperties.StoreProperties(
                    DownloadProperties.StoreType.MEMORY, "unused"),
                new DownloadProperties.SchedulerProperties(1000)));
    try {
      restarted.recover();

      Await.until(
          () -> restarted.getStatistics().doneDownloads() == 2, "recovered jobs to finish");
      assertThat(extractor.fetchOrder()).containsExactlyInAnyOrder(A, B);
    } finally {
      restoredDispatcher.shutdown();
    }
  }

  private void awaitState(DownloadJob job, JobState expected) {
    Await.until(
        () -> store.get(job.id()).map(DownloadJob::state).orElse(null) == expected,
        job.sourceUrl() + " to become " + expected);
  }

  private static MediaProbe playlistOf(int size) {
    List<PlaylistEntry> entries = new ArrayList<>();
    for (int i = 1; i <= size; i++) {
      entries.add(new PlaylistEntry(entryUrl(i), "Entry " + i, "Channel", 60L, null));
    }
    return MediaProbe.playlist(new PlaylistAnalysis("My list", PLAYLIST, size, entries));
  }

  private static String entryUrl(int index) {
    return "https://example.com/watch?v=entry" + index;
  }
}
