package com.scholary.streamvault.notify;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.streamvault.job.DownloadJob;
import com.scholary.streamvault.job.InMemoryRecordStore;
import com.scholary.streamvault.job.JobPatch;
import com.scholary.streamvault.job.JobSpec;
import com.scholary.streamvault.job.JobStore;
import com.scholary.streamvault.support.Await;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class UpdateBroadcasterTest {

  private JobStore store;
  private UpdateBroadcaster broadcaster;

  @BeforeEach
  void setUp() {
    store =
        new JobStore(new InMemoryRecordStore<>(), new InMemoryRecordStore<>(), Clock.systemUTC());
    broadcaster = new UpdateBroadcaster(store, Clock.systemUTC(), 1000, 0);
    store.addListener(broadcaster);
  }

  @AfterEach
  void tearDown() {
    broadcaster.shutdown();
  }

  @Test
  void buildMessage_containsStatsAndOnlyActiveJobs() {
    DownloadJob queued = store.create(JobSpec.of("https://example.com/a", null));
    DownloadJob downloading = store.create(JobSpec.of("https://example.com/b", null));
    DownloadJob cancelled = store.create(JobSpec.of("https://example.com/c", null));
    store.update(downloading.id(), JobPatch.start());
    store.update(cancelled.id(), JobPatch.cancel());

    StatsUpdateMessage message = broadcaster.buildMessage();

    assertThat(message.type()).isEqualTo("stats_update");
    assertThat(message.stats().totalDownloads()).isEqualTo(3);
    assertThat(message.stats().activeDownloads()).isEqualTo(1);
    assertThat(message.activeDownloads()).containsOnlyKeys(queued.id(), downloading.id());
  }

  @Test
  void register_sendsCurrentState() {
    store.create(JobSpec.of("https://example.com/a", null));
    RecordingObserver observer = new RecordingObserver("first", Mode.ACCEPT);

    broadcaster.register(observer);

    Await.until(() -> !observer.received.isEmpty(), "initial update");
    assertThat(observer.received.get(0).activeDownloads()).hasSize(1);
  }

  @Test
  void stateChange_isPublished() {
    RecordingObserver observer = new RecordingObserver("first", Mode.ACCEPT);
    broadcaster.register(observer);
    Await.until(() -> observer.received.size() == 1, "initial update");

    DownloadJob job = store.create(JobSpec.of("https://example.com/a", null));

    Await.until(
        () -> observer.last() != null && observer.last().activeDownloads().containsKey(job.id()),
        "update with new job");
  }

  @Test
  void refusingObserver_isDroppedWithoutAffectingOthers() {
    RecordingObserver healthy = new RecordingObserver("healthy", Mode.ACCEPT);
    RecordingObserver full = new RecordingObserver("full", Mode.REFUSE);
    RecordingObserver broken = new RecordingObserver("broken", Mode.THROW);
    broadcaster.register(healthy);
    broadcaster.register(full);
    broadcaster.register(broken);

    broadcaster.publish();

    Await.until(() -> broadcaster.observerCount() == 1, "slow observers dropped");
    broadcaster.publish();
    assertThat(healthy.received).isNotEmpty();
    assertThat(full.received).isEmpty();
    assertThat(broken.received).isEmpty();
  }

  @Test
  void unregister_stopsDelivery() {
    RecordingObserver observer = new RecordingObserver("first", Mode.ACCEPT);
    broadcaster.register(observer);
    broadcaster.unregister(observer);

    broadcaster.publish();

    assertThat(broadcaster.observerCount()).isZero();
  }

  @Test
  void progressBurst_isCoalesced() {
    DownloadJob job = store.create(JobSpec.of("https://example.com/a", null));
    store.update(job.id(), JobPatch.start());
    RecordingObserver observer = new RecordingObserver("first", Mode.ACCEPT);
    broadcaster.register(observer);
    Await.until(() -> !observer.received.isEmpty(), "initial update");
    int baseline = observer.received.size();

    for (int i = 1; i <= 50; i++) {
      store.update(job.id(), JobPatch.progress(i, 100L, 10L));
    }

    Await.until(
        () -> observer.last().activeDownloads().get(job.id()).progressPercent() > 0,
        "progress update");
    assertThat(observer.received.size() - baseline).isLessThan(5);
  }

  @Test
  void stateChangeBurst_isCollapsedIntoOnePublish() throws Exception {
    GatedObserver observer = new GatedObserver();
    broadcaster.register(observer);
    assertThat(observer.entered.await(5, TimeUnit.SECONDS)).isTrue();

    for (int i = 0; i < 50; i++) {
      store.create(JobSpec.of("https://example.com/v" + i, null));
    }
    observer.resume.countDown();

    Await.until(() -> observer.received.size() >= 2, "update after burst");
    assertThat(observer.received).hasSize(2);
    assertThat(observer.received.get(1).activeDownloads()).hasSize(50);
  }

  private enum Mode {
    ACCEPT,
    REFUSE,
    THROW
  }

  /** Holds the publisher thread inside its first delivery until resumed. */
  private static final class GatedObserver implements UpdateObserver {
    private final CountDownLatch entered = new CountDownLatch(1);
    private final CountDownLatch resume = new CountDownLatch(1);
    private final List<StatsUpdateMessage> received = new CopyOnWriteArrayList<>();

    @Override
    public String id() {
      return "gated";
    }

    @Override
    public boolean offer(StatsUpdateMessage message) {
      received.add(message);
      if (received.size() == 1) {
        entered.countDown();
        try {
          resume.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      }
      return true;
    }
  }

  private static final class RecordingObserver implements UpdateObserver {
    private final String id;
    private final Mode mode;
    private final List<StatsUpdateMessage> received = new CopyOnWriteArrayList<>();

    RecordingObserver(String id, Mode mode) {
      this.id = id;
      this.mode = mode;
    }

    @Override
    public String id() {
      return id;
    }

    @Override
    public boolean offer(StatsUpdateMessage message) {
      if (mode == Mode.THROW) {
        throw new IllegalStateException("socket closed");
      }
      if (mode == Mode.REFUSE) {
        return false;
      }
      received.add(message);
      return true;
    }

    StatsUpdateMessage last() {
      return received.isEmpty() ? null : received.get(received.size() - 1);
    }
  }
}
