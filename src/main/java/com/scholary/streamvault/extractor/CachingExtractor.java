package com.scholary.streamvault.extractor;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extractor decorator that caches successful probes per URL.
 *
 * <p>The UI analyzes a playlist before submitting it, which would otherwise probe the same URL
 * twice within seconds. Failures are not cached. Fetches always go to the delegate.
 */
public class CachingExtractor implements Extractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(CachingExtractor.class);

  private final Extractor delegate;
  private final Cache<String, MediaProbe> probes;

  public CachingExtractor(Extractor delegate, int maxSize, int ttlMinutes) {
    this.delegate = delegate;
    this.probes =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(ttlMinutes))
            .recordStats()
            .build();

    LOGGER.info("Initialized probe cache: maxSize={}, ttlMinutes={}", maxSize, ttlMinutes);
  }

  @Override
  public MediaProbe probe(String url) {
    MediaProbe cached = probes.getIfPresent(url);
    if (cached != null) {
      LOGGER.debug("Probe cache hit: url={}", url);
      return cached;
    }
    MediaProbe probe = delegate.probe(url);
    probes.put(url, probe);
    return probe;
  }

  @Override
  public FetchResult fetch(
      FetchRequest request, ProgressListener listener, CancellationSignal signal) {
    return delegate.fetch(request, listener, signal);
  }

  @Override
  public void close() {
    probes.invalidateAll();
    delegate.close();
  }

  /**
   * Get cache statistics for monitoring.
   *
   * @return cache stats
   */
  public String getStats() {
    var stats = probes.stats();
    return String.format(
        "ProbeCache[size=%d, hitRate=%.2f%%, evictions=%d]",
        probes.estimatedSize(), stats.hitRate() * 100, stats.evictionCount());
  }
}
