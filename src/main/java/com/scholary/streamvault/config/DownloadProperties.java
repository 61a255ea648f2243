package com.scholary.streamvault.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for download orchestration.
 *
 * <p>Controls concurrency, retries, live-update throttling, playlist limits and where job records
 * are kept.
 */
@ConfigurationProperties(prefix = "downloads")
@Validated
public record DownloadProperties(
    @Min(1) int maxDownloads,
    @Min(1) int maxConcurrencyLimit,
    @Positive int cancelGraceSeconds,
    List<String> allowedHosts,
    @NotNull @Valid RetryProperties retry,
    @NotNull @Valid NotifyProperties notifications,
    @NotNull @Valid PlaylistProperties playlist,
    @NotNull @Valid StoreProperties store,
    @NotNull @Valid SchedulerProperties scheduler) {

  public DownloadProperties {
    allowedHosts = allowedHosts == null ? List.of() : List.copyOf(allowedHosts);
  }

  public record RetryProperties(
      boolean enabled,
      @PositiveOrZero int maxRetries,
      @PositiveOrZero long initialBackoffMs,
      @DecimalMin("1.0") double multiplier,
      @PositiveOrZero long maxBackoffMs) {}

  public record NotifyProperties(
      @Positive long progressIntervalMs,
      @PositiveOrZero long heartbeatIntervalMs,
      @Positive int sendTimeLimitMs,
      @Positive int bufferSizeLimitBytes) {}

  public record PlaylistProperties(@Positive int maxVideos) {}

  public record StoreProperties(@NotNull StoreType type, @NotBlank String directory) {}

  public record SchedulerProperties(@Positive long sweepIntervalMs) {}

  public enum StoreType {
    JSON,
    MEMORY
  }
}
