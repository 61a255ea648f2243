package com.scholary.streamvault.api;

import com.scholary.streamvault.extractor.MediaProbe;
import com.scholary.streamvault.job.DownloadJob;
import com.scholary.streamvault.service.DownloadOrchestrator;
import com.scholary.streamvault.stats.StatisticsSnapshot;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for video downloads.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Submitting single, bulk and playlist downloads
 *   <li>Listing, scheduling, cancelling and deleting jobs
 *   <li>Statistics and the concurrent download limit
 *   <li>Retrieving finished files
 * </ul>
 *
 * <p>Live updates are pushed over the WebSocket at {@code /api/ws}.
 */
@RestController
@RequestMapping("/api")
@Tag(name = "Downloads", description = "Video download orchestration API")
public class DownloadController {

  private static final Logger LOGGER = LoggerFactory.getLogger(DownloadController.class);

  private final DownloadOrchestrator orchestrator;

  public DownloadController(DownloadOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @GetMapping({"", "/"})
  @Operation(summary = "Service banner")
  public MessageResponse root() {
    return new MessageResponse("StreamVault Video Downloader API");
  }

  @GetMapping("/stats")
  @Operation(summary = "Aggregate download statistics")
  public StatisticsSnapshot stats() {
    return orchestrator.getStatistics();
  }

  @PostMapping("/analyze")
  @Operation(
      summary = "Analyze a URL",
      description = "Probe a video or playlist URL and return its metadata without downloading.")
  public MediaProbe analyze(@Valid @RequestBody AnalyzeRequest request) {
    return orchestrator.analyze(request.url());
  }

  @PostMapping("/download")
  @Operation(
      summary = "Download a single video",
      description =
          "Create one job. It starts when a download slot is free, or at schedule_at if given.")
  public ResponseEntity<SubmitResponse> download(@Valid @RequestBody DownloadRequest request) {
    LOGGER.info("Download request: url={}", request.url());
    DownloadJob job =
        orchestrator.submitSingle(request.url(), request.options(), request.scheduleAt());
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(SubmitResponse.of(List.of(job)));
  }

  @PostMapping("/download/bulk")
  @Operation(
      summary = "Download several videos",
      description =
          "All URLs are validated before any job is created. Duplicate URLs are submitted once.")
  public ResponseEntity<SubmitResponse> downloadBulk(
      @Valid @RequestBody BulkDownloadRequest request) {
    LOGGER.info("Bulk download request: urls={}", request.urls().size());
    List<DownloadJob> jobs =
        orchestrator.submitBulk(request.urls(), request.options(), request.scheduleAt());
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(SubmitResponse.of(jobs));
  }

  @PostMapping("/download/playlist")
  @Operation(
      summary = "Download a playlist or channel",
      description = "Expand the playlist into one job per entry, in playlist order.")
  public ResponseEntity<SubmitResponse> downloadPlaylist(
      @Valid @RequestBody PlaylistRequest request) {
    LOGGER.info("Playlist request: url={}, maxVideos={}", request.url(), request.maxVideos());
    List<DownloadJob> jobs =
        orchestrator.submitPlaylist(
            request.url(), request.options(), request.maxVideos(), request.scheduleAt());
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(SubmitResponse.of(jobs));
  }

  @GetMapping("/downloads")
  @Operation(summary = "List all jobs, newest first")
  public List<DownloadJob> listDownloads() {
    return orchestrator.listJobs();
  }

  @GetMapping("/downloads/{id}")
  @Operation(summary = "Get one job")
  public DownloadJob getDownload(@PathVariable String id) {
    return orchestrator.getJob(id);
  }

  @PostMapping("/downloads/{id}/schedule")
  @Operation(summary = "Schedule or reschedule a queued job")
  public DownloadJob schedule(
      @PathVariable String id, @Valid @RequestBody ScheduleRequest request) {
    return orchestrator.schedule(id, request.fireAt());
  }

  @DeleteMapping("/downloads/{id}/schedule")
  @Operation(summary = "Drop a schedule and queue the job now")
  public DownloadJob unschedule(@PathVariable String id) {
    return orchestrator.unschedule(id);
  }

  @PostMapping("/downloads/{id}/cancel")
  @Operation(summary = "Cancel a queued, scheduled or running job")
  public DownloadJob cancel(@PathVariable String id) {
    return orchestrator.cancelJob(id);
  }

  @DeleteMapping("/downloads/{id}")
  @Operation(
      summary = "Delete a job",
      description = "Cancels it first if running. The file of a completed job is removed too.")
  public MessageResponse deleteDownload(@PathVariable String id) {
    orchestrator.deleteJob(id);
    return new MessageResponse("Download deleted");
  }

  @DeleteMapping("/downloads")
  @Operation(
      summary = "Clear history",
      description = "Cancels active downloads and removes all jobs. Files stay on disk.")
  public MessageResponse clearHistory() {
    int removed = orchestrator.clearHistory();
    return new MessageResponse("History cleared: " + removed + " downloads removed");
  }

  @GetMapping("/settings/max-downloads")
  @Operation(summary = "Current concurrent download limit")
  public MaxDownloadsRequest getMaxDownloads() {
    return new MaxDownloadsRequest(orchestrator.getMaxDownloads());
  }

  @PutMapping("/settings/max-downloads")
  @Operation(summary = "Change the concurrent download limit")
  public MaxDownloadsRequest setMaxDownloads(@Valid @RequestBody MaxDownloadsRequest request) {
    return new MaxDownloadsRequest(orchestrator.setMaxDownloads(request.maxDownloads()));
  }

  @GetMapping("/download/{id}/file")
  @Operation(summary = "Download the file of a completed job")
  public ResponseEntity<Resource> downloadFile(@PathVariable String id) {
    Path path = orchestrator.resolveFile(id);
    return ResponseEntity.ok()
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment()
                .filename(path.getFileName().toString())
                .build()
                .toString())
        .contentType(MediaType.APPLICATION_OCTET_STREAM)
        .body(new FileSystemResource(path));
  }
}
