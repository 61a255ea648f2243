package com.scholary.streamvault.extractor;

import com.fasterxml.jackson.databind.JsonNode;
import com.scholary.streamvault.error.ErrorKind;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Parses yt-dlp output: progress lines, printed file paths, error lines and probe JSON. */
final class YtDlpOutputParser {

  private static final String ERROR_PREFIX = "ERROR:";

  private static final List<String> NOT_FOUND_MARKERS =
      List.of(
          "video unavailable",
          "http error 404",
          "does not exist",
          "not found",
          "private video",
          "has been removed",
          "this video is not available");

  private YtDlpOutputParser() {}

  /** One progress sample. Speed and ETA are null when yt-dlp does not know them yet. */
  record ProgressSample(double percent, Long speedBytesPerSec, Long etaSeconds) {}

  /**
   * Parse a progress line emitted by the progress template.
   *
   * <p>Format: {@code [progress] <downloaded> <total> <estimate> <speed> <eta>}, each value a
   * number or {@code NA}. Lines without a known total are skipped.
   */
  static Optional<ProgressSample> parseProgress(String line) {
    String trimmed = line.trim();
    if (!trimmed.startsWith(YtDlpCommandBuilder.PROGRESS_PREFIX)) {
      return Optional.empty();
    }
    String[] parts =
        trimmed.substring(YtDlpCommandBuilder.PROGRESS_PREFIX.length()).trim().split("\\s+");
    if (parts.length < 5) {
      return Optional.empty();
    }
    Double downloaded = parseNumber(parts[0]);
    Double total = parseNumber(parts[1]);
    if (total == null || total <= 0) {
      total = parseNumber(parts[2]);
    }
    if (downloaded == null || total == null || total <= 0) {
      return Optional.empty();
    }
    double percent = Math.min(100.0, downloaded / total * 100.0);
    percent = Math.round(percent * 10.0) / 10.0;
    return Optional.of(
        new ProgressSample(percent, toLong(parseNumber(parts[3])), toLong(parseNumber(parts[4]))));
  }

  /** Path printed after the final move, if this is such a line. */
  static Optional<Path> parseFilePath(String line) {
    String trimmed = line.trim();
    if (!trimmed.startsWith(YtDlpCommandBuilder.FILE_PREFIX)) {
      return Optional.empty();
    }
    String path = trimmed.substring(YtDlpCommandBuilder.FILE_PREFIX.length()).trim();
    return path.isEmpty() ? Optional.empty() : Optional.of(Paths.get(path));
  }

  /** The message of an {@code ERROR:} line, if this is one. */
  static Optional<String> parseError(String line) {
    String trimmed = line.trim();
    if (!trimmed.startsWith(ERROR_PREFIX)) {
      return Optional.empty();
    }
    return Optional.of(trimmed.substring(ERROR_PREFIX.length()).trim());
  }

  /** Map an extractor error message to the error taxonomy. */
  static ErrorKind classifyError(String message) {
    if (message == null) {
      return ErrorKind.EXTRACT_ERROR;
    }
    String lower = message.toLowerCase(Locale.ROOT);
    if (lower.contains("unsupported url")) {
      return ErrorKind.UNSUPPORTED;
    }
    for (String marker : NOT_FOUND_MARKERS) {
      if (lower.contains(marker)) {
        return ErrorKind.NOT_FOUND;
      }
    }
    return ErrorKind.EXTRACT_ERROR;
  }

  /** Interpret {@code --dump-single-json} output. */
  static MediaProbe parseProbe(JsonNode root, String sourceUrl) {
    boolean playlist = "playlist".equals(root.path("_type").asText()) || root.has("entries");
    if (!playlist) {
      return MediaProbe.video(
          new VideoMetadata(
              text(root, "id"),
              Optional.ofNullable(text(root, "webpage_url")).orElse(sourceUrl),
              text(root, "title"),
              text(root, "uploader"),
              number(root, "duration"),
              text(root, "thumbnail"),
              number(root, "view_count"),
              text(root, "upload_date")));
    }

    List<PlaylistEntry> entries = new ArrayList<>();
    for (JsonNode entry : root.path("entries")) {
      String url = entryUrl(entry);
      if (url == null) {
        continue;
      }
      entries.add(
          new PlaylistEntry(
              url,
              text(entry, "title"),
              text(entry, "uploader"),
              number(entry, "duration"),
              thumbnail(entry)));
    }
    int total =
        root.hasNonNull("playlist_count") ? root.get("playlist_count").asInt() : entries.size();
    return MediaProbe.playlist(
        new PlaylistAnalysis(
            Optional.ofNullable(text(root, "title")).orElse("Unknown Playlist"),
            sourceUrl,
            Math.max(total, entries.size()),
            entries));
  }

  private static String entryUrl(JsonNode entry) {
    String url = text(entry, "url");
    if (url != null && url.contains("://")) {
      return url;
    }
    String webpage = text(entry, "webpage_url");
    if (webpage != null) {
      return webpage;
    }
    String id = text(entry, "id");
    if (id != null && "Youtube".equals(text(entry, "ie_key"))) {
      return "https://www.youtube.com/watch?v=" + id;
    }
    return null;
  }

  private static String thumbnail(JsonNode entry) {
    String direct = text(entry, "thumbnail");
    if (direct != null) {
      return direct;
    }
    JsonNode thumbnails = entry.path("thumbnails");
    if (thumbnails.isArray() && thumbnails.size() > 0) {
      return text(thumbnails.get(thumbnails.size() - 1), "url");
    }
    return null;
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    String text = value.asText();
    return text.isEmpty() ? null : text;
  }

  private static Long number(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || !value.isNumber()) {
      return null;
    }
    return value.asLong();
  }

  private static Double parseNumber(String raw) {
    if (raw == null || raw.isEmpty() || "NA".equals(raw) || "None".equals(raw)) {
      return null;
    }
    try {
      return Double.parseDouble(raw);
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static Long toLong(Double value) {
    return value == null ? null : Math.round(value);
  }
}
