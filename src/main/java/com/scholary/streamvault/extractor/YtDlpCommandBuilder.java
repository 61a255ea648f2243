package com.scholary.streamvault.extractor;

import com.scholary.streamvault.job.DownloadOptions;
import com.scholary.streamvault.job.MediaFormat;
import com.scholary.streamvault.job.Quality;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds yt-dlp command lines.
 *
 * <p>Progress is requested through a machine-readable template ({@value #PROGRESS_PREFIX}) and
 * the final path through a post-move print ({@value #FILE_PREFIX}), so the parser never has to
 * scrape human-oriented output.
 */
final class YtDlpCommandBuilder {

  static final String PROGRESS_PREFIX = "[progress]";
  static final String FILE_PREFIX = "[file]";

  private static final String PROGRESS_TEMPLATE =
      "download:"
          + PROGRESS_PREFIX
          + " %(progress.downloaded_bytes)s %(progress.total_bytes)s"
          + " %(progress.total_bytes_estimate)s %(progress.speed)s %(progress.eta)s";

  private final ExtractorProperties properties;

  YtDlpCommandBuilder(ExtractorProperties properties) {
    this.properties = properties;
  }

  /** Metadata-only command. Playlists are listed flat and capped. */
  List<String> probeCommand(String url) {
    List<String> command = new ArrayList<>();
    command.add(properties.binaryPath());
    command.add("--dump-single-json");
    command.add("--flat-playlist");
    command.add("--no-warnings");
    command.add("--playlist-end");
    command.add(String.valueOf(properties.playlistProbeLimit()));
    command.add("--socket-timeout");
    command.add(String.valueOf(properties.socketTimeoutSeconds()));
    command.add(url);
    return command;
  }

  /** Download command writing into {@code workDir} with the job's filename template. */
  List<String> fetchCommand(String url, DownloadOptions options, Path workDir) {
    List<String> command = new ArrayList<>();
    command.add(properties.binaryPath());
    command.add("--newline");
    command.add("--no-playlist");
    command.add("--no-warnings");
    command.add("--progress");
    command.add("--progress-template");
    command.add(PROGRESS_TEMPLATE);
    command.add("--print");
    command.add("after_move:" + FILE_PREFIX + " %(filepath)s");
    command.add("--no-simulate");
    command.add("--socket-timeout");
    command.add(String.valueOf(properties.socketTimeoutSeconds()));
    command.add("-o");
    command.add(workDir.resolve(options.filenameTemplate()).toString());

    if (options.proxy() != null) {
      command.add("--proxy");
      command.add(options.proxy());
    }

    MediaFormat format = options.format();
    if (format.isAudioOnly()) {
      command.add("-f");
      command.add("bestaudio/best");
      command.add("--extract-audio");
      command.add("--audio-format");
      command.add(format.extension());
      command.add("--audio-quality");
      command.add("192K");
    } else {
      command.add("-f");
      command.add(formatSelector(options.quality(), format));
      command.add("--merge-output-format");
      command.add(format.extension());
    }

    command.add(url);
    return command;
  }

  /**
   * Prefer separate streams in the requested container, fall back to any combined stream under
   * the height cap, then to whatever is best.
   */
  static String formatSelector(Quality quality, MediaFormat format) {
    String cap = quality.maxHeight() == null ? "" : "[height<=" + quality.maxHeight() + "]";
    String ext = format.extension();
    return String.format(
        "bestvideo%s[ext=%s]+bestaudio/best%s[ext=%s]/bestvideo%s+bestaudio/best%s/best",
        cap, ext, cap, ext, cap, cap);
  }
}
