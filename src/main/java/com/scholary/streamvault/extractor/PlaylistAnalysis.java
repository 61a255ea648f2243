package com.scholary.streamvault.extractor;

import java.util.List;

/**
 * Read-only result of probing a playlist or channel URL. Never persisted.
 *
 * @param title playlist title
 * @param sourceUrl the probed URL
 * @param totalEntries number of entries the extractor reported before any cap was applied
 * @param entries member videos in playlist order
 */
public record PlaylistAnalysis(
    String title, String sourceUrl, int totalEntries, List<PlaylistEntry> entries) {

  public PlaylistAnalysis {
    entries = List.copyOf(entries);
  }
}
