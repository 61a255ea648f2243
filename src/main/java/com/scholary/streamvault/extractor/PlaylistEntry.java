package com.scholary.streamvault.extractor;

/** One member of a playlist or channel, in playlist order. */
public record PlaylistEntry(
    String url, String title, String uploader, Long durationSeconds, String thumbnailUrl) {}
