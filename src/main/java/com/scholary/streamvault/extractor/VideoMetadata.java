package com.scholary.streamvault.extractor;

/** Metadata of a single video as reported by the extractor. Any field may be null. */
public record VideoMetadata(
    String id,
    String url,
    String title,
    String uploader,
    Long durationSeconds,
    String thumbnailUrl,
    Long viewCount,
    String uploadDate) {}
