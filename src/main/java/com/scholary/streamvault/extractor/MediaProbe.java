package com.scholary.streamvault.extractor;

/**
 * Outcome of {@link Extractor#probe(String)}: either a single video or a playlist.
 *
 * <p>Exactly one of {@code video} and {@code playlist} is non-null, matching {@code type}.
 */
public record MediaProbe(Type type, VideoMetadata video, PlaylistAnalysis playlist) {

  public enum Type {
    VIDEO,
    PLAYLIST
  }

  public static MediaProbe video(VideoMetadata metadata) {
    return new MediaProbe(Type.VIDEO, metadata, null);
  }

  public static MediaProbe playlist(PlaylistAnalysis analysis) {
    return new MediaProbe(Type.PLAYLIST, null, analysis);
  }
}
