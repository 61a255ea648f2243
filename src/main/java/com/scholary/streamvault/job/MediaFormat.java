package com.scholary.streamvault.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Output container. {@link #MP3} is audio-only and triggers audio extraction. */
public enum MediaFormat {
  MP4,
  MP3,
  MKV,
  WEBM;

  public boolean isAudioOnly() {
    return this == MP3;
  }

  @JsonValue
  public String extension() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static MediaFormat fromValue(String raw) {
    if (raw == null) {
      return MP4;
    }
    try {
      return MediaFormat.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unsupported format: " + raw, e);
    }
  }
}
