package com.scholary.streamvault.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Requested video quality. Everything except {@link #BEST} caps the frame height. */
public enum Quality {
  BEST("best", null),
  P1080("1080", 1080),
  P720("720", 720),
  P480("480", 480),
  P360("360", 360);

  private final String value;
  private final Integer maxHeight;

  Quality(String value, Integer maxHeight) {
    this.value = value;
    this.maxHeight = maxHeight;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** Maximum frame height in pixels, or null for no cap. */
  public Integer maxHeight() {
    return maxHeight;
  }

  /** Accepts "720", "720p" and "best" (case-insensitive). */
  @JsonCreator
  public static Quality fromValue(String raw) {
    if (raw == null) {
      return BEST;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    if (normalized.endsWith("p")) {
      normalized = normalized.substring(0, normalized.length() - 1);
    }
    for (Quality quality : values()) {
      if (quality.value.equals(normalized)) {
        return quality;
      }
    }
    throw new IllegalArgumentException("Unsupported quality: " + raw);
  }
}
