package com.scholary.subtitle.pipeline;

import com.scholary.subtitle.storage.OutputStore;
import java.util.Objects;

/**
 * Where a voice run gets its subtitle text: inline in the request, or from a local path or
 * {@code s3://} location that is read when the run starts.
 */
public record SubtitleSource(String text, String location) {

  public SubtitleSource {
    if ((text == null) == (location == null)) {
      throw new IllegalArgumentException("Exactly one of text or location must be set");
    }
  }

  public static SubtitleSource inline(String text) {
    return new SubtitleSource(Objects.requireNonNull(text, "text"), null);
  }

  public static SubtitleSource stored(String location) {
    return new SubtitleSource(null, Objects.requireNonNull(location, "location"));
  }

  public boolean isStored() {
    return location != null;
  }

  /** Short description for logs. */
  public String describe() {
    return isStored() ? location : "inline";
  }

  String load(OutputStore outputStore) {
    return isStored() ? outputStore.readText(location) : text;
  }
}
