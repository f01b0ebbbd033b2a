package com.scholary.subtitle.subtitle;

import java.util.Objects;

/**
 * A timed unit of subtitle text.
 *
 * <p>{@code index} is the 1-based position of the segment in its sequence. The serializer
 * renumbers on output and the parser assigns indices from block position, so the index never
 * carries information of its own. Times are in seconds; {@code end > start} is expected but not
 * enforced, and sequences are not checked for ordering or overlap.
 */
public record Segment(int index, double start, double end, String text) {

  public Segment {
    Objects.requireNonNull(text, "text must not be null");
  }

  /** Returns a copy carrying {@code newText}, keeping index and timing. */
  public Segment withText(String newText) {
    return new Segment(index, start, end, newText);
  }
}
