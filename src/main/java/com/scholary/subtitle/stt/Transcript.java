package com.scholary.subtitle.stt;

import java.util.List;

/**
 * Output of a speech-to-text run.
 *
 * <p>{@code segments} may be empty when the model recognized speech but did not time it; the full
 * {@code text} is still available then.
 */
public record Transcript(List<TranscriptSegment> segments, String text, String language) {

  public Transcript {
    segments = segments == null ? List.of() : List.copyOf(segments);
    text = text == null ? "" : text;
  }
}
