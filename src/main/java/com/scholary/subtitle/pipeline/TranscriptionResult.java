package com.scholary.subtitle.pipeline;

import com.scholary.subtitle.subtitle.Segment;
import java.util.List;

/**
 * Outcome of a transcription run.
 *
 * @param subtitleText the subtitle text that was written
 * @param destination where it was written
 * @param segments the segments in the file, translated where translation succeeded
 * @param fallbackCount how many segments kept their source text after a translation error
 */
public record TranscriptionResult(
    String subtitleText, String destination, List<Segment> segments, int fallbackCount) {

  public TranscriptionResult {
    segments = List.copyOf(segments);
  }
}
