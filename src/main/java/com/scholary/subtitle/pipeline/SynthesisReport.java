package com.scholary.subtitle.pipeline;

import com.scholary.subtitle.audio.ContainerFormat;

/**
 * Outcome of a voice generation run.
 *
 * <p>{@code destination} and {@code format} are null when there was nothing to synthesize and no
 * file was written.
 */
public record SynthesisReport(
    String destination,
    ContainerFormat format,
    int segmentCount,
    int synthesized,
    int skipped,
    double durationSeconds) {

  public static SynthesisReport empty() {
    return new SynthesisReport(null, null, 0, 0, 0, 0.0);
  }

  public boolean hasOutput() {
    return destination != null;
  }
}
