package com.scholary.subtitle.media;

import com.scholary.subtitle.storage.ScopedTempFile;
import java.nio.file.Path;

/**
 * Speech-ready audio pulled out of a media file.
 *
 * <p>Owns the temporary WAV file; closing the handle deletes it.
 */
public final class ExtractedAudio implements AutoCloseable {

  private final ScopedTempFile file;
  private final double durationSeconds;

  public ExtractedAudio(ScopedTempFile file, double durationSeconds) {
    this.file = file;
    this.durationSeconds = durationSeconds;
  }

  public Path path() {
    return file.path();
  }

  /** Duration of the source media as probed by ffprobe. */
  public double durationSeconds() {
    return durationSeconds;
  }

  @Override
  public void close() {
    file.close();
  }
}
