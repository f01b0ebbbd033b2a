package com.scholary.subtitle.stt;

import java.nio.file.Path;

/**
 * Interface for speech-to-text services.
 *
 * <p>This abstraction allows us to swap transcription providers without changing the pipeline.
 */
public interface SpeechToTextClient {

  /**
   * Transcribe an audio file.
   *
   * @param audioFile a WAV file produced by the audio extractor
   * @return the timed transcript
   * @throws com.scholary.subtitle.exception.ExternalServiceException if transcription fails
   */
  Transcript transcribe(Path audioFile);

  /** Backend and model, for progress messages. */
  String describe();
}
