package com.scholary.subtitle.audio;

import java.nio.file.Path;

/** Decodes an audio file into PCM of a requested format. */
public interface AudioDecoder {

  /**
   * Decode an audio file, resampling and remixing as needed.
   *
   * @param audioFile any file format the decoder understands (mp3, wav, ...)
   * @param sampleRate the sample rate of the returned clip
   * @param channels the channel count of the returned clip
   * @return the decoded audio
   * @throws com.scholary.subtitle.exception.ExternalServiceException if decoding fails
   */
  AudioClip decode(Path audioFile, int sampleRate, int channels);
}
