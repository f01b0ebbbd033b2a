package com.scholary.subtitle.media;

/** Pulls the audio track out of a media file for speech recognition. */
public interface AudioExtractor {

  /**
   * Extract audio from a media file.
   *
   * @param mediaLocation local path or URL understood by the extraction tool
   * @return the extracted audio, to be closed by the caller
   * @throws com.scholary.subtitle.exception.ExternalServiceException if extraction fails
   */
  ExtractedAudio extract(String mediaLocation);
}
