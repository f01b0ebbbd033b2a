package com.scholary.subtitle.audio;

/** Encodes PCM audio into a container format. */
public interface AudioEncoder {

  /**
   * Encode a clip.
   *
   * @param clip the audio to encode
   * @param format the target container
   * @return the encoded file content
   * @throws com.scholary.subtitle.exception.ExternalServiceException if encoding fails
   */
  byte[] encode(AudioClip clip, ContainerFormat format);
}
