package com.scholary.subtitle.api;

import com.scholary.subtitle.synthesis.VoiceSelector;
import jakarta.validation.constraints.NotBlank;

/**
 * Request for generating a voice track from subtitles.
 *
 * <p>Exactly one of {@code subtitleText} and {@code subtitlePath} must be given. The voice
 * defaults to {@link VoiceSelector#GOOGLE_TTS}.
 */
public record VoiceJobRequest(
    String subtitleText,
    String subtitlePath,
    @NotBlank String audioPath,
    @NotBlank String targetLanguage,
    VoiceSelector voice) {

  public VoiceJobRequest {
    if (voice == null) {
      voice = VoiceSelector.GOOGLE_TTS;
    }
  }
}
