package com.scholary.subtitle.synthesis;

import com.scholary.subtitle.audio.AudioClip;

/**
 * Turns text into speech.
 *
 * <p>One instance serves one pipeline run. The voice is fixed when the instance is created, so
 * callers only supply text and language.
 */
public interface SpeechSynthesizer {

  /**
   * Synthesize speech for one segment.
   *
   * @param text the text to speak
   * @param language the target language code, e.g. "en" or "km"
   * @return the synthesized audio in the format the synthesizer was created for
   * @throws SynthesisException if the backend fails for this text
   */
  AudioClip synthesize(String text, String language) throws SynthesisException;

  /** Short description for progress messages and logs. */
  String describe();
}
