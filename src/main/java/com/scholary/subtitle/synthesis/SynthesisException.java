package com.scholary.subtitle.synthesis;

/**
 * A single synthesis call failed.
 *
 * <p>Checked on purpose: callers handle it per segment by skipping that segment's audio.
 */
public class SynthesisException extends Exception {

  public SynthesisException(String message) {
    super(message);
  }

  public SynthesisException(String message, Throwable cause) {
    super(message, cause);
  }
}
