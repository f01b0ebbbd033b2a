package com.scholary.subtitle.translation;

/**
 * A single translation call failed.
 *
 * <p>Checked: callers decide per segment what to do, normally keep the source text.
 */
public class TranslationException extends Exception {

  public TranslationException(String message) {
    super(message);
  }

  public TranslationException(String message, Throwable cause) {
    super(message, cause);
  }
}
