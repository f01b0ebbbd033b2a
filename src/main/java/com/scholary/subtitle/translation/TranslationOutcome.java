package com.scholary.subtitle.translation;

/**
 * Result of translating one segment: the text to use, whether it is a translation, and the
 * warning recorded when the source text had to be kept.
 */
public record TranslationOutcome(String text, boolean translated, String warning) {

  public static TranslationOutcome translated(String text) {
    return new TranslationOutcome(text, true, null);
  }

  /** The source text is kept without a warning, e.g. when the service returned nothing. */
  public static TranslationOutcome untouched(String sourceText) {
    return new TranslationOutcome(sourceText, false, null);
  }

  public static TranslationOutcome fallback(String sourceText, String warning) {
    return new TranslationOutcome(sourceText, false, warning);
  }

  public boolean hasWarning() {
    return warning != null;
  }
}
