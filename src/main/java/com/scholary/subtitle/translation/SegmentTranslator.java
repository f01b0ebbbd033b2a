package com.scholary.subtitle.translation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates segment texts and turns failures into source-text fallbacks.
 *
 * <p>A failed or empty translation never propagates: the caller always gets text to use.
 */
public class SegmentTranslator {

  private static final Logger LOGGER = LoggerFactory.getLogger(SegmentTranslator.class);

  private final TranslationClient client;

  public SegmentTranslator(TranslationClient client) {
    this.client = client;
  }

  public TranslationOutcome translate(String sourceText, String targetLanguage) {
    try {
      String translated = client.translate(sourceText, targetLanguage);
      if (translated == null || translated.isBlank()) {
        LOGGER.debug("Empty translation, keeping source text");
        return TranslationOutcome.untouched(sourceText);
      }
      return TranslationOutcome.translated(translated);
    } catch (TranslationException e) {
      LOGGER.warn("Translation failed, keeping source text: {}", e.getMessage());
      return TranslationOutcome.fallback(sourceText, e.getMessage());
    }
  }
}
