package com.scholary.subtitle.translation;

/**
 * Machine translation of short texts.
 *
 * <p>Implementations hold their own connection state. Create one per pipeline run rather than
 * sharing a process-wide instance.
 */
public interface TranslationClient {

  /**
   * Translate text into the target language. The source language is detected.
   *
   * @param text the text to translate
   * @param targetLanguage a language code such as "es", "fr" or "km"
   * @return the translated text, possibly blank if the service had nothing to return
   * @throws TranslationException if the call fails
   */
  String translate(String text, String targetLanguage) throws TranslationException;
}
