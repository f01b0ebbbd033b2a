package com.scholary.subtitle.translation;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Hands out a fresh translation client for each pipeline run.
 *
 * <p>Clients are never shared between runs, so one run's connection state or failures cannot
 * leak into another.
 */
@Component
public class TranslationClientFactory {

  private final TranslationProperties properties;
  private final ObjectMapper objectMapper;

  public TranslationClientFactory(TranslationProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  public TranslationClient create() {
    return new GoogleTranslateClient(properties, objectMapper);
  }
}
