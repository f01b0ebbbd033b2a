package com.scholary.subtitle.translation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for Google Translate's public {@code translate_a/single} endpoint.
 *
 * <p>The response is a nested JSON array; the first element lists translated sentences, each an
 * array whose first entry is the translated text:
 *
 * <pre>
 * [[["Hola mundo","Hello world",null,null,10]],null,"en", ...]
 * </pre>
 *
 * <p>Transient failures (I/O errors, 429 and 5xx responses) are retried with exponential backoff.
 */
public class GoogleTranslateClient implements TranslationClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(GoogleTranslateClient.class);

  private final TranslationProperties properties;
  private final ObjectMapper objectMapper;
  private final HttpClient httpClient;

  public GoogleTranslateClient(TranslationProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();
  }

  @Override
  public String translate(String text, String targetLanguage) throws TranslationException {
    if (text == null || text.isBlank()) {
      return text;
    }

    int attempt = 0;
    Exception lastException = null;

    while (attempt < properties.maxRetries()) {
      try {
        return attemptTranslate(text, targetLanguage);
      } catch (IOException e) {
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          long backoffMs = (long) (Math.pow(2, attempt) * 250);
          LOGGER.warn(
              "Translation attempt {} failed, retrying in {}ms: {}",
              attempt,
              backoffMs,
              e.getMessage());
          try {
            Thread.sleep(backoffMs);
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new TranslationException("Translation interrupted", ie);
          }
        }
      }
    }

    throw new TranslationException(
        String.format(
            "Translation failed after %d attempts: %s",
            properties.maxRetries(), lastException == null ? "" : lastException.getMessage()),
        lastException);
  }

  private String attemptTranslate(String text, String targetLanguage)
      throws IOException, TranslationException {
    String query =
        String.format(
            "client=gtx&sl=auto&tl=%s&dt=t&q=%s",
            URLEncoder.encode(targetLanguage, StandardCharsets.UTF_8),
            URLEncoder.encode(text, StandardCharsets.UTF_8));

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/translate_a/single?" + query))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .GET()
            .build();

    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TranslationException("Translation interrupted", e);
    }

    int status = response.statusCode();
    if (status == 429 || status >= 500) {
      throw new IOException("Translation service returned status " + status);
    }
    if (status != 200) {
      throw new TranslationException(
          String.format("Translation service returned status %d for '%s'", status, targetLanguage));
    }

    return parseResponse(response.body());
  }

  /** Concatenate the translated sentences of a {@code translate_a/single} response. */
  String parseResponse(String body) throws TranslationException {
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (IOException e) {
      throw new TranslationException("Unreadable translation response", e);
    }

    JsonNode sentences = root.path(0);
    if (!sentences.isArray()) {
      throw new TranslationException("Unexpected translation response shape");
    }

    StringBuilder translated = new StringBuilder();
    for (JsonNode sentence : sentences) {
      JsonNode part = sentence.path(0);
      if (part.isTextual()) {
        translated.append(part.asText());
      }
    }
    return translated.toString();
  }
}
