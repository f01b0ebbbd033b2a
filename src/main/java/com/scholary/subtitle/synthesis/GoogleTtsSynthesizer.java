package com.scholary.subtitle.synthesis;

import com.scholary.subtitle.audio.AudioDecoder;
import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Speech from Google Translate's text-to-speech endpoint.
 *
 * <p>The endpoint only accepts short texts, so longer segments are split on whitespace into
 * pieces of at most {@code googleTtsMaxChars} characters. Each piece comes back as MP3 and the
 * pieces are concatenated frame by frame into one file.
 */
public class GoogleTtsSynthesizer extends FileBackedSynthesizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(GoogleTtsSynthesizer.class);

  private final SynthesisProperties properties;
  private final HttpClient httpClient;

  public GoogleTtsSynthesizer(
      SynthesisProperties properties,
      AudioDecoder decoder,
      Path tempDir,
      int sampleRate,
      int channels) {
    super(decoder, tempDir, sampleRate, channels);
    this.properties = properties;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
  }

  @Override
  public String describe() {
    return "Google TTS";
  }

  @Override
  protected String fileSuffix() {
    return ".mp3";
  }

  @Override
  protected void render(String text, String language, Path output)
      throws SynthesisException, IOException {
    List<String> pieces = splitText(text.strip(), properties.googleTtsMaxChars());

    try (OutputStream out = Files.newOutputStream(output)) {
      for (int i = 0; i < pieces.size(); i++) {
        out.write(fetchPiece(pieces.get(i), language, i, pieces.size()));
      }
    }
  }

  private byte[] fetchPiece(String piece, String language, int index, int total)
      throws SynthesisException, IOException {
    String query =
        String.format(
            "ie=UTF-8&client=tw-ob&tl=%s&q=%s&total=%d&idx=%d&textlen=%d",
            encode(language), encode(piece), total, index, piece.length());

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.googleTtsUrl() + "?" + query))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("User-Agent", "Mozilla/5.0")
            .GET()
            .build();

    HttpResponse<byte[]> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("Google TTS request interrupted", e);
    }

    if (response.statusCode() != 200) {
      throw new SynthesisException(
          String.format(
              "Google TTS returned status %d for language '%s'", response.statusCode(), language));
    }

    LOGGER.debug("Fetched TTS piece {}/{}: {} bytes", index + 1, total, response.body().length);
    return response.body();
  }

  /**
   * Split text into pieces no longer than {@code maxChars}, breaking on whitespace where
   * possible. A single word longer than the limit is cut.
   */
  static List<String> splitText(String text, int maxChars) {
    List<String> pieces = new ArrayList<>();
    StringBuilder current = new StringBuilder();

    for (String word : text.split("\\s+")) {
      if (word.isEmpty()) {
        continue;
      }
      while (word.length() > maxChars) {
        if (current.length() > 0) {
          pieces.add(current.toString());
          current.setLength(0);
        }
        pieces.add(word.substring(0, maxChars));
        word = word.substring(maxChars);
      }
      if (current.length() > 0 && current.length() + 1 + word.length() > maxChars) {
        pieces.add(current.toString());
        current.setLength(0);
      }
      if (current.length() > 0) {
        current.append(' ');
      }
      current.append(word);
    }

    if (current.length() > 0) {
      pieces.add(current.toString());
    }
    return pieces;
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
