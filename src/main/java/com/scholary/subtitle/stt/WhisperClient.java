package com.scholary.subtitle.stt;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for a faster-whisper transcription service.
 *
 * <p>Sends the extracted audio as multipart/form-data and maps the JSON answer to a
 * {@link Transcript}. Transient failures are retried with exponential backoff and jitter.
 */
@Component
public class WhisperClient implements SpeechToTextClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperClient.class);

  private final HttpClient httpClient;
  private final WhisperProperties properties;
  private final ObjectMapper objectMapper;

  public WhisperClient(WhisperProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized Whisper client: baseUrl={}, model={}", properties.baseUrl(), properties.model());
  }

  @Override
  public String describe() {
    return "whisper (" + properties.model() + ")";
  }

  /**
   * Transcribe an audio file.
   *
   * @throws WhisperException if transcription fails after retries
   */
  @Override
  public Transcript transcribe(Path audioFile) {
    LOGGER.info("Transcribing audio: file={}", audioFile.getFileName());

    int attempt = 0;
    Exception lastException = null;

    while (attempt < properties.maxRetries()) {
      try {
        return attemptTranscribe(audioFile);
      } catch (IOException e) {
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          long backoffMs = (long) (Math.pow(2, attempt) * 1000 + Math.random() * 1000);
          LOGGER.warn(
              "Transcription attempt {} failed, retrying in {}ms: {}",
              attempt,
              backoffMs,
              e.getMessage());
          try {
            Thread.sleep(backoffMs);
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new WhisperException("Transcription interrupted", ie);
          }
        }
      }
    }

    throw new WhisperException(
        String.format("Transcription failed after %d attempts", properties.maxRetries()),
        lastException);
  }

  private Transcript attemptTranscribe(Path audioFile) throws IOException {
    String boundary = UUID.randomUUID().toString();
    BodyPublisher bodyPublisher = buildMultipartBody(audioFile, boundary);

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/api/v1/transcribe"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "multipart/form-data; boundary=" + boundary)
            .POST(bodyPublisher)
            .build();

    LOGGER.debug("Sending transcription request to {}", request.uri());

    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new WhisperException("Transcription interrupted", e);
    }

    if (response.statusCode() >= 500) {
      throw new IOException(
          String.format(
              "Whisper API returned status %d: %s", response.statusCode(), response.body()));
    }
    if (response.statusCode() != 200) {
      throw new WhisperException(
          String.format(
              "Whisper API rejected the request with status %d: %s",
              response.statusCode(), response.body()));
    }

    WhisperResponse whisperResponse =
        objectMapper.readValue(response.body(), WhisperResponse.class);
    Transcript transcript =
        new Transcript(
            whisperResponse.segments(), whisperResponse.text(), whisperResponse.language());

    LOGGER.info(
        "Transcription successful: {} segments, language={}",
        transcript.segments().size(),
        transcript.language());

    return transcript;
  }

  /**
   * Build a multipart/form-data body with the audio file and the model name.
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="file"; filename="audio.wav"
   * Content-Type: audio/wav
   *
   * [binary data]
   * --boundary
   * Content-Disposition: form-data; name="model"
   *
   * base
   * --boundary--
   * </pre>
   */
  private BodyPublisher buildMultipartBody(Path audioFile, String boundary) throws IOException {
    String filename = audioFile.getFileName().toString();
    byte[] fileBytes = Files.readAllBytes(audioFile);

    StringBuilder sb = new StringBuilder();
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"file\"; filename=\"")
        .append(filename)
        .append("\"\r\n");
    sb.append("Content-Type: audio/wav\r\n\r\n");

    byte[] prefix = sb.toString().getBytes(StandardCharsets.UTF_8);

    sb = new StringBuilder();
    sb.append("\r\n");
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"model\"\r\n\r\n");
    sb.append(properties.model()).append("\r\n");
    sb.append("--").append(boundary).append("--\r\n");

    byte[] suffix = sb.toString().getBytes(StandardCharsets.UTF_8);

    byte[] body = new byte[prefix.length + fileBytes.length + suffix.length];
    System.arraycopy(prefix, 0, body, 0, prefix.length);
    System.arraycopy(fileBytes, 0, body, prefix.length, fileBytes.length);
    System.arraycopy(suffix, 0, body, prefix.length + fileBytes.length, suffix.length);

    return BodyPublishers.ofByteArray(body);
  }
}
