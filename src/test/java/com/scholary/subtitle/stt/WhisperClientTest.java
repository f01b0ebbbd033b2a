package com.scholary.subtitle.stt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WhisperClientTest {

  @TempDir Path tempDir;

  private HttpServer server;
  private final AtomicInteger requests = new AtomicInteger();
  private final AtomicReference<String> lastBody = new AtomicReference<>();
  private volatile int status = 200;
  private volatile String response = "";

  @BeforeEach
  void setUp() throws Exception {
    server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
    server.createContext(
        "/api/v1/transcribe",
        exchange -> {
          requests.incrementAndGet();
          lastBody.set(
              new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.ISO_8859_1));
          byte[] bytes = response.getBytes(StandardCharsets.UTF_8);
          exchange.getResponseHeaders().add("Content-Type", "application/json");
          exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
          try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
          }
        });
    server.start();
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  private WhisperClient client() {
    WhisperProperties properties =
        new WhisperProperties(
            "http://localhost:" + server.getAddress().getPort(), "small", 5, 5, 1);
    return new WhisperClient(properties, new ObjectMapper());
  }

  @Test
  void transcribe_shouldUploadAudioAndMapSegments() throws Exception {
    Path audio = Files.write(tempDir.resolve("audio.wav"), new byte[] {'R', 'I', 'F', 'F'});
    response =
        "{\"segments\":[{\"id\":0,\"start\":0.0,\"end\":2.5,\"text\":\" Hello\",\"avg_logprob\":-0.2},"
            + "{\"id\":1,\"start\":2.5,\"end\":4.0,\"text\":\" world\"}],"
            + "\"text\":\" Hello world\",\"language\":\"en\",\"duration\":4.0}";

    Transcript transcript = client().transcribe(audio);

    assertThat(transcript.segments())
        .containsExactly(
            new TranscriptSegment(0.0, 2.5, " Hello"), new TranscriptSegment(2.5, 4.0, " world"));
    assertThat(transcript.text()).isEqualTo(" Hello world");
    assertThat(transcript.language()).isEqualTo("en");
    assertThat(lastBody.get())
        .contains("name=\"file\"; filename=\"audio.wav\"")
        .contains("RIFF")
        .contains("name=\"model\"")
        .contains("small");
  }

  @Test
  void transcribe_shouldTolerateMissingSegments() throws Exception {
    Path audio = Files.write(tempDir.resolve("audio.wav"), new byte[] {1});
    response = "{\"text\":\"only text\",\"language\":\"km\"}";

    Transcript transcript = client().transcribe(audio);

    assertThat(transcript.segments()).isEmpty();
    assertThat(transcript.text()).isEqualTo("only text");
  }

  @Test
  void transcribe_shouldFailWithoutRetryWhenRequestIsRejected() throws Exception {
    Path audio = Files.write(tempDir.resolve("audio.wav"), new byte[] {1});
    status = 422;
    response = "{\"detail\":\"bad audio\"}";

    assertThatThrownBy(() -> client().transcribe(audio))
        .isInstanceOf(WhisperException.class)
        .hasMessageContaining("422");
    assertThat(requests.get()).isEqualTo(1);
  }

  @Test
  void transcribe_shouldFailAfterServerErrors() throws Exception {
    Path audio = Files.write(tempDir.resolve("audio.wav"), new byte[] {1});
    status = 503;

    assertThatThrownBy(() -> client().transcribe(audio))
        .isInstanceOf(WhisperException.class)
        .hasMessageContaining("after 1 attempts");
  }

  @Test
  void describe_shouldNameModel() {
    assertThat(client().describe()).isEqualTo("whisper (small)");
  }
}
