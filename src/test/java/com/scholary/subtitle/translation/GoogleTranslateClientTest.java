package com.scholary.subtitle.translation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GoogleTranslateClientTest {

  private HttpServer server;
  private final AtomicInteger requests = new AtomicInteger();
  private final AtomicReference<String> lastQuery = new AtomicReference<>();
  private volatile int status = 200;
  private volatile String body = "";

  @BeforeEach
  void setUp() throws Exception {
    server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
    server.createContext(
        "/translate_a/single",
        exchange -> {
          requests.incrementAndGet();
          lastQuery.set(exchange.getRequestURI().getRawQuery());
          byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
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

  private GoogleTranslateClient client(int maxRetries) {
    String baseUrl = "http://localhost:" + server.getAddress().getPort();
    return new GoogleTranslateClient(
        new TranslationProperties(baseUrl, 5, 5, maxRetries), new ObjectMapper());
  }

  @Test
  void translate_shouldConcatenateTranslatedSentences() throws Exception {
    body = "[[[\"Bonjour. \",\"Hello. \",null],[\"Au revoir.\",\"Goodbye.\",null]],null,\"en\"]";

    String translated = client(1).translate("Hello. Goodbye.", "fr");

    assertThat(translated).isEqualTo("Bonjour. Au revoir.");
    assertThat(lastQuery.get()).contains("client=gtx").contains("tl=fr").contains("dt=t");
  }

  @Test
  void translate_shouldNotCallServiceForBlankText() throws Exception {
    assertThat(client(1).translate("  ", "fr")).isEqualTo("  ");
    assertThat(requests.get()).isZero();
  }

  @Test
  void translate_shouldFailWithoutRetryOnClientError() {
    status = 400;

    assertThatThrownBy(() -> client(3).translate("Hello", "xx"))
        .isInstanceOf(TranslationException.class)
        .hasMessageContaining("400");
    assertThat(requests.get()).isEqualTo(1);
  }

  @Test
  void translate_shouldRetryServerErrorsThenGiveUp() {
    status = 503;

    assertThatThrownBy(() -> client(2).translate("Hello", "fr"))
        .isInstanceOf(TranslationException.class)
        .hasMessageContaining("after 2 attempts");
    assertThat(requests.get()).isEqualTo(2);
  }

  @Test
  void parseResponse_shouldRejectUnexpectedShape() {
    assertThatThrownBy(() -> client(1).parseResponse("{\"error\":true}"))
        .isInstanceOf(TranslationException.class);
    assertThatThrownBy(() -> client(1).parseResponse("not json"))
        .isInstanceOf(TranslationException.class);
  }
}
