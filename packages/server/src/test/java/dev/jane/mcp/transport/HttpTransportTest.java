package dev.jane.mcp.transport;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import dev.jane.mcp.JaneMcp;
import dev.jane.mcp.utility.FileUtility;
import dev.jane.mcp.utility.JacksonUtility;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HttpTransportTest {

  private final HttpClient client = HttpClient.newHttpClient();
  private Path tempDir;
  private JaneMcp janeMcp;
  private String baseUrl;

  @BeforeEach
  void setUp() throws Exception {
    tempDir = Files.createTempDirectory("jane_http_test_");
    janeMcp =
        new JaneMcp(
            new String[] {
              "--config-file", "classpath:application-test.yaml",
              "--mode", "http",
              "--root", tempDir.toString()
            });
    janeMcp.initialize();
    baseUrl = "http://127.0.0.1:" + janeMcp.httpServer().getPort();
  }

  @AfterEach
  void tearDown() {
    janeMcp.shutdown();
    FileUtility.deleteDir(tempDir, true);
  }

  private HttpResponse<String> post(String body) throws Exception {
    return client.send(
        HttpRequest.newBuilder(URI.create(baseUrl + "/mcp"))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build(),
        HttpResponse.BodyHandlers.ofString());
  }

  private HttpResponse<String> send(String method, String path) throws Exception {
    return client.send(
        HttpRequest.newBuilder(URI.create(baseUrl + path))
            .method(method, HttpRequest.BodyPublishers.noBody())
            .build(),
        HttpResponse.BodyHandlers.ofString());
  }

  @Test
  @DisplayName("requests are answered with 200 and a JSON-RPC body")
  void request() throws Exception {
    HttpResponse<String> response =
        post("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\",\"params\":{}}");

    assertEquals(200, response.statusCode());
    assertTrue(
        response.headers().firstValue("Content-Type").orElse("").startsWith("application/json"));
    JsonNode body = JacksonUtility.getJsonMapper().readTree(response.body());
    assertEquals("jane-test", body.path("result").path("serverInfo").path("name").asText());
  }

  @Test
  @DisplayName("JSON-RPC errors still travel with status 200")
  void errorsUse200() throws Exception {
    HttpResponse<String> response = post("{broken");

    assertEquals(200, response.statusCode());
    JsonNode body = JacksonUtility.getJsonMapper().readTree(response.body());
    assertEquals(-32700, body.path("error").path("code").asInt());
  }

  @Test
  @DisplayName("notifications are acknowledged with 202 and no body")
  void notification() throws Exception {
    HttpResponse<String> response =
        post("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}");

    assertEquals(202, response.statusCode());
    assertEquals("", response.body());
  }

  @Test
  @DisplayName("only POST is accepted on the endpoint")
  void otherMethods() throws Exception {
    assertEquals(405, send("GET", "/mcp").statusCode());
    assertEquals(405, send("PUT", "/mcp").statusCode());
    assertEquals(405, send("DELETE", "/mcp").statusCode());
  }

  @Test
  @DisplayName("bodies above the configured limit are refused with 413")
  void oversizedBody() throws Exception {
    String filler = "x".repeat(5000);
    HttpResponse<String> response =
        post(
            "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"search\",\"params\":{\"query\":\""
                + filler
                + "\"}}");

    assertEquals(413, response.statusCode());
  }

  @Test
  @DisplayName("HTTP and stdio produce identical responses for the same request")
  void parityWithStdio() throws Exception {
    String request =
        "{\"jsonrpc\":\"2.0\",\"id\":\"p\",\"method\":\"list_stdlibs\",\"params\":{}}";
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    new StdioTransport(
            janeMcp.dispatcher(),
            new ByteArrayInputStream((request + "\n").getBytes(StandardCharsets.UTF_8)),
            out)
        .run();

    HttpResponse<String> response = post(request);

    assertEquals(out.toString(StandardCharsets.UTF_8), response.body() + "\n");
    assertTrue(response.body().contains("\"javascript\""));
  }

  @Test
  @DisplayName("health endpoint reports status, identity and document count")
  void health() throws Exception {
    post(
        "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"create_document\",\"params\":{"
            + "\"type\":\"spec\",\"project\":\"jane\",\"path\":\"intro.md\","
            + "\"title\":\"Intro\",\"content\":\"hello\"}}");

    HttpResponse<String> response = send("GET", "/actuator/health");

    assertEquals(200, response.statusCode());
    JsonNode health = JacksonUtility.getJsonMapper().readTree(response.body());
    assertEquals("UP", health.path("status").asText());
    assertEquals("jane-test", health.path("name").asText());
    assertEquals("0.0.1", health.path("version").asText());
    assertEquals(1, health.path("documents").asInt());
  }
}
