package dev.jane.mcp.transport;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import dev.jane.mcp.protocol.ProtocolDispatcher;
import dev.jane.mcp.protocol.ToolDefinition;
import dev.jane.mcp.protocol.ToolProperty;
import dev.jane.mcp.protocol.ToolSpecification;
import dev.jane.mcp.utility.JacksonUtility;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StdioTransportTest {

  private ProtocolDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    ToolDefinition upper =
        ToolDefinition.builder()
            .name("upper")
            .description("Upper-cases text")
            .argument(ToolProperty.string("text", "Input", true))
            .build();
    dispatcher =
        ProtocolDispatcher.builder()
            .tool(
                new ToolSpecification(
                    upper, args -> Map.of("text", args.string("text").toUpperCase())))
            .build();
  }

  private List<String> serve(String input) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    new StdioTransport(
            dispatcher, new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), out)
        .run();
    String written = out.toString(StandardCharsets.UTF_8);
    assertTrue(written.isEmpty() || written.endsWith("\n"));
    return written.isEmpty() ? List.of() : List.of(written.split("\n"));
  }

  @Test
  @DisplayName("each request line produces exactly one response line")
  void oneLinePerRequest() throws Exception {
    List<String> lines =
        serve(
            "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"upper\",\"params\":{\"text\":\"é a\"}}\n"
                + "{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"ping\"}\n");

    assertEquals(2, lines.size());
    JsonNode first = JacksonUtility.getJsonMapper().readTree(lines.get(0));
    assertEquals(1, first.path("id").asInt());
    assertEquals("É A", first.path("result").path("text").asText());
    assertEquals(2, JacksonUtility.getJsonMapper().readTree(lines.get(1)).path("id").asInt());
  }

  @Test
  @DisplayName("notifications and blank lines are silent, garbage gets a parse error")
  void silentAndErrors() throws Exception {
    List<String> lines =
        serve(
            "\n"
                + "{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}\n"
                + "   \n"
                + "not json\n");

    assertEquals(1, lines.size());
    JsonNode error = JacksonUtility.getJsonMapper().readTree(lines.get(0));
    assertEquals(-32700, error.path("error").path("code").asInt());
    assertTrue(error.get("id").isNull());
  }

  @Test
  @DisplayName("responses are the dispatcher output byte for byte")
  void matchesDispatcher() {
    String request = "{\"jsonrpc\":\"2.0\",\"id\":\"x\",\"method\":\"upper\",\"params\":{}}";

    List<String> lines = serve(request + "\n");

    assertEquals(List.of(dispatcher.handle(request)), lines);
  }

  @Test
  @DisplayName("background mode answers while input stays open and stops at end of input")
  void backgroundThread() throws Exception {
    PipedOutputStream feed = new PipedOutputStream();
    PipedInputStream in = new PipedInputStream(feed);
    PipedInputStream responses = new PipedInputStream();
    PipedOutputStream out = new PipedOutputStream(responses);
    StdioTransport transport = new StdioTransport(dispatcher, in, out);

    Thread worker = transport.start();
    assertSame(worker, transport.start());
    assertTrue(worker.isDaemon());

    feed.write(
        "{\"jsonrpc\":\"2.0\",\"id\":5,\"method\":\"ping\"}\n"
            .getBytes(StandardCharsets.UTF_8));
    feed.flush();
    StringBuilder line = new StringBuilder();
    int c;
    while ((c = responses.read()) != '\n' && c != -1) {
      line.append((char) c);
    }
    assertEquals(5, JacksonUtility.getJsonMapper().readTree(line.toString()).path("id").asInt());

    feed.close();
    worker.join(5000);
    assertFalse(worker.isAlive());
    transport.close();
  }
}
