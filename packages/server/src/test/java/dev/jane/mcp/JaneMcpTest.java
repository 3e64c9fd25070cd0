package dev.jane.mcp;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import dev.jane.mcp.exception.StateException;
import dev.jane.mcp.utility.FileUtility;
import dev.jane.mcp.utility.JacksonUtility;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JaneMcpTest {

  private Path tempDir;

  @BeforeEach
  void setUp() throws Exception {
    tempDir = Files.createTempDirectory("jane_app_test_");
  }

  @AfterEach
  void tearDown() {
    FileUtility.deleteDir(tempDir, true);
  }

  private JaneMcp stdioApp(String input, ByteArrayOutputStream out, String... extra) {
    String[] base = {
      "--config-file", "classpath:application-test.yaml", "--mode", "stdio",
      "--root", tempDir.toString()
    };
    String[] args = new String[base.length + extra.length];
    System.arraycopy(base, 0, args, 0, base.length);
    System.arraycopy(extra, 0, args, base.length, extra.length);
    return new JaneMcp(
        args,
        new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
        new PrintStream(out, true, StandardCharsets.UTF_8));
  }

  @Test
  @DisplayName("initialize creates the storage layout with the bootstrap categories")
  void bootstrapLayout() {
    JaneMcp app = stdioApp("", new ByteArrayOutputStream());
    app.initialize();
    try {
      assertTrue(Files.isDirectory(tempDir.resolve("stdlib/javascript")));
      assertTrue(Files.isDirectory(tempDir.resolve("specs/jane")));
      assertNull(app.httpServer());
      assertNotNull(app.stdioTransport());
      assertTrue(app.searchIndex().isInitialized());
    } finally {
      app.shutdown();
    }
  }

  @Test
  @DisplayName("--index lazy defers building the search index")
  void lazyIndexOverride() {
    JaneMcp app = stdioApp("", new ByteArrayOutputStream(), "--index", "lazy");
    app.initialize();
    try {
      assertFalse(app.searchIndex().isInitialized());
      assertEquals(0, app.knowledgeBase().documentCount());
      assertTrue(app.searchIndex().isInitialized());
    } finally {
      app.shutdown();
    }
  }

  @Test
  @DisplayName("stdio mode serves requests from the supplied streams")
  void servesStdio() throws Exception {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    JaneMcp app =
        stdioApp(
            "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"list_specs\"}\n"
                + "{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/list\"}\n",
            out);
    app.initialize();
    try {
      app.stdioTransport().run();
    } finally {
      app.shutdown();
    }

    String[] lines = out.toString(StandardCharsets.UTF_8).split("\n");
    assertEquals(2, lines.length);
    JsonNode specs = JacksonUtility.getJsonMapper().readTree(lines[0]);
    assertEquals("jane", specs.path("result").path("projects").get(0).asText());
  }

  @Test
  @DisplayName("configuration is unavailable before initialize and shutdown is idempotent")
  void lifecycle() {
    JaneMcp app = stdioApp("", new ByteArrayOutputStream());

    assertThrows(StateException.class, app::configuration);
    app.initialize();
    assertEquals("jane-test", app.serverName());
    app.shutdown();
    assertDoesNotThrow(app::shutdown);
  }
}
