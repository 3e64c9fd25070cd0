package dev.jane.mcp.transport;

import dev.jane.mcp.JaneMcp;
import dev.jane.mcp.logging.LoggingService;
import dev.jane.mcp.protocol.ProtocolDispatcher;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.slf4j.Logger;

/**
 * JSON-RPC over HTTP POST, mounted on the shared Jetty context.
 *
 * <ul>
 *   <li><b>http.mcp.endpoint</b> (string) - servlet path; default: "/mcp"
 *   <li><b>http.mcp.max-request-bytes</b> (int) - larger bodies are answered with 413; default:
 *       1048576
 * </ul>
 *
 * <p>Responses are the exact bytes produced by {@link ProtocolDispatcher#handle(String)}; a message
 * that needs no response (notifications only) is acknowledged with 202 and an empty body.
 */
public class HttpTransport {
  private static final Logger log = LoggingService.getLogger(HttpTransport.class);

  public static final String DEFAULT_ENDPOINT = "/mcp";
  public static final int DEFAULT_MAX_REQUEST_BYTES = 1024 * 1024;

  private final JaneMcp janeMcp;

  public HttpTransport(JaneMcp janeMcp) {
    this.janeMcp = janeMcp;
  }

  /** Register the JSON-RPC servlet; Jetty's lifecycle stays with {@code EmbeddedJettyServer}. */
  public void register() {
    String endpoint =
        normalizeEndpoint(janeMcp.configuration().getString("http.mcp.endpoint", DEFAULT_ENDPOINT));
    int maxBytes =
        janeMcp.configuration().getInt("http.mcp.max-request-bytes", DEFAULT_MAX_REQUEST_BYTES);
    janeMcp
        .httpServer()
        .getContextHandler()
        .addServlet(
            new ServletHolder(new JsonRpcServlet(janeMcp.dispatcher(), maxBytes)), endpoint);
    log.info("JSON-RPC endpoint registered at {}", endpoint);
  }

  static String normalizeEndpoint(String endpoint) {
    if (endpoint == null || endpoint.isBlank()) {
      return DEFAULT_ENDPOINT;
    }
    String e = endpoint.trim();
    return e.startsWith("/") ? e : "/" + e;
  }

  static class JsonRpcServlet extends HttpServlet {
    private final transient ProtocolDispatcher dispatcher;
    private final int maxRequestBytes;

    JsonRpcServlet(ProtocolDispatcher dispatcher, int maxRequestBytes) {
      this.dispatcher = dispatcher;
      this.maxRequestBytes = maxRequestBytes;
    }

    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      long declared = req.getContentLengthLong();
      if (declared > maxRequestBytes) {
        resp.sendError(HttpServletResponse.SC_REQUEST_ENTITY_TOO_LARGE);
        return;
      }
      byte[] body;
      try (InputStream in = req.getInputStream()) {
        body = in.readNBytes(maxRequestBytes + 1);
      }
      if (body.length > maxRequestBytes) {
        resp.sendError(HttpServletResponse.SC_REQUEST_ENTITY_TOO_LARGE);
        return;
      }

      String response = dispatcher.handle(new String(body, StandardCharsets.UTF_8));
      if (response == null) {
        resp.setStatus(HttpServletResponse.SC_ACCEPTED);
        return;
      }
      byte[] bytes = response.getBytes(StandardCharsets.UTF_8);
      resp.setStatus(HttpServletResponse.SC_OK);
      resp.setContentType("application/json");
      resp.setCharacterEncoding("UTF-8");
      resp.setContentLength(bytes.length);
      try (OutputStream out = resp.getOutputStream()) {
        out.write(bytes);
      }
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      methodNotAllowed(resp);
    }

    @Override
    protected void doPut(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      methodNotAllowed(resp);
    }

    @Override
    protected void doDelete(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      methodNotAllowed(resp);
    }

    private static void methodNotAllowed(HttpServletResponse resp) throws IOException {
      resp.setHeader("Allow", "POST");
      resp.sendError(HttpServletResponse.SC_METHOD_NOT_ALLOWED);
    }
  }
}
