package dev.jane.mcp.actuator;

import dev.jane.mcp.JaneMcp;
import dev.jane.mcp.logging.LoggingService;
import dev.jane.mcp.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Health endpoint in the style of Spring Boot's actuator, registered at {@code /actuator/health}.
 *
 * <p>Response body: {@code {"status":"UP","name":"jane","version":"1.0.0","documents":42}}
 */
public class ActuatorService {
  private static final org.slf4j.Logger log = LoggingService.getLogger(ActuatorService.class);

  public static final String HEALTH_PATH = "/actuator/health";

  private final JaneMcp janeMcp;

  public ActuatorService(JaneMcp janeMcp) {
    this.janeMcp = janeMcp;
  }

  /** Register the actuator servlet with the shared Jetty context handler. */
  public void register() {
    janeMcp
        .httpServer()
        .getContextHandler()
        .addServlet(new ServletHolder(new ActuatorServlet()), HEALTH_PATH);
    log.info("Actuator health endpoint registered at {}", HEALTH_PATH);
  }

  Map<String, Object> health() {
    Map<String, Object> health = new LinkedHashMap<>();
    health.put("status", "UP");
    health.put("name", janeMcp.serverName());
    health.put("version", janeMcp.serverVersion());
    health.put("documents", janeMcp.knowledgeBase().documentCount());
    return health;
  }

  private class ActuatorServlet extends HttpServlet {
    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      String payload = JacksonUtility.toJson(health());
      resp.setStatus(200);
      resp.setContentType("application/json");
      resp.setCharacterEncoding("UTF-8");
      try (PrintWriter out = resp.getWriter()) {
        out.println(payload);
      }
    }
  }
}
