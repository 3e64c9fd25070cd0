package dev.jane.mcp;

import dev.jane.mcp.logging.LoggingService;

public class JaneMcpApp {

  private static final org.slf4j.Logger log = LoggingService.getLogger(JaneMcpApp.class);

  public static void main(String[] args) {
    JaneMcp app;
    try {
      app = new JaneMcp(args);
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      System.err.println(StartupParameters.usage());
      System.exit(2);
      return;
    }
    if ("help".equals(app.startupParameters().mode())) {
      System.out.println(StartupParameters.usage());
      return;
    }
    try {
      app.initialize();
      app.run();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      app.shutdown();
      System.exit(1);
    }
  }
}
