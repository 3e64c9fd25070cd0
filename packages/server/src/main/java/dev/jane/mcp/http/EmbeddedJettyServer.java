package dev.jane.mcp.http;

import dev.jane.mcp.JaneMcp;
import dev.jane.mcp.exception.ConfigException;
import dev.jane.mcp.exception.ExceptionUtil;
import dev.jane.mcp.exception.NetworkException;
import dev.jane.mcp.logging.LoggingService;
import java.util.Objects;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Connector;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;

/**
 * Embedded Jetty 12 server with a root {@link ServletContextHandler}.
 *
 * <p>This class owns the Jetty lifecycle (prepare/start/stop) and exposes the {@link
 * ServletContextHandler} so that other components can register their servlets before {@link
 * #start()} is called.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      LoggingService.getLogger(EmbeddedJettyServer.class);

  public static final int DEFAULT_PORT = 9001;

  private final JaneMcp janeMcp;
  private final Object lifecycleLock = new Object();
  private Server server;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(JaneMcp janeMcp) {
    this.janeMcp = janeMcp;
  }

  /** Prepare the Jetty Server and root ServletContextHandler without starting it. */
  public void prepare() {
    synchronized (lifecycleLock) {
      if (server != null) {
        log.trace("Server already prepared");
        return;
      }

      int port;
      try {
        port = janeMcp.configuration().getInt("http.port", DEFAULT_PORT);
      } catch (Exception e) {
        throw new ConfigException("Failed to resolve http.port configuration", e);
      }

      String hostname;
      try {
        hostname = janeMcp.configuration().getString("http.hostname", "0.0.0.0");
        if (Objects.isNull(hostname) || hostname.isBlank()) {
          throw new ConfigException("Missing http.hostname configuration");
        }
        hostname = hostname.trim();
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e, (ex) -> new ConfigException("Failed to resolve http.hostname configuration", ex));
      }

      try {
        server = new Server();
        ServerConnector connector = new ServerConnector(server);
        if (!hostname.equals("0.0.0.0")) {
          connector.setHost(hostname);
        }
        connector.setPort(port);
        server.addConnector(connector);

        contextHandler = new ServletContextHandler();
        contextHandler.setContextPath("/");
        server.setHandler(contextHandler);
      } catch (Exception e) {
        server = null;
        contextHandler = null;
        throw new NetworkException(
            "Failed to initialize Jetty on %s:%d".formatted(hostname, port), e);
      }
    }
  }

  /** Start Jetty if not already started. Servlets must be registered before this call. */
  public void start() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        log.trace("Server already started");
        return;
      }

      if (server == null) {
        log.warn("Called start() before prepare()");
        prepare();
      }

      try {
        server.start();
        log.info("Jetty listening on http://localhost:{}", getPort());
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e,
            (ex) ->
                new NetworkException(
                    "Failed to start Jetty; check that the configured port and hostname are"
                        + " available",
                    ex));
      }
    }
  }

  public void stop() {
    synchronized (lifecycleLock) {
      if (server != null) {
        try {
          if (server.isRunning() || server.isStarted() || server.isStarting()) {
            server.stop();
          }
        } catch (Exception e) {
          log.error("Error stopping Jetty server", e);
        } finally {
          server = null;
          contextHandler = null;
        }
      }
    }
  }

  public boolean isRunning() {
    synchronized (lifecycleLock) {
      return server != null && server.isRunning();
    }
  }

  /** Bound port once started (resolves {@code http.port: 0}), otherwise the configured one. */
  public int getPort() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        for (Connector connector : server.getConnectors()) {
          if (connector instanceof ServerConnector sc && sc.getLocalPort() > 0) {
            return sc.getLocalPort();
          }
        }
      }
      return janeMcp.configuration().getInt("http.port", DEFAULT_PORT);
    }
  }

  public ServletContextHandler getContextHandler() {
    synchronized (lifecycleLock) {
      return contextHandler;
    }
  }

  @Override
  public void close() {
    stop();
  }
}
