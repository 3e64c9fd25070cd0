package dev.jane.mcp;

import dev.jane.mcp.actuator.ActuatorService;
import dev.jane.mcp.document.DocumentStore;
import dev.jane.mcp.exception.NetworkException;
import dev.jane.mcp.exception.StateException;
import dev.jane.mcp.http.EmbeddedJettyServer;
import dev.jane.mcp.index.IndexInitialization;
import dev.jane.mcp.index.SearchIndex;
import dev.jane.mcp.kb.KnowledgeBaseService;
import dev.jane.mcp.logging.LoggingService;
import dev.jane.mcp.protocol.ProtocolDispatcher;
import dev.jane.mcp.tools.DocumentResources;
import dev.jane.mcp.tools.DocumentTools;
import dev.jane.mcp.transport.HttpTransport;
import dev.jane.mcp.transport.StdioTransport;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.apache.commons.configuration2.Configuration;

/**
 * Process root: builds every component in dependency order, hands them to each other explicitly
 * and tears them down in reverse order.
 */
public class JaneMcp {

  private static final org.slf4j.Logger log = LoggingService.getLogger(JaneMcp.class);

  private final StartupParameters startupParameters;
  private final InputStream stdin;
  private final PrintStream stdout;
  private ConfigurationProvider configurationProvider;
  private DocumentStore documentStore;
  private SearchIndex searchIndex;
  private KnowledgeBaseService knowledgeBase;
  private ProtocolDispatcher dispatcher;
  private EmbeddedJettyServer httpServer;
  private StdioTransport stdioTransport;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public JaneMcp(String[] applicationArgs) {
    this(applicationArgs, System.in, System.out);
  }

  public JaneMcp(String[] applicationArgs, InputStream stdin, PrintStream stdout) {
    this.startupParameters = new StartupParameters(applicationArgs);
    this.stdin = stdin;
    this.stdout = stdout;
  }

  public void initialize() {
    // Disable java logging entirely.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    configurationProvider.override(
        "store.root", startupParameters.getOptionalParameter("root", String.class).orElse(null));
    configurationProvider.override(
        "index.initialization",
        startupParameters.getOptionalParameter("index", String.class).orElse(null));
    LoggingService.applyConfiguration(configuration());

    Path root = Paths.get(configuration().getString("store.root", "Jane"));
    this.documentStore = new DocumentStore(root);
    documentStore.ensureStructure(
        configuration().getList(String.class, "store.bootstrap.languages", List.of()),
        configuration().getList(String.class, "store.bootstrap.projects", List.of()));

    this.searchIndex = new SearchIndex();
    this.knowledgeBase =
        new KnowledgeBaseService(
            documentStore,
            searchIndex,
            IndexInitialization.fromString(
                configuration().getString("index.initialization", "eager")));
    knowledgeBase.init();

    this.dispatcher =
        ProtocolDispatcher.builder()
            .serverInfo(serverName(), serverVersion())
            .tools(new DocumentTools(knowledgeBase).specifications())
            .resources(new DocumentResources(knowledgeBase).specifications())
            .build();

    if (startupParameters.servesHttp()) {
      this.httpServer = new EmbeddedJettyServer(this);
      httpServer.prepare();
      try {
        new ActuatorService(this).register();
        new HttpTransport(this).register();
        httpServer.start();
      } catch (RuntimeException e) {
        shutdown();
        throw new NetworkException("Could not start http server", e);
      }
    }

    if (startupParameters.servesStdio()) {
      this.stdioTransport = new StdioTransport(dispatcher, stdin, stdout);
    }
    log.info(
        "{} {} ready (mode={}, root={})",
        serverName(),
        serverVersion(),
        startupParameters.mode(),
        documentStore.root());
  }

  /**
   * Serve until the process should exit. In {@code stdio} mode this returns at end of input; in
   * {@code http} and {@code both} modes it blocks until a shutdown signal.
   */
  public void run() {
    registerShutdownHook();
    switch (startupParameters.mode()) {
      case "stdio" -> {
        try {
          stdioTransport.run();
        } finally {
          shutdown();
        }
      }
      case "both" -> {
        stdioTransport.start();
        waitShutdownSignal();
      }
      case "http" -> waitShutdownSignal();
      default -> throw new StateException("Nothing to serve in mode " + startupParameters.mode());
    }
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   */
  public void waitShutdownSignal() {
    registerShutdownHook();
    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  private void registerShutdownHook() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "jane-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      log.info("Shutting down");
      try {
        if (stdioTransport != null) stdioTransport.close();
        if (httpServer != null) httpServer.stop();
        if (knowledgeBase != null) knowledgeBase.shutdown();
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("JaneMcp not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public String serverName() {
    return configuration().getString("mcp.server.name", "jane");
  }

  public String serverVersion() {
    return configuration().getString("mcp.server.version", "1.0.0");
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public DocumentStore documentStore() {
    return documentStore;
  }

  public SearchIndex searchIndex() {
    return searchIndex;
  }

  public KnowledgeBaseService knowledgeBase() {
    return knowledgeBase;
  }

  public ProtocolDispatcher dispatcher() {
    return dispatcher;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }

  public StdioTransport stdioTransport() {
    return stdioTransport;
  }
}
