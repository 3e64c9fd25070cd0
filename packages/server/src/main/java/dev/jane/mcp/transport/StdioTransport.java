package dev.jane.mcp.transport;

import dev.jane.mcp.exception.IoException;
import dev.jane.mcp.logging.LoggingService;
import dev.jane.mcp.protocol.ProtocolDispatcher;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;

/**
 * Newline-delimited JSON-RPC over a pair of byte streams, normally stdin and stdout.
 *
 * <p>One blocking read, dispatch, write loop: requests from this transport never overlap. Each
 * response is written on its own line and flushed immediately. Nothing else may write to the output
 * stream.
 */
public class StdioTransport implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(StdioTransport.class);

  private final ProtocolDispatcher dispatcher;
  private final InputStream in;
  private final OutputStream out;
  private volatile boolean closed;
  private Thread worker;

  public StdioTransport(ProtocolDispatcher dispatcher, InputStream in, OutputStream out) {
    this.dispatcher = dispatcher;
    this.in = in;
    this.out = out;
  }

  /** Serve requests on the calling thread until end of input or {@link #close()}. */
  public void run() {
    log.info("Serving JSON-RPC over stdio");
    BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
    try {
      String line;
      while (!closed && (line = reader.readLine()) != null) {
        if (line.isBlank()) {
          continue;
        }
        String response = dispatcher.handle(line);
        if (response != null) {
          writer.write(response);
          writer.write('\n');
          writer.flush();
        }
      }
      log.info("stdio input closed");
    } catch (IOException e) {
      if (!closed) {
        throw new IoException("stdio transport failed", e);
      }
    }
  }

  /** Run the loop on a background thread; used when HTTP serves the main thread. */
  public synchronized Thread start() {
    if (worker == null) {
      worker = new Thread(this::runLogged, "jane-stdio");
      worker.setDaemon(true);
      worker.start();
    }
    return worker;
  }

  private void runLogged() {
    try {
      run();
    } catch (IoException e) {
      log.error("stdio transport stopped", e);
    }
  }

  @Override
  public void close() {
    closed = true;
  }
}
