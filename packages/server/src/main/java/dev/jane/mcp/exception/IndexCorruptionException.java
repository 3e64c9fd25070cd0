package dev.jane.mcp.exception;

import java.util.Map;

/** The search index disagrees with the document store. */
public class IndexCorruptionException extends JaneException {
  public IndexCorruptionException(String message) {
    super(JaneErrorCode.INDEX_CORRUPTION, message);
  }

  public IndexCorruptionException(String message, Throwable cause) {
    super(JaneErrorCode.INDEX_CORRUPTION, message, cause);
  }

  public IndexCorruptionException(String message, Map<String, ?> context) {
    super(JaneErrorCode.INDEX_CORRUPTION, message, context);
  }
}
