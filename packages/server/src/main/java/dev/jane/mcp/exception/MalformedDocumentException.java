package dev.jane.mcp.exception;

import java.util.Map;

/** A document file could not be decoded into metadata and body. */
public class MalformedDocumentException extends JaneException {
  public MalformedDocumentException(String message) {
    super(JaneErrorCode.DATA_LOSS, message);
  }

  public MalformedDocumentException(String message, Throwable cause) {
    super(JaneErrorCode.DATA_LOSS, message, cause);
  }

  public MalformedDocumentException(String message, Map<String, ?> context) {
    super(JaneErrorCode.DATA_LOSS, message, context);
  }
}
