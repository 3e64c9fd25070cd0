package dev.jane.mcp.exception;

import java.util.Map;

/** Document or category requested was not found. */
public class NotFoundException extends JaneException {
  public NotFoundException(String message) {
    super(JaneErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(JaneErrorCode.NOT_FOUND, message, cause);
  }

  public NotFoundException(String message, Map<String, ?> context) {
    super(JaneErrorCode.NOT_FOUND, message, context);
  }
}
