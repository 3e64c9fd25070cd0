package dev.jane.mcp.exception;

import java.util.Map;

/** Input validation failure or illegal argument. */
public class ValidationException extends JaneException {
  public ValidationException(String message) {
    super(JaneErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(JaneErrorCode.INVALID_ARGUMENT, message, cause);
  }

  public ValidationException(String message, Map<String, ?> context) {
    super(JaneErrorCode.INVALID_ARGUMENT, message, context);
  }
}
