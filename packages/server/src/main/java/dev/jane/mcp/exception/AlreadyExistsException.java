package dev.jane.mcp.exception;

import java.util.Map;

/** A document already occupies the requested category and path. */
public class AlreadyExistsException extends JaneException {
  public AlreadyExistsException(String message) {
    super(JaneErrorCode.ALREADY_EXISTS, message);
  }

  public AlreadyExistsException(String message, Throwable cause) {
    super(JaneErrorCode.ALREADY_EXISTS, message, cause);
  }

  public AlreadyExistsException(String message, Map<String, ?> context) {
    super(JaneErrorCode.ALREADY_EXISTS, message, context);
  }
}
