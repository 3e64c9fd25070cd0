package dev.jane.mcp.exception;

import java.util.Map;

/** A document path resolved outside of its category root. */
public class PathSecurityException extends JaneException {
  public PathSecurityException(String message) {
    super(JaneErrorCode.PERMISSION_DENIED, message);
  }

  public PathSecurityException(String message, Throwable cause) {
    super(JaneErrorCode.PERMISSION_DENIED, message, cause);
  }

  public PathSecurityException(String message, Map<String, ?> context) {
    super(JaneErrorCode.PERMISSION_DENIED, message, context);
  }
}
