package dev.jane.mcp.exception;

/** I/O operation failed (filesystem, classpath, network streams). */
public class IoException extends JaneException {
  public IoException(String message) {
    super(JaneErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(JaneErrorCode.IO_ERROR, message, cause);
  }
}
