package dev.jane.mcp.exception;

/** Component used in an invalid lifecycle state. */
public class StateException extends JaneException {
  public StateException(String message) {
    super(JaneErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(JaneErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
