package dev.jane.mcp.exception;

/** Listener could not be created or started. */
public class NetworkException extends JaneException {
  public NetworkException(String message) {
    super(JaneErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(JaneErrorCode.NETWORK_ERROR, message, cause);
  }
}
