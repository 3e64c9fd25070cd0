package dev.jane.mcp.exception;

/** JSON or YAML (de)serialization failed. */
public class SerializationException extends JaneException {
  public SerializationException(String message) {
    super(JaneErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(JaneErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
