package dev.jane.mcp.exception;

/** Configuration is missing or invalid. */
public class ConfigException extends JaneException {
  public ConfigException(String message) {
    super(JaneErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(JaneErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
