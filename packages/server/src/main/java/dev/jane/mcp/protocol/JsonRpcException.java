package dev.jane.mcp.protocol;

/** Protocol-level failure that maps directly onto a JSON-RPC error object. */
public class JsonRpcException extends RuntimeException {
  private final JsonRpcErrorCode code;
  private final transient Object data;

  public JsonRpcException(JsonRpcErrorCode code, String message) {
    this(code, message, null);
  }

  public JsonRpcException(JsonRpcErrorCode code, String message, Object data) {
    super(message != null ? message : code.defaultMessage());
    this.code = code;
    this.data = data;
  }

  public JsonRpcErrorCode getCode() {
    return code;
  }

  public Object getData() {
    return data;
  }
}
