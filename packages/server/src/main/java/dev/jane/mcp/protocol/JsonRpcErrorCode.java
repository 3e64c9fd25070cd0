package dev.jane.mcp.protocol;

/** Error codes placed in JSON-RPC error responses. */
public enum JsonRpcErrorCode {
  PARSE_ERROR(-32700, "Parse error"),
  INVALID_REQUEST(-32600, "Invalid Request"),
  METHOD_NOT_FOUND(-32601, "Method not found"),
  INVALID_PARAMS(-32602, "Invalid params"),
  INTERNAL_ERROR(-32603, "Internal error"),
  DOCUMENT_NOT_FOUND(-32000, "Document not found"),
  DOCUMENT_EXISTS(-32001, "Document already exists"),
  MALFORMED_DOCUMENT(-32002, "Malformed document");

  private final int code;
  private final String defaultMessage;

  JsonRpcErrorCode(int code, String defaultMessage) {
    this.code = code;
    this.defaultMessage = defaultMessage;
  }

  public int code() {
    return code;
  }

  public String defaultMessage() {
    return defaultMessage;
  }
}
