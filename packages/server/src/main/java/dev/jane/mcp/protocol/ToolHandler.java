package dev.jane.mcp.protocol;

/** Executes a tool. The returned value is serialized as the JSON-RPC result. */
@FunctionalInterface
public interface ToolHandler {
  Object handle(ToolArguments arguments);
}
