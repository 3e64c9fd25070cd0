package dev.jane.mcp.protocol;

import java.util.Map;

@FunctionalInterface
public interface ResourceHandler {
  ResourceContents read(String uri, Map<String, String> variables);
}
