package dev.jane.mcp.protocol;

import java.util.List;
import java.util.Map;

/**
 * Suggests values for one template variable. {@code resolved} holds the variables the client has
 * already filled in.
 */
@FunctionalInterface
public interface CompletionProvider {
  List<String> complete(String partial, Map<String, String> resolved);
}
