package dev.jane.mcp.index;

import dev.jane.mcp.exception.ConfigException;
import java.util.Locale;

/** When the search index is first built from disk. */
public enum IndexInitialization {
  /** At server start, before any request is served. */
  EAGER,
  /** On the first request that touches the index. */
  LAZY;

  public static IndexInitialization fromString(String value) {
    if (value == null || value.isBlank()) return EAGER;
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ConfigException(
          "Unsupported index initialization '" + value + "', expected eager or lazy", e);
    }
  }
}
