package dev.jane.mcp.exception;

import java.util.function.Function;

/** Utility helpers for dealing with exceptions. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Return {@code t} unchanged when it already is a {@link JaneException}, otherwise wrap it with
   * the supplied factory. Intended for {@code throw ExceptionUtil.rethrowIfUnchecked(e, ...)}.
   */
  public static JaneException rethrowIfUnchecked(
      Throwable t, Function<Throwable, JaneException> supplier) {
    if (t instanceof JaneException) {
      return (JaneException) t;
    } else {
      return supplier.apply(t);
    }
  }
}
