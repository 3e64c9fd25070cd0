package dev.jane.mcp.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JaneExceptionTest {

  @Test
  @DisplayName("subclasses pin their error code")
  void codes() {
    assertEquals(JaneErrorCode.NOT_FOUND, new NotFoundException("x").getCode());
    assertEquals(JaneErrorCode.ALREADY_EXISTS, new AlreadyExistsException("x").getCode());
    assertEquals(JaneErrorCode.PERMISSION_DENIED, new PathSecurityException("x").getCode());
    assertEquals(JaneErrorCode.INVALID_ARGUMENT, new ValidationException("x").getCode());
    assertEquals(JaneErrorCode.DATA_LOSS, new MalformedDocumentException("x").getCode());
    assertEquals(JaneErrorCode.INDEX_CORRUPTION, new IndexCorruptionException("x").getCode());
  }

  @Test
  @DisplayName("context is copied and read-only")
  void contextIsCopied() {
    Map<String, Object> source = new HashMap<>();
    source.put("field", "path");
    ValidationException e = new ValidationException("bad", source);
    source.put("field", "changed");

    assertEquals("path", e.getContext().get("field"));
    assertThrows(UnsupportedOperationException.class, () -> e.getContext().put("k", "v"));
    assertTrue(new ValidationException("bad").getContext().isEmpty());
    assertTrue(e.toString().contains("context={field=path}"));
  }

  @Test
  @DisplayName("rethrowIfUnchecked keeps domain exceptions and wraps the rest")
  void rethrowIfUnchecked() {
    NotFoundException domain = new NotFoundException("missing");
    assertSame(domain, ExceptionUtil.rethrowIfUnchecked(domain, t -> new IoException("io", t)));

    IOException io = new IOException("disk");
    JaneException wrapped = ExceptionUtil.rethrowIfUnchecked(io, t -> new IoException("io", t));
    assertInstanceOf(IoException.class, wrapped);
    assertSame(io, wrapped.getCause());
  }
}
