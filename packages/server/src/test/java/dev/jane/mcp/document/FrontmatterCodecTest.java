package dev.jane.mcp.document;

import static org.junit.jupiter.api.Assertions.*;

import dev.jane.mcp.exception.MalformedDocumentException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FrontmatterCodecTest {

  private final FrontmatterCodec codec = new FrontmatterCodec();

  private static DocumentMetadata metadata(String title) {
    return new DocumentMetadata(
        title,
        "Everything about arrays",
        "ada",
        List.of("arrays", "javascript"),
        Instant.parse("2024-05-01T10:00:00.123Z"),
        Instant.parse("2024-05-02T08:30:00Z"));
  }

  @Test
  @DisplayName("encode then parse returns the same metadata and body")
  void roundTrip() {
    DocumentMetadata m = metadata("Array Methods");
    String body = "# Array Methods\n\nUse `map` and `filter`.\n";

    ParsedDocument parsed = codec.parse(codec.encode(m, body));

    assertEquals(m, parsed.metadata());
    assertEquals(body, parsed.body());
  }

  @Test
  @DisplayName("round trip keeps titles that need quoting and multi-line descriptions")
  void roundTripAwkwardScalars() {
    DocumentMetadata m =
        new DocumentMetadata(
            "Intro: Basics #1",
            "line one\nline two",
            null,
            List.of("2024", "true"),
            Instant.parse("2024-01-01T00:00:00Z"),
            Instant.parse("2024-01-01T00:00:00Z"));

    ParsedDocument parsed = codec.parse(codec.encode(m, "body"));

    assertEquals(m, parsed.metadata());
  }

  @Test
  @DisplayName("unknown frontmatter keys survive a round trip")
  void preservesExtraKeys() {
    DocumentMetadata m =
        new DocumentMetadata(
            "Title",
            null,
            null,
            List.of(),
            Instant.parse("2024-01-01T00:00:00Z"),
            Instant.parse("2024-01-01T00:00:00Z"),
            Map.of("owner", "docs-team"));

    String encoded = codec.encode(m, "text");
    ParsedDocument parsed = codec.parse(encoded);

    assertTrue(encoded.contains("owner: \"docs-team\""));
    assertEquals("docs-team", parsed.metadata().extra().get("owner"));
    assertEquals(m, parsed.metadata());
  }

  @Test
  @DisplayName("generate wraps the YAML in delimiters without a trailing newline")
  void generateShape() {
    String block = codec.generate(metadata("T"));

    assertTrue(block.startsWith("---\n"));
    assertTrue(block.endsWith("\n---"));
    assertTrue(block.contains("title: \"T\"\n"));
    assertTrue(block.contains("createdAt: "));
    assertFalse(block.contains("author: null"));
  }

  @Test
  @DisplayName("leading blank lines and delimiter lines inside the body are kept")
  void bodyEdgeCases() {
    DocumentMetadata m = metadata("T");

    assertEquals("\n\nstarts late", codec.parse(codec.encode(m, "\n\nstarts late")).body());
    assertEquals("intro\n---\nmore", codec.parse(codec.encode(m, "intro\n---\nmore")).body());
    assertEquals("", codec.parse(codec.encode(m, "")).body());
  }

  @Test
  @DisplayName("CRLF input is normalized to LF")
  void normalizesCrlf() {
    String raw =
        "---\r\ntitle: T\r\ncreatedAt: 2024-01-01T00:00:00Z\r\n"
            + "updatedAt: 2024-01-01T00:00:00Z\r\n---\r\n\r\nline1\r\nline2";

    ParsedDocument parsed = codec.parse(raw);

    assertEquals("T", parsed.metadata().title());
    assertEquals("line1\nline2", parsed.body());
  }

  @Test
  @DisplayName("lenient timestamp shapes and single-string tags are accepted")
  void lenientValues() {
    String raw =
        "---\ntitle: T\ntags: solo\ncreatedAt: 2024-01-01\n"
            + "updatedAt: 2024-01-02T10:15:30+02:00\n---\n\nbody";

    DocumentMetadata m = codec.parse(raw).metadata();

    assertEquals(List.of("solo"), m.tags());
    assertEquals(Instant.parse("2024-01-01T00:00:00Z"), m.createdAt());
    assertEquals(Instant.parse("2024-01-02T08:15:30Z"), m.updatedAt());
  }

  @Test
  @DisplayName("missing required fields are reported as malformed")
  void missingRequiredFields() {
    assertThrows(
        MalformedDocumentException.class,
        () ->
            codec.parse(
                "---\ncreatedAt: 2024-01-01T00:00:00Z\nupdatedAt: 2024-01-01T00:00:00Z\n---\n\nx"));
    assertThrows(
        MalformedDocumentException.class,
        () -> codec.parse("---\ntitle: T\nupdatedAt: 2024-01-01T00:00:00Z\n---\n\nx"));
    assertThrows(
        MalformedDocumentException.class,
        () -> codec.parse("---\ntitle: T\ncreatedAt: 2024-01-01T00:00:00Z\n---\n\nx"));
  }

  @Test
  @DisplayName("absent, unterminated or invalid frontmatter is malformed")
  void invalidBlocks() {
    assertThrows(MalformedDocumentException.class, () -> codec.parse("# just markdown"));
    assertThrows(MalformedDocumentException.class, () -> codec.parse("---\ntitle: T\n"));
    assertThrows(
        MalformedDocumentException.class, () -> codec.parse("---\ntitle: [unclosed\n---\n\nx"));
    assertThrows(
        MalformedDocumentException.class,
        () -> codec.parse("---\ntitle: T\ncreatedAt: yesterday\nupdatedAt: today\n---\n\nx"));
  }

  @Test
  @DisplayName("updatedAt before createdAt is malformed")
  void updatedBeforeCreated() {
    String raw =
        "---\ntitle: T\ncreatedAt: 2024-02-01T00:00:00Z\n"
            + "updatedAt: 2024-01-01T00:00:00Z\n---\n\nx";

    MalformedDocumentException e =
        assertThrows(MalformedDocumentException.class, () -> codec.parse(raw));
    assertTrue(e.getMessage().contains("updatedAt"));
  }

  @Test
  @DisplayName("strings that look like YAML numbers stay strings")
  void numericLookingStrings() {
    for (String value : List.of("0x1F", "1e3", "1_000", ".inf", "-.Inf", ".NaN", "0o17", "42")) {
      DocumentMetadata m =
          new DocumentMetadata(
              value,
              value,
              value,
              List.of(value, "tag"),
              Instant.parse("2024-01-01T00:00:00Z"),
              Instant.parse("2024-01-01T00:00:00Z"));

      ParsedDocument parsed = codec.parse(codec.generate(m) + "\n\nbody");

      assertEquals(m, parsed.metadata(), value);
      assertEquals("body", parsed.body(), value);
    }
  }

  @Test
  @DisplayName("sub-millisecond timestamps are normalized before they are written")
  void subMillisecondTimestamps() {
    DocumentMetadata m =
        new DocumentMetadata(
            "T",
            null,
            null,
            List.of(),
            Instant.parse("2024-01-01T00:00:00.123456Z"),
            Instant.parse("2024-01-01T00:00:00.123999Z"));

    assertEquals(Instant.parse("2024-01-01T00:00:00.123Z"), m.createdAt());
    assertEquals(Instant.parse("2024-01-01T00:00:00.123Z"), m.updatedAt());
    assertEquals(m, codec.parse(codec.encode(m, "x")).metadata());
  }
}
