package dev.jane.mcp.document;

/** Result of decoding a document file: its frontmatter and markdown body. */
public record ParsedDocument(DocumentMetadata metadata, String body) {}
