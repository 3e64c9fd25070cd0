package dev.jane.mcp.protocol;

public record ResourceContents(String uri, String mimeType, String text) {}
