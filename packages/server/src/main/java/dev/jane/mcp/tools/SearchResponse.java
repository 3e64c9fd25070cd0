package dev.jane.mcp.tools;

import java.util.List;

public record SearchResponse(String query, int total, List<SearchResultItem> results) {}
