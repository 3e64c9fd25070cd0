package dev.jane.mcp.index;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class Tokenizer {

  /** Split a query on whitespace and lowercase every term. Blank input yields no tokens. */
  public static List<String> tokenize(String text) {
    List<String> tokens = new ArrayList<>();
    if (text == null || text.isBlank()) return tokens;
    for (String part : text.trim().split("\\s+")) {
      if (!part.isEmpty()) tokens.add(fold(part));
    }
    return tokens;
  }

  public static String fold(String text) {
    return text == null ? "" : text.toLowerCase(Locale.ROOT);
  }

  /** Non-overlapping occurrences of {@code token} in already folded {@code text}. */
  public static int countOccurrences(String text, String token) {
    if (text == null || text.isEmpty() || token == null || token.isEmpty()) return 0;
    int count = 0;
    int from = 0;
    int idx;
    while ((idx = text.indexOf(token, from)) >= 0) {
      count++;
      from = idx + token.length();
    }
    return count;
  }

  /** First line of {@code text} containing {@code token} case-insensitively, trimmed. */
  public static String firstMatchingLine(String text, String token) {
    if (text == null || token == null || token.isEmpty()) return null;
    for (String line : text.split("\n")) {
      if (fold(line).contains(token)) {
        return line.trim();
      }
    }
    return null;
  }
}
