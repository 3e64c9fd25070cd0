package dev.jane.mcp.protocol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * URI template such as {@code stdlib://{language}/{path}}. Every variable matches one path segment
 * except the last, which takes the rest of the URI so nested document paths resolve.
 */
public final class ResourceTemplate {
  private static final Pattern VARIABLE = Pattern.compile("\\{([A-Za-z][A-Za-z0-9]*)}");

  private final String template;
  private final List<String> variables;
  private final Pattern pattern;

  private ResourceTemplate(String template, List<String> variables, Pattern pattern) {
    this.template = template;
    this.variables = variables;
    this.pattern = pattern;
  }

  public static ResourceTemplate parse(String template) {
    List<String> variables = new ArrayList<>();
    List<String> literals = new ArrayList<>();
    Matcher m = VARIABLE.matcher(template);
    int last = 0;
    while (m.find()) {
      literals.add(template.substring(last, m.start()));
      variables.add(m.group(1));
      last = m.end();
    }
    String tail = template.substring(last);

    StringBuilder regex = new StringBuilder("^");
    for (int i = 0; i < variables.size(); i++) {
      if (!literals.get(i).isEmpty()) regex.append(Pattern.quote(literals.get(i)));
      String group = i == variables.size() - 1 ? ".+" : "[^/]+";
      regex.append("(?<").append(variables.get(i)).append('>').append(group).append(')');
    }
    if (!tail.isEmpty()) regex.append(Pattern.quote(tail));
    regex.append('$');
    return new ResourceTemplate(
        template, Collections.unmodifiableList(variables), Pattern.compile(regex.toString()));
  }

  public String template() {
    return template;
  }

  public List<String> variables() {
    return variables;
  }

  /** Variable bindings when {@code uri} matches, in template order. */
  public Optional<Map<String, String>> match(String uri) {
    if (uri == null) return Optional.empty();
    Matcher m = pattern.matcher(uri);
    if (!m.matches()) return Optional.empty();
    Map<String, String> bindings = new LinkedHashMap<>();
    for (String variable : variables) {
      bindings.put(variable, m.group(variable));
    }
    return Optional.of(bindings);
  }

  @Override
  public String toString() {
    return template;
  }
}
