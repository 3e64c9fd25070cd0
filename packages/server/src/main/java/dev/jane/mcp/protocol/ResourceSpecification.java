package dev.jane.mcp.protocol;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record ResourceSpecification(
    ResourceTemplate template,
    String name,
    String title,
    String description,
    String mimeType,
    ResourceHandler handler,
    Map<String, CompletionProvider> completions) {

  public ResourceSpecification {
    Objects.requireNonNull(template, "template");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(handler, "handler");
    completions = completions == null ? Map.of() : Map.copyOf(completions);
  }

  /** Descriptor entry of {@code resources/templates/list}. */
  public Map<String, Object> toDescriptor() {
    Map<String, Object> descriptor = new LinkedHashMap<>();
    descriptor.put("uriTemplate", template.template());
    descriptor.put("name", name);
    if (title != null) descriptor.put("title", title);
    if (description != null) descriptor.put("description", description);
    if (mimeType != null) descriptor.put("mimeType", mimeType);
    return descriptor;
  }
}
