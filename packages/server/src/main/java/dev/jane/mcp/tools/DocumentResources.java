package dev.jane.mcp.tools;

import dev.jane.mcp.document.Category;
import dev.jane.mcp.document.CategoryKind;
import dev.jane.mcp.document.Document;
import dev.jane.mcp.exception.JaneException;
import dev.jane.mcp.kb.KnowledgeBaseService;
import dev.jane.mcp.logging.LoggingService;
import dev.jane.mcp.protocol.CompletionProvider;
import dev.jane.mcp.protocol.ResourceContents;
import dev.jane.mcp.protocol.ResourceSpecification;
import dev.jane.mcp.protocol.ResourceTemplate;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;

/**
 * Read-only resource templates {@code stdlib://{language}/{path}} and {@code
 * spec://{project}/{path}}, with completions for both variables.
 */
public class DocumentResources {
  private static final Logger log = LoggingService.getLogger(DocumentResources.class);

  public static final String MIME_TYPE = "text/markdown";
  private static final int MAX_COMPLETIONS = 100;

  private final KnowledgeBaseService knowledgeBase;

  public DocumentResources(KnowledgeBaseService knowledgeBase) {
    this.knowledgeBase = knowledgeBase;
  }

  public List<ResourceSpecification> specifications() {
    return List.of(
        resource(CategoryKind.STDLIB, "Standard library document"),
        resource(CategoryKind.SPEC, "Project specification document"));
  }

  private ResourceSpecification resource(CategoryKind kind, String title) {
    String parameter = kind.parameterName();
    ResourceTemplate template =
        ResourceTemplate.parse(kind.wireName() + "://{" + parameter + "}/{path}");
    return new ResourceSpecification(
        template,
        kind.wireName(),
        title,
        "Markdown content of a %s document, addressed by %s and path"
            .formatted(kind.wireName(), parameter),
        MIME_TYPE,
        (uri, variables) -> {
          Document document =
              knowledgeBase.read(
                  Category.of(kind, variables.get(parameter)), variables.get("path"));
          return new ResourceContents(uri, MIME_TYPE, document.content());
        },
        Map.of(parameter, categoryCompletion(kind), "path", pathCompletion(kind)));
  }

  private CompletionProvider categoryCompletion(CategoryKind kind) {
    return (partial, resolved) -> filter(knowledgeBase.listCategories(kind), partial);
  }

  private CompletionProvider pathCompletion(CategoryKind kind) {
    return (partial, resolved) -> {
      String name = resolved.get(kind.parameterName());
      if (name == null || name.isBlank()) {
        return List.of();
      }
      try {
        return filter(knowledgeBase.list(Category.of(kind, name)), partial);
      } catch (JaneException e) {
        log.debug("No path completions for {} {}: {}", kind.parameterName(), name, e.getMessage());
        return List.of();
      }
    };
  }

  private static List<String> filter(List<String> candidates, String partial) {
    String needle = partial == null ? "" : partial.toLowerCase(Locale.ROOT);
    return candidates.stream()
        .filter(c -> c.toLowerCase(Locale.ROOT).contains(needle))
        .limit(MAX_COMPLETIONS)
        .toList();
  }
}
