package dev.jane.mcp.tools;

import dev.jane.mcp.document.Category;
import dev.jane.mcp.document.CategoryKind;
import dev.jane.mcp.document.MetadataPatch;
import dev.jane.mcp.exception.ValidationException;
import dev.jane.mcp.index.SearchFilter;
import dev.jane.mcp.index.SearchHit;
import dev.jane.mcp.kb.KnowledgeBaseService;
import dev.jane.mcp.protocol.ToolArguments;
import dev.jane.mcp.protocol.ToolDefinition;
import dev.jane.mcp.protocol.ToolProperty;
import dev.jane.mcp.protocol.ToolSpecification;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The knowledge-base tools exposed over JSON-RPC: {@code get_stdlib}, {@code get_spec}, {@code
 * list_stdlibs}, {@code list_specs}, {@code search}, {@code create_document} and {@code
 * update_document}.
 */
public class DocumentTools {
  public static final String GET_STDLIB = "get_stdlib";
  public static final String GET_SPEC = "get_spec";
  public static final String LIST_STDLIBS = "list_stdlibs";
  public static final String LIST_SPECS = "list_specs";
  public static final String SEARCH = "search";
  public static final String CREATE_DOCUMENT = "create_document";
  public static final String UPDATE_DOCUMENT = "update_document";

  private static final List<String> TYPES =
      List.of(CategoryKind.STDLIB.wireName(), CategoryKind.SPEC.wireName());

  private final KnowledgeBaseService knowledgeBase;

  public DocumentTools(KnowledgeBaseService knowledgeBase) {
    this.knowledgeBase = knowledgeBase;
  }

  public List<ToolSpecification> specifications() {
    return List.of(
        getTool(CategoryKind.STDLIB, GET_STDLIB, "Get stdlib document"),
        getTool(CategoryKind.SPEC, GET_SPEC, "Get spec document"),
        listTool(CategoryKind.STDLIB, LIST_STDLIBS, "List stdlib documents"),
        listTool(CategoryKind.SPEC, LIST_SPECS, "List spec documents"),
        searchTool(),
        createTool(),
        updateTool());
  }

  private ToolSpecification getTool(CategoryKind kind, String name, String title) {
    String parameter = kind.parameterName();
    ToolDefinition definition =
        ToolDefinition.builder()
            .name(name)
            .title(title)
            .description(
                "Read a %s document with its metadata and markdown content."
                    .formatted(kind.wireName()))
            .argument(
                ToolProperty.string(
                    parameter, "The %s the document belongs to".formatted(parameter), true))
            .argument(
                ToolProperty.string(
                    "path", "Document path inside the " + parameter + ", e.g. arrays.md", true))
            .build();
    return new ToolSpecification(
        definition,
        args ->
            DocumentView.of(
                knowledgeBase.read(
                    Category.of(kind, args.string(parameter)), args.string("path"))));
  }

  private ToolSpecification listTool(CategoryKind kind, String name, String title) {
    String parameter = kind.parameterName();
    ToolDefinition definition =
        ToolDefinition.builder()
            .name(name)
            .title(title)
            .description(
                "Without '%s', list every known %s. With it, list the documents it contains."
                    .formatted(parameter, parameter))
            .argument(ToolProperty.string(parameter, "Restrict to one " + parameter, false))
            .build();
    return new ToolSpecification(definition, args -> list(kind, args));
  }

  private Map<String, Object> list(CategoryKind kind, ToolArguments args) {
    String parameter = kind.parameterName();
    Map<String, Object> result = new LinkedHashMap<>();
    String name = args.optionalString(parameter);
    if (name == null) {
      result.put(parameter + "s", knowledgeBase.listCategories(kind));
      return result;
    }
    Category category = Category.of(kind, name);
    result.put(parameter, category.name());
    result.put("documents", knowledgeBase.list(category));
    return result;
  }

  private ToolSpecification searchTool() {
    ToolDefinition definition =
        ToolDefinition.builder()
            .name(SEARCH)
            .title("Search documents")
            .description(
                "Full-text search over titles, descriptions, tags and content. Every term must"
                    + " match. Use '*' to list all documents that pass the filters.")
            .argument(ToolProperty.string("query", "Search terms separated by spaces", true))
            .argument(typeProperty(false))
            .argument(ToolProperty.string("language", "Only stdlib docs of this language", false))
            .argument(ToolProperty.string("project", "Only spec documents of this project", false))
            .argument(
                ToolProperty.builder()
                    .name("includeContent")
                    .description("Include the document body and matching lines")
                    .type(ToolProperty.Type.BOOLEAN)
                    .defaultValue(false)
                    .build())
            .build();
    return new ToolSpecification(definition, this::search);
  }

  private SearchResponse search(ToolArguments args) {
    String query = args.string("query");
    String type = args.optionalString("type");
    CategoryKind kind = type == null ? null : CategoryKind.fromWireName(type);
    String language = args.optionalString("language");
    String project = args.optionalString("project");
    // validates the names the same way as category lookups do
    if (language != null) language = Category.stdlib(language).name();
    if (project != null) project = Category.spec(project).name();
    boolean includeContent = args.optionalBoolean("includeContent", false);

    List<SearchHit> hits =
        knowledgeBase.search(query, new SearchFilter(kind, language, project), includeContent);
    List<SearchResultItem> results =
        hits.stream().map(hit -> SearchResultItem.of(hit, includeContent)).toList();
    return new SearchResponse(query, results.size(), results);
  }

  private ToolSpecification createTool() {
    ToolDefinition definition =
        ToolDefinition.builder()
            .name(CREATE_DOCUMENT)
            .title("Create document")
            .description(
                "Create a new markdown document. 'language' is required for stdlib documents,"
                    + " 'project' for spec documents.")
            .argument(typeProperty(true))
            .argument(ToolProperty.string("language", "Required when type is stdlib", false))
            .argument(ToolProperty.string("project", "Required when type is spec", false))
            .argument(ToolProperty.string("path", "Relative path ending in .md", true))
            .argument(ToolProperty.string("title", "Document title", true))
            .argument(ToolProperty.string("description", "Short summary", false))
            .argument(ToolProperty.string("author", "Author", false))
            .argument(tagsProperty())
            .argument(ToolProperty.string("content", "Markdown body", true))
            .build();
    return new ToolSpecification(
        definition,
        args ->
            DocumentSummary.of(
                knowledgeBase.create(
                    categoryOf(args),
                    args.string("path"),
                    new MetadataPatch(
                        args.string("title"),
                        args.optionalString("description"),
                        args.optionalString("author"),
                        args.optionalStringList("tags")),
                    args.string("content"))));
  }

  private ToolSpecification updateTool() {
    ToolDefinition definition =
        ToolDefinition.builder()
            .name(UPDATE_DOCUMENT)
            .title("Update document")
            .description(
                "Update an existing document. Only supplied fields change; updatedAt always"
                    + " advances. Set updateMeta=false to change the content only.")
            .argument(typeProperty(true))
            .argument(ToolProperty.string("language", "Required when type is stdlib", false))
            .argument(ToolProperty.string("project", "Required when type is spec", false))
            .argument(ToolProperty.string("path", "Relative path of the document", true))
            .argument(ToolProperty.string("title", "New title", false))
            .argument(ToolProperty.string("description", "New summary", false))
            .argument(ToolProperty.string("author", "New author", false))
            .argument(tagsProperty())
            .argument(ToolProperty.string("content", "New markdown body", false))
            .argument(
                ToolProperty.builder()
                    .name("updateMeta")
                    .description("Apply the supplied metadata fields")
                    .type(ToolProperty.Type.BOOLEAN)
                    .defaultValue(true)
                    .build())
            .build();
    return new ToolSpecification(
        definition,
        args -> {
          MetadataPatch patch =
              args.optionalBoolean("updateMeta", true)
                  ? new MetadataPatch(
                      args.optionalString("title"),
                      args.optionalString("description"),
                      args.optionalString("author"),
                      args.optionalStringList("tags"))
                  : MetadataPatch.empty();
          return DocumentSummary.of(
              knowledgeBase.update(
                  categoryOf(args), args.string("path"), patch, args.optionalString("content")));
        });
  }

  /** Resolve the category of a create/update call from {@code type} plus language or project. */
  static Category categoryOf(ToolArguments args) {
    CategoryKind kind = CategoryKind.fromWireName(args.string("type"));
    String parameter = kind.parameterName();
    String name = args.optionalString(parameter);
    if (name == null) {
      throw new ValidationException(
          "'%s' is required when type is %s".formatted(parameter, kind.wireName()),
          Map.of("field", parameter, "constraint", "required"));
    }
    return Category.of(kind, name);
  }

  private static ToolProperty typeProperty(boolean required) {
    return ToolProperty.builder()
        .name("type")
        .description("Document kind")
        .type(ToolProperty.Type.STRING)
        .required(required)
        .enumValues(TYPES)
        .build();
  }

  private static ToolProperty tagsProperty() {
    return ToolProperty.builder()
        .name("tags")
        .description("Tags, order does not matter")
        .type(ToolProperty.Type.ARRAY)
        .items(new ToolProperty(null, null, false, ToolProperty.Type.STRING))
        .build();
  }
}
