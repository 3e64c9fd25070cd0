package dev.jane.mcp.document;

import dev.jane.mcp.exception.PathSecurityException;
import dev.jane.mcp.exception.ValidationException;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Partition a document belongs to: either the stdlib bucket of a programming language or the spec
 * bucket of a project.
 *
 * <p>Code that needs to branch on the partition switches over {@link #kind()}; switch expressions
 * over the enum are checked for exhaustiveness by the compiler.
 */
public sealed interface Category permits Category.Stdlib, Category.Spec {

  Pattern NAME_PATTERN = Pattern.compile("[A-Za-z0-9._-]+");

  CategoryKind kind();

  /** Language or project name. Always a single, safe path segment. */
  String name();

  /** Resource URI of a document in this category, e.g. {@code stdlib://javascript/arrays.md}. */
  default String uri(String path) {
    return kind().wireName() + "://" + name() + "/" + path;
  }

  static Category of(CategoryKind kind, String name) {
    return switch (kind) {
      case STDLIB -> new Stdlib(name);
      case SPEC -> new Spec(name);
    };
  }

  static Category stdlib(String language) {
    return new Stdlib(language);
  }

  static Category spec(String project) {
    return new Spec(project);
  }

  record Stdlib(String language) implements Category {
    public Stdlib {
      language = validateName(CategoryKind.STDLIB, language);
    }

    @Override
    public CategoryKind kind() {
      return CategoryKind.STDLIB;
    }

    @Override
    public String name() {
      return language;
    }
  }

  record Spec(String project) implements Category {
    public Spec {
      project = validateName(CategoryKind.SPEC, project);
    }

    @Override
    public CategoryKind kind() {
      return CategoryKind.SPEC;
    }

    @Override
    public String name() {
      return project;
    }
  }

  private static String validateName(CategoryKind kind, String name) {
    String field = kind.parameterName();
    if (name == null || name.isBlank()) {
      throw new ValidationException(
          "%s must not be blank".formatted(field),
          Map.of("field", field, "constraint", "required"));
    }
    String trimmed = name.trim();
    if (trimmed.equals(".")
        || trimmed.equals("..")
        || trimmed.indexOf('/') >= 0
        || trimmed.indexOf('\\') >= 0) {
      throw new PathSecurityException(
          "%s '%s' is not a single directory name".formatted(field, name),
          Map.of("field", field, "constraint", "path-security"));
    }
    if (!NAME_PATTERN.matcher(trimmed).matches()) {
      throw new ValidationException(
          "%s '%s' may only contain letters, digits, '.', '_' and '-'".formatted(field, name),
          Map.of("field", field, "constraint", "pattern"));
    }
    return trimmed;
  }
}
