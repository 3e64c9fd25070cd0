package dev.jane.mcp;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class StartupParameters {

  public static final List<String> MODES = List.of("stdio", "http", "both", "help");
  public static final List<String> INDEX_MODES = List.of("eager", "lazy");

  final Map<String, Object> parameters = new HashMap<>();

  {
    parameters.put("config-file", "classpath:application.yaml");
    parameters.put("mode", "stdio"); // stdio, http, both, help
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, Object> parseArguments(String[] arguments) {
    Map<String, Object> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {

      if (!arguments[p].startsWith("--")) {
        continue;
      }

      String paramName = arguments[p].substring(2);
      String paramValue = null;

      if (p < arguments.length - 1 && !arguments[p + 1].startsWith("--")) {
        paramValue = arguments[p + 1];
        p++;
      }

      result.put(paramName, paramValue);
    }
    return result;
  }

  private void validate() {
    Object mode = parameters.get("mode");
    if (mode == null || !MODES.contains(mode.toString())) {
      throw new IllegalArgumentException("Invalid mode: " + mode + ", expected one of " + MODES);
    }

    if (parameters.get("config-file") == null
        || parameters.get("config-file").toString().isBlank()) {
      throw new IllegalArgumentException("Missing config file location");
    }

    if (parameters.containsKey("index")) {
      Object index = parameters.get("index");
      if (index == null || !INDEX_MODES.contains(index.toString())) {
        throw new IllegalArgumentException(
            "Invalid index initialization: " + index + ", expected one of " + INDEX_MODES);
      }
    }

    if (parameters.containsKey("root")
        && (parameters.get("root") == null || parameters.get("root").toString().isBlank())) {
      throw new IllegalArgumentException("Missing value for --root");
    }
  }

  /**
   * Returns the configuration location string. Examples: "classpath:application.yaml",
   * "/etc/jane.yaml", "config/local.yaml".
   */
  public String configFile() {
    return getOptionalParameter("config-file", String.class).orElse("classpath:application.yaml");
  }

  public String mode() {
    return getParameter("mode", String.class);
  }

  public boolean servesStdio() {
    return "stdio".equals(mode()) || "both".equals(mode());
  }

  public boolean servesHttp() {
    return "http".equals(mode()) || "both".equals(mode());
  }

  public <T> T getParameter(String name, Class<T> type) {
    return type.cast(parameters.get(name));
  }

  public <T> Optional<T> getOptionalParameter(String name, Class<T> type) {
    return Optional.ofNullable(type.cast(parameters.get(name)));
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }

  public static String usage() {
    return String.join(
        "\n",
        "Usage: jane [--config-file <location>] [--mode stdio|http|both|help]",
        "            [--index eager|lazy] [--root <directory>]",
        "",
        "  --config-file  YAML configuration, classpath:<name> or a file path",
        "                 (default classpath:application.yaml)",
        "  --mode         transports to serve (default stdio)",
        "  --index        when to build the search index (overrides index.initialization)",
        "  --root         knowledge-base directory (overrides store.root)");
  }
}
