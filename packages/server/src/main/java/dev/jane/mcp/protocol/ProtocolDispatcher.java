package dev.jane.mcp.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.jane.mcp.exception.AlreadyExistsException;
import dev.jane.mcp.exception.ConfigException;
import dev.jane.mcp.exception.JaneException;
import dev.jane.mcp.exception.MalformedDocumentException;
import dev.jane.mcp.exception.NotFoundException;
import dev.jane.mcp.exception.PathSecurityException;
import dev.jane.mcp.exception.ValidationException;
import dev.jane.mcp.logging.LoggingService;
import dev.jane.mcp.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Transport-independent JSON-RPC 2.0 request handler.
 *
 * <p>Each request passes through parse, envelope check, routing, argument validation and handler
 * invocation; any stage may short-circuit into an error response. Registered tools are callable
 * both by their own name and through the MCP {@code tools/call} method. Registries are fixed at
 * {@link Builder#build()} time.
 *
 * <p>{@link #handle(String)} never throws: every failure ends up as a JSON-RPC error object. Domain
 * exceptions are mapped to stable codes; anything unexpected becomes {@code -32603 Internal error}
 * with the details only in the server log.
 */
public class ProtocolDispatcher {
  private static final Logger log = LoggingService.getLogger(ProtocolDispatcher.class);

  public static final String JSONRPC_VERSION = "2.0";
  public static final String PROTOCOL_VERSION = "2025-06-18";
  static final List<String> SUPPORTED_PROTOCOL_VERSIONS =
      List.of("2025-06-18", "2025-03-26", "2024-11-05");

  private static final String NOTIFICATION_PREFIX = "notifications/";

  private final Map<String, ToolSpecification> tools;
  private final List<ResourceSpecification> resources;
  private final String serverName;
  private final String serverVersion;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();
  private final JsonNodeFactory nodes = JsonNodeFactory.instance;

  private ProtocolDispatcher(Builder builder) {
    this.tools = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tools));
    this.resources = List.copyOf(builder.resources);
    this.serverName = builder.serverName;
    this.serverVersion = builder.serverVersion;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Collection<ToolSpecification> tools() {
    return tools.values();
  }

  public List<ResourceSpecification> resources() {
    return resources;
  }

  /**
   * Handle one raw JSON-RPC message (single request or batch).
   *
   * @return serialized response, or {@code null} when nothing must be sent back (notifications)
   */
  public String handle(String raw) {
    JsonNode response;
    try {
      JsonNode request = raw == null || raw.isBlank() ? null : mapper.readTree(raw);
      if (request == null) {
        response = error(NullNode.getInstance(), JsonRpcErrorCode.PARSE_ERROR, null, null);
      } else {
        response = handle(request);
      }
    } catch (JsonProcessingException e) {
      log.debug("Rejecting unparseable request: {}", e.getOriginalMessage());
      response = error(NullNode.getInstance(), JsonRpcErrorCode.PARSE_ERROR, null, null);
    }
    if (response == null) {
      return null;
    }
    try {
      return mapper.writeValueAsString(response);
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize JSON-RPC response", e);
      return "{\"jsonrpc\":\"2.0\",\"error\":{\"code\":-32603,\"message\":\"Internal error\"},"
          + "\"id\":null}";
    }
  }

  /** Handle an already parsed message; {@code null} means no response. */
  public JsonNode handle(JsonNode message) {
    if (message.isArray()) {
      if (message.isEmpty()) {
        return error(NullNode.getInstance(), JsonRpcErrorCode.INVALID_REQUEST, null, null);
      }
      ArrayNode responses = nodes.arrayNode();
      for (JsonNode item : message) {
        ObjectNode response = handleSingle(item);
        if (response != null) responses.add(response);
      }
      return responses.isEmpty() ? null : responses;
    }
    return handleSingle(message);
  }

  private ObjectNode handleSingle(JsonNode request) {
    if (!request.isObject()) {
      return error(NullNode.getInstance(), JsonRpcErrorCode.INVALID_REQUEST, null, null);
    }
    JsonNode idNode = request.get("id");
    if (idNode != null && !(idNode.isTextual() || idNode.isNumber() || idNode.isNull())) {
      return error(NullNode.getInstance(), JsonRpcErrorCode.INVALID_REQUEST, "Invalid id", null);
    }
    JsonNode id = idNode == null ? NullNode.getInstance() : idNode;

    // Envelope failures are answered even when the id is missing.
    JsonNode version = request.get("jsonrpc");
    if (version == null || !JSONRPC_VERSION.equals(version.asText(null))) {
      return error(id, JsonRpcErrorCode.INVALID_REQUEST, "jsonrpc must be \"2.0\"", null);
    }
    JsonNode methodNode = request.get("method");
    if (methodNode == null || !methodNode.isTextual() || methodNode.asText().isBlank()) {
      return error(id, JsonRpcErrorCode.INVALID_REQUEST, "method is required", null);
    }
    String method = methodNode.asText();
    boolean notification = idNode == null;

    try {
      Object result = route(method, paramsOf(request.get("params")));
      return notification ? null : success(id, result);
    } catch (RuntimeException e) {
      ObjectNode error = toError(id, method, e);
      return notification ? null : error;
    }
  }

  private ObjectNode paramsOf(JsonNode params) {
    if (params == null || params.isNull()) {
      return nodes.objectNode();
    }
    if (!params.isObject()) {
      throw new JsonRpcException(
          JsonRpcErrorCode.INVALID_PARAMS,
          "params must be an object",
          Map.of("field", "params", "constraint", "type"));
    }
    return (ObjectNode) params;
  }

  private Object route(String method, ObjectNode params) {
    switch (method) {
      case "initialize":
        return initialize(params);
      case "ping":
        return Map.of();
      case "tools/list":
        return Map.of(
            "tools", tools.values().stream().map(t -> t.definition().toDescriptor()).toList());
      case "tools/call":
        return callTool(params);
      case "resources/list":
        return Map.of("resources", List.of());
      case "resources/templates/list":
        return Map.of(
            "resourceTemplates",
            resources.stream().map(ResourceSpecification::toDescriptor).toList());
      case "resources/read":
        return readResource(params);
      case "completion/complete":
        return complete(params);
      default:
        if (method.startsWith(NOTIFICATION_PREFIX)) {
          log.debug("Received notification {}", method);
          return Map.of();
        }
        ToolSpecification tool = tools.get(method);
        if (tool == null) {
          throw new JsonRpcException(
              JsonRpcErrorCode.METHOD_NOT_FOUND,
              "Method not found: " + method,
              Map.of("method", method));
        }
        return invoke(tool, params);
    }
  }

  private Object invoke(ToolSpecification tool, ObjectNode arguments) {
    ToolArgumentValidator.validate(tool.definition().schema(), arguments);
    return tool.handler().handle(new ToolArguments(arguments));
  }

  private Map<String, Object> initialize(ObjectNode params) {
    String requested = params.path("protocolVersion").asText(null);
    String version =
        requested != null && SUPPORTED_PROTOCOL_VERSIONS.contains(requested)
            ? requested
            : PROTOCOL_VERSION;
    Map<String, Object> capabilities = new LinkedHashMap<>();
    capabilities.put("tools", Map.of("listChanged", false));
    capabilities.put("resources", Map.of("subscribe", false, "listChanged", false));
    capabilities.put("completions", Map.of());

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("protocolVersion", version);
    result.put("capabilities", capabilities);
    result.put("serverInfo", Map.of("name", serverName, "version", serverVersion));
    return result;
  }

  private Map<String, Object> callTool(ObjectNode params) {
    String name = requiredText(params, "name");
    ToolSpecification tool = tools.get(name);
    if (tool == null) {
      throw new JsonRpcException(
          JsonRpcErrorCode.METHOD_NOT_FOUND, "Unknown tool: " + name, Map.of("method", name));
    }
    JsonNode arguments = params.get("arguments");
    ObjectNode args;
    if (arguments == null || arguments.isNull()) {
      args = nodes.objectNode();
    } else if (arguments.isObject()) {
      args = (ObjectNode) arguments;
    } else {
      throw new ValidationException(
          "'arguments' must be an object", Map.of("field", "arguments", "constraint", "type"));
    }

    Object result = invoke(tool, args);
    Map<String, Object> response = new LinkedHashMap<>();
    response.put(
        "content", List.of(Map.of("type", "text", "text", JacksonUtility.toJson(result))));
    response.put("structuredContent", result);
    response.put("isError", false);
    return response;
  }

  private Map<String, Object> readResource(ObjectNode params) {
    String uri = requiredText(params, "uri");
    for (ResourceSpecification resource : resources) {
      Optional<Map<String, String>> bindings = resource.template().match(uri);
      if (bindings.isPresent()) {
        ResourceContents contents = resource.handler().read(uri, bindings.get());
        return Map.of("contents", List.of(contents));
      }
    }
    throw new ValidationException(
        "No resource template matches " + uri, Map.of("field", "uri", "constraint", "template"));
  }

  private Map<String, Object> complete(ObjectNode params) {
    JsonNode ref = params.path("ref");
    String uri = ref.path("uri").asText(null);
    String argument = params.path("argument").path("name").asText(null);
    if (uri == null || argument == null) {
      throw new ValidationException(
          "completion requires ref.uri and argument.name",
          Map.of("field", uri == null ? "ref.uri" : "argument.name", "constraint", "required"));
    }
    String value = params.path("argument").path("value").asText("");
    Map<String, String> resolved = new LinkedHashMap<>();
    params
        .path("context")
        .path("arguments")
        .fields()
        .forEachRemaining(e -> resolved.put(e.getKey(), e.getValue().asText()));

    List<String> values = List.of();
    for (ResourceSpecification resource : resources) {
      if (resource.template().template().equals(uri)) {
        CompletionProvider provider = resource.completions().get(argument);
        if (provider != null) {
          values = provider.complete(value, resolved);
        }
        break;
      }
    }
    Map<String, Object> completion = new LinkedHashMap<>();
    completion.put("values", values);
    completion.put("total", values.size());
    completion.put("hasMore", false);
    return Map.of("completion", completion);
  }

  private static String requiredText(ObjectNode params, String field) {
    JsonNode value = params.get(field);
    if (value == null || !value.isTextual() || value.asText().isBlank()) {
      throw new ValidationException(
          "'" + field + "' is required", Map.of("field", field, "constraint", "required"));
    }
    return value.asText();
  }

  private ObjectNode toError(JsonNode id, String method, RuntimeException e) {
    if (e instanceof JsonRpcException rpc) {
      log.debug("Request {} rejected: {}", method, rpc.getMessage());
      return error(id, rpc.getCode(), rpc.getMessage(), rpc.getData());
    }
    if (e instanceof PathSecurityException pse) {
      log.warn("Path security violation in {}: {}", method, pse.getMessage());
      return error(id, JsonRpcErrorCode.INVALID_PARAMS, pse.getMessage(), contextOf(pse));
    }
    if (e instanceof ValidationException ve) {
      log.debug("Invalid params for {}: {}", method, ve.getMessage());
      return error(id, JsonRpcErrorCode.INVALID_PARAMS, ve.getMessage(), contextOf(ve));
    }
    if (e instanceof NotFoundException nfe) {
      log.debug("{}: {}", method, nfe.getMessage());
      return error(id, JsonRpcErrorCode.DOCUMENT_NOT_FOUND, nfe.getMessage(), contextOf(nfe));
    }
    if (e instanceof AlreadyExistsException aee) {
      log.debug("{}: {}", method, aee.getMessage());
      return error(id, JsonRpcErrorCode.DOCUMENT_EXISTS, aee.getMessage(), contextOf(aee));
    }
    if (e instanceof MalformedDocumentException mde) {
      log.warn("{}: {}", method, mde.getMessage());
      return error(id, JsonRpcErrorCode.MALFORMED_DOCUMENT, mde.getMessage(), contextOf(mde));
    }
    log.error("Unexpected failure while handling {}", method, e);
    return error(id, JsonRpcErrorCode.INTERNAL_ERROR, null, null);
  }

  private static Map<String, Object> contextOf(JaneException e) {
    return e.getContext().isEmpty() ? null : e.getContext();
  }

  private ObjectNode success(JsonNode id, Object result) {
    ObjectNode response = nodes.objectNode();
    response.put("jsonrpc", JSONRPC_VERSION);
    response.set("result", result == null ? nodes.objectNode() : mapper.valueToTree(result));
    response.set("id", id);
    return response;
  }

  private ObjectNode error(JsonNode id, JsonRpcErrorCode code, String message, Object data) {
    ObjectNode error = nodes.objectNode();
    error.put("code", code.code());
    error.put("message", message != null ? message : code.defaultMessage());
    if (data != null) {
      error.set("data", mapper.valueToTree(data));
    }
    ObjectNode response = nodes.objectNode();
    response.put("jsonrpc", JSONRPC_VERSION);
    response.set("error", error);
    response.set("id", id);
    return response;
  }

  public static final class Builder {
    private final Map<String, ToolSpecification> tools = new LinkedHashMap<>();
    private final List<ResourceSpecification> resources = new ArrayList<>();
    private String serverName = "jane";
    private String serverVersion = "1.0.0";

    public Builder serverInfo(String name, String version) {
      this.serverName = name;
      this.serverVersion = version;
      return this;
    }

    public Builder tool(ToolSpecification tool) {
      if (tools.putIfAbsent(tool.name(), tool) != null) {
        throw new ConfigException("Tool registered twice: " + tool.name());
      }
      return this;
    }

    public Builder tools(Collection<ToolSpecification> tools) {
      tools.forEach(this::tool);
      return this;
    }

    public Builder resource(ResourceSpecification resource) {
      this.resources.add(resource);
      return this;
    }

    public Builder resources(Collection<ResourceSpecification> resources) {
      resources.forEach(this::resource);
      return this;
    }

    public ProtocolDispatcher build() {
      return new ProtocolDispatcher(this);
    }
  }
}
