package com.drawiomcp.tools;

import com.drawiomcp.annotation.DrawioMcpTool;
import com.drawiomcp.exceptions.DrawioMcpException;
import com.drawiomcp.models.DrawioMcpError;
import com.drawiomcp.models.McpResponse;
import com.drawiomcp.query.QueryOptions;
import com.drawiomcp.utils.DrawioMcpErrorUtils;
import com.drawiomcp.utils.JsonMapperHolder;
import com.drawiomcp.utils.jsonschema.JsonSchema;
import com.drawiomcp.utils.jsonschema.SchemaBuilder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.common.McpTransportContext;
import io.modelcontextprotocol.server.McpStatelessServerFeatures.AsyncToolSpecification;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.Tool;
import io.modelcontextprotocol.spec.McpSchema.ToolAnnotations;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Abstract base class for all drawio MCP tools. Provides standardized handling for:
 *
 * <ul>
 *   <li>Error normalization - every throwable becomes a structured DrawioMcpException
 *   <li>Argument parsing - file path, page filter and bounded result limit
 *   <li>Response envelope - consistent McpResponse wrapper with timing
 * </ul>
 *
 * <p>Tools extend this class and implement {@link #schema()} and {@link #execute}.
 */
public abstract class BaseMcpTool {

  private static final Logger LOG = LoggerFactory.getLogger(BaseMcpTool.class);

  protected static final ObjectMapper mapper = JsonMapperHolder.getMapper();

  private static final Map<String, Object> DEFAULT_OUTPUT_SCHEMA = createDefaultOutputSchema();
  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  // =================== Argument Name Constants (snake_case) ===================

  public static final String ARG_FILE_PATH = "file_path";
  public static final String ARG_PAGE_NAME = "page_name";
  public static final String ARG_LIMIT = "limit";
  public static final String ARG_OPERATION = "operation";

  // =================== Abstract Methods ===================

  /**
   * Defines the JSON input schema for this tool.
   *
   * @return the schema describing the arguments map passed to {@link #execute}
   */
  public abstract JsonSchema schema();

  /**
   * Executes the tool. Errors are signalled with a {@link DrawioMcpException}, thrown or
   * emitted through {@code Mono.error()}.
   *
   * @param context the MCP transport context
   * @param args the arguments passed to the tool
   * @param tool the query service and configuration
   * @return a Mono emitting the raw result object
   */
  public abstract Mono<? extends Object> execute(
      McpTransportContext context, Map<String, Object> args, DrawioToolContext tool);

  // =================== Tool Specification Generation ===================

  /**
   * Generates the MCP {@link AsyncToolSpecification} for this tool.
   *
   * @return the specification, or null if the tool is not annotated or its schema is invalid
   */
  public AsyncToolSpecification specification(DrawioToolContext tool) {
    return Optional.ofNullable(getAnnotation())
        .map(annotation -> createToolSpecification(annotation, tool))
        .orElseGet(
            () -> {
              LOG.error("Missing @DrawioMcpTool annotation on {}", getClass().getSimpleName());
              return null;
            });
  }

  private AsyncToolSpecification createToolSpecification(
      DrawioMcpTool annotation, DrawioToolContext tool) {
    return convertToMcpSchema(schema(), annotation)
        .map(
            mcpSchema ->
                new AsyncToolSpecification(
                    Tool.builder()
                        .name(annotation.mcpName())
                        .description(annotation.mcpDescription())
                        .inputSchema(mcpSchema)
                        .outputSchema(outputSchema())
                        .title(annotation.title().isEmpty() ? null : annotation.title())
                        .annotations(createToolAnnotations(annotation))
                        .build(),
                    (ctx, request) ->
                        executeWithEnvelope(ctx, request.arguments(), tool, annotation)))
        .orElse(null);
  }

  /** Returns the MCP output schema advertised for this tool. */
  protected Map<String, Object> outputSchema() {
    return DEFAULT_OUTPUT_SCHEMA;
  }

  private static Map<String, Object> createDefaultOutputSchema() {
    Map<String, Object> errorSchema = new LinkedHashMap<>();
    errorSchema.put("type", "object");
    errorSchema.put(
        "properties",
        Map.of(
            "message", Map.of("type", "string"),
            "error_type", Map.of("type", "string"),
            "error_code", Map.of("type", "string"),
            "context", Map.of("type", "object"),
            "related_resources", Map.of("type", "array"),
            "suggestions", Map.of("type", "array")));
    errorSchema.put("additionalProperties", true);

    Map<String, Object> responseSchema = new LinkedHashMap<>();
    responseSchema.put("type", "object");
    responseSchema.put("required", List.of("success"));
    responseSchema.put(
        "properties",
        Map.of(
            "success", Map.of("type", "boolean"),
            "tool", Map.of("type", "string"),
            "operation", Map.of("type", "string"),
            "data", Map.of(),
            "duration_ms", Map.of("type", "number"),
            "error", errorSchema));
    responseSchema.put("additionalProperties", false);
    return responseSchema;
  }

  /** Creates ToolAnnotations from the annotation hints, or null when none is set. */
  private ToolAnnotations createToolAnnotations(DrawioMcpTool annotation) {
    boolean hasTitle = !annotation.title().isEmpty();
    boolean hasReadOnly = annotation.readOnlyHint();
    boolean hasDestructive = annotation.destructiveHint();
    boolean hasIdempotent = annotation.idempotentHint();
    boolean hasOpenWorld = annotation.openWorldHint();

    if (!hasTitle && !hasReadOnly && !hasDestructive && !hasIdempotent && !hasOpenWorld) {
      return null;
    }

    return new ToolAnnotations(
        hasTitle ? annotation.title() : null,
        hasReadOnly ? Boolean.TRUE : null,
        hasDestructive ? Boolean.TRUE : null,
        hasIdempotent ? Boolean.TRUE : null,
        hasOpenWorld ? Boolean.TRUE : null,
        null);
  }

  /** Wraps execution with timing, error normalization, and the response envelope. */
  Mono<CallToolResult> executeWithEnvelope(
      McpTransportContext ctx,
      Map<String, Object> args,
      DrawioToolContext tool,
      DrawioMcpTool annotation) {

    long startTime = System.currentTimeMillis();
    String toolName = annotation.mcpName();
    Map<String, Object> safeArgs = args != null ? args : Map.of();
    String operation = getOperationFromArgs(safeArgs);

    return Mono.defer(() -> execute(ctx, safeArgs, tool))
        .map(
            result -> {
              long duration = System.currentTimeMillis() - startTime;
              McpResponse<?> response = McpResponse.success(toolName, operation, result, duration);
              return createSuccessResult(response, toolName, operation);
            })
        .onErrorResume(
            t -> {
              long duration = System.currentTimeMillis() - startTime;
              DrawioMcpException normalized = normalizeException(t, toolName, operation);
              McpResponse<?> response =
                  McpResponse.error(toolName, operation, normalized.getErr(), duration);
              return createErrorResult(response, normalized);
            });
  }

  /** The operation recorded in the envelope: the {@code operation} argument, else "execute". */
  protected String getOperationFromArgs(Map<String, Object> args) {
    Object operation = args.get(ARG_OPERATION);
    if (operation instanceof String) {
      return (String) operation;
    }
    return "execute";
  }

  /**
   * Runs blocking diagram work on the bounded elastic scheduler.
   */
  protected <T> Mono<T> runBlocking(Callable<T> work) {
    return Mono.fromCallable(work).subscribeOn(Schedulers.boundedElastic());
  }

  // =================== Error Normalization ===================

  /**
   * Normalizes any throwable to a DrawioMcpException with structured error info.
   *
   * @param t the throwable to normalize
   * @param toolName the tool name for error context
   * @param operation the operation being performed
   * @return a DrawioMcpException with structured error information
   */
  protected DrawioMcpException normalizeException(Throwable t, String toolName, String operation) {
    if (t instanceof DrawioMcpException) {
      return (DrawioMcpException) t;
    }

    if (t instanceof RuntimeException && t.getCause() instanceof DrawioMcpException) {
      return (DrawioMcpException) t.getCause();
    }

    if (t instanceof IllegalArgumentException) {
      DrawioMcpError error =
          DrawioMcpError.validation()
              .errorCode(DrawioMcpError.ErrorCode.INVALID_ARGUMENT_VALUE)
              .message(t.getMessage())
              .context(
                  new DrawioMcpError.ErrorContext(
                      operation,
                      toolName,
                      null,
                      null,
                      Map.of("exception_type", "IllegalArgumentException")))
              .build();
      return new DrawioMcpException(error, t);
    }

    LOG.warn("Unexpected failure in tool {}", toolName, t);
    return DrawioMcpException.fromException(t, operation, getClass().getSimpleName());
  }

  // =================== Result Creation ===================

  private CallToolResult createSuccessResult(
      McpResponse<?> response, String toolName, String operation) {
    try {
      return buildStructuredToolResult(response, false);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      LOG.error("Error serializing {} response to JSON", toolName, e);
      McpResponse<?> errorResponse =
          McpResponse.error(
              toolName,
              operation,
              DrawioMcpError.internal()
                  .errorCode(DrawioMcpError.ErrorCode.SERIALIZATION_FAILED)
                  .message("Failed to serialize tool response")
                  .context(
                      new DrawioMcpError.ErrorContext(
                          operation,
                          toolName,
                          null,
                          null,
                          Map.of("exception_type", e.getClass().getSimpleName())))
                  .build(),
              response.getDurationMs());
      try {
        return buildStructuredToolResult(errorResponse, true);
      } catch (JsonProcessingException nested) {
        throw new IllegalStateException("Error envelope cannot be serialized", nested);
      }
    }
  }

  private Mono<CallToolResult> createErrorResult(
      McpResponse<?> response, DrawioMcpException exception) {
    LOG.error(
        "Tool error - {} [{}]: {}",
        exception.getErrorType(),
        exception.getErrorCode(),
        exception.getMessage());
    return Mono.fromCallable(() -> buildStructuredToolResult(response, true));
  }

  private CallToolResult buildStructuredToolResult(McpResponse<?> response, boolean isError)
      throws JsonProcessingException {
    String json = mapper.writeValueAsString(response);
    Map<String, Object> structured = mapper.convertValue(response, MAP_TYPE);
    return CallToolResult.builder()
        .addTextContent(json)
        .structuredContent(structured)
        .isError(isError)
        .build();
  }

  // =================== Argument Parsing ===================

  /**
   * Retrieves an optional string argument.
   *
   * @return the non-blank string value if present
   */
  protected Optional<String> getOptionalStringArgument(
      Map<String, Object> args, String argumentName) {
    return Optional.ofNullable(args.get(argumentName))
        .filter(String.class::isInstance)
        .map(String.class::cast)
        .filter(value -> !value.isBlank());
  }

  /**
   * Retrieves a required non-blank string argument.
   *
   * @throws DrawioMcpException if the argument is missing, blank, or not a string
   */
  protected String getRequiredStringArgument(Map<String, Object> args, String argumentName) {
    Object raw = args.get(argumentName);
    if (raw != null && !(raw instanceof String)) {
      throw new DrawioMcpException(
          DrawioMcpErrorUtils.invalidArgumentType(argumentName, "string", raw, getMcpName()));
    }
    return getOptionalStringArgument(args, argumentName)
        .orElseThrow(
            () ->
                new DrawioMcpException(
                    DrawioMcpErrorUtils.missingRequiredArgument(argumentName, getMcpName(), args)));
  }

  /**
   * Retrieves an optional integer argument. Accepts JSON numbers and integral strings.
   *
   * @throws DrawioMcpException if present but not a 32-bit integer
   */
  protected Optional<Integer> getOptionalIntArgument(
      Map<String, Object> args, String argumentName) {
    Object raw = args.get(argumentName);
    if (raw == null) {
      return Optional.empty();
    }
    return parseStrictIntegralValue(raw)
        .filter(value -> value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE)
        .map(Long::intValue)
        .map(Optional::of)
        .orElseThrow(
            () ->
                new DrawioMcpException(
                    DrawioMcpError.invalid(argumentName, raw, "must be a valid 32-bit integer value")));
  }

  private Optional<Long> parseStrictIntegralValue(Object value) {
    String rawValue = value instanceof String ? ((String) value).trim() : value.toString().trim();
    if (rawValue.isEmpty() || !rawValue.matches("[-+]?\\d+")) {
      return Optional.empty();
    }
    try {
      return Optional.of(Long.parseLong(rawValue));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }

  /**
   * Reads {@code page_name} and {@code limit}. The limit must lie between 1 and the configured
   * maximum.
   */
  protected QueryOptions getQueryOptions(Map<String, Object> args, DrawioToolContext tool) {
    String pageName = getOptionalStringArgument(args, ARG_PAGE_NAME).orElse(null);
    Integer limit = getOptionalIntArgument(args, ARG_LIMIT).orElse(null);
    if (limit != null) {
      int max = tool.config().getMaxLimit();
      if (limit < 1 || limit > max) {
        throw new DrawioMcpException(
            DrawioMcpErrorUtils.argumentOutOfRange(ARG_LIMIT, limit, 1, max, getMcpName()));
      }
    }
    return new QueryOptions(pageName, limit);
  }

  // =================== Tool Information ===================

  /** Gets the tool's MCP name from the @DrawioMcpTool annotation. */
  public String getMcpName() {
    DrawioMcpTool annotation = getAnnotation();
    return annotation != null ? annotation.mcpName() : getClass().getSimpleName();
  }

  /** Gets the annotation for this tool. */
  protected DrawioMcpTool getAnnotation() {
    return getClass().getAnnotation(DrawioMcpTool.class);
  }

  // =================== Schema Helpers ===================

  protected static SchemaBuilder.IObjectSchemaBuilder createBaseSchemaNode() {
    return SchemaBuilder.object(mapper);
  }

  // =================== Schema Conversion ===================

  private Optional<McpSchema.JsonSchema> convertToMcpSchema(
      JsonSchema schema, DrawioMcpTool annotation) {
    return Optional.ofNullable(schema)
        .flatMap(s -> s.toJsonString(mapper))
        .flatMap(schemaString -> convertSchemaString(schemaString, annotation))
        .or(
            () -> {
              LOG.error(
                  "Failed to generate schema for tool '{}'. Tool will be disabled.",
                  annotation.mcpName());
              return Optional.empty();
            });
  }

  @SuppressWarnings("unchecked")
  private Optional<McpSchema.JsonSchema> convertSchemaString(
      String schemaString, DrawioMcpTool annotation) {
    try {
      Map<String, Object> schemaMap = mapper.readValue(schemaString, MAP_TYPE);
      return Optional.of(
          new McpSchema.JsonSchema(
              (String) schemaMap.get("type"),
              (Map<String, Object>) schemaMap.get("properties"),
              (List<String>) schemaMap.get("required"),
              (Boolean) schemaMap.get("additionalProperties"),
              (Map<String, Object>) schemaMap.get("$defs"),
              (Map<String, Object>) schemaMap.get("definitions")));
    } catch (IOException | ClassCastException e) {
      LOG.error("Failed to convert schema for tool '{}': {}", annotation.mcpName(), e.getMessage(), e);
      return Optional.empty();
    }
  }
}
