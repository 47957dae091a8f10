package com.drawiomcp.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Standard response envelope for MCP tool responses.
 *
 * @param <T> The type of data contained in the response
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"success", "tool", "operation", "data", "duration_ms", "error"})
public class McpResponse<T> {

  private final String tool;
  private final String operation;
  private final T data;
  private final Long durationMs;
  private final DrawioMcpError error;

  private McpResponse(Builder<T> builder) {
    this.tool = builder.tool;
    this.operation = builder.operation;
    this.data = builder.data;
    this.durationMs = builder.durationMs;
    this.error = builder.error;
  }

  /** Checks if the response is successful (has no error). */
  @JsonProperty("success")
  public boolean isSuccess() {
    return error == null;
  }

  @JsonProperty("tool")
  public String getTool() {
    return tool;
  }

  @JsonProperty("operation")
  public String getOperation() {
    return operation;
  }

  @JsonProperty("data")
  public T getData() {
    return data;
  }

  @JsonProperty("duration_ms")
  public Long getDurationMs() {
    return durationMs;
  }

  @JsonProperty("error")
  public DrawioMcpError getError() {
    return error;
  }

  public static <T> McpResponse<T> success(String tool, String operation, T data) {
    return new Builder<T>().tool(tool).operation(operation).data(data).build();
  }

  public static <T> McpResponse<T> success(String tool, String operation, T data, long ms) {
    return new Builder<T>().tool(tool).operation(operation).data(data).durationMs(ms).build();
  }

  public static <T> McpResponse<T> error(String tool, String operation, DrawioMcpError err) {
    return new Builder<T>().tool(tool).operation(operation).error(err).build();
  }

  public static <T> McpResponse<T> error(String tool, String operation, DrawioMcpError err, long ms) {
    return new Builder<T>().tool(tool).operation(operation).error(err).durationMs(ms).build();
  }

  public static class Builder<T> {
    private String tool;
    private String operation;
    private T data;
    private Long durationMs;
    private DrawioMcpError error;

    public Builder<T> tool(String tool) {
      this.tool = tool;
      return this;
    }

    public Builder<T> operation(String operation) {
      this.operation = operation;
      return this;
    }

    public Builder<T> data(T data) {
      this.data = data;
      return this;
    }

    public Builder<T> durationMs(Long ms) {
      this.durationMs = ms;
      return this;
    }

    public Builder<T> error(DrawioMcpError error) {
      this.error = error;
      return this;
    }

    public McpResponse<T> build() {
      return new McpResponse<>(this);
    }
  }
}
