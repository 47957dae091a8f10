package com.drawiomcp.models;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Structured error information returned by drawio MCP tools.
 * Carries the error category, a stable code, context about the attempted
 * operation, suggestions for the caller and optional debug information.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "error_type", "error_code", "message", "context", "suggestions", "related_resources", "debug_info" })
public class DrawioMcpError {

	private final ErrorType errorType;
	private final String errorCode;
	private final String message;
	private final ErrorContext context;
	private final List<ErrorSuggestion> suggestions;
	private final List<String> relatedResources;
	private final ErrorDebugInfo debugInfo;

	/**
	 * Categories of errors that can occur while serving a diagram query.
	 */
	public enum ErrorType {
		/** Invalid arguments, wrong types, missing required fields, unknown operations */
		VALIDATION,

		/** Diagram source or page could not be found or read */
		RESOURCE_NOT_FOUND,

		/** The diagram document is not well-formed or has an unexpected shape */
		DOCUMENT_PARSING,

		/** Unexpected errors, system failures */
		INTERNAL
	}

	/**
	 * Specific error subcategories for programmatic handling.
	 */
	public enum ErrorCode {
		// Validation errors
		MISSING_REQUIRED_ARGUMENT("VAL_001"),
		INVALID_ARGUMENT_TYPE("VAL_002"),
		INVALID_ARGUMENT_VALUE("VAL_003"),
		ARGUMENT_OUT_OF_RANGE("VAL_004"),
		UNKNOWN_OPERATION("VAL_005"),

		// Resource not found errors
		FILE_NOT_FOUND("RNF_001"),
		FILE_READ_FAILED("RNF_002"),
		PAGE_NOT_FOUND("RNF_003"),

		// Document parsing errors
		MALFORMED_DOCUMENT("DOC_001"),
		UNSUPPORTED_ROOT_ELEMENT("DOC_002"),

		// Internal errors
		SERIALIZATION_FAILED("INT_001"),
		UNEXPECTED_ERROR("INT_002"),
		CONFIGURATION_ERROR("INT_003");

		private final String code;

		ErrorCode(String code) {
			this.code = code;
		}

		public String getCode() {
			return code;
		}
	}

	/**
	 * Context information about what was being attempted when the error occurred.
	 */
	@JsonInclude(JsonInclude.Include.NON_NULL)
	@JsonPropertyOrder({ "operation", "target_resource", "arguments", "attempted_values", "validation_details" })
	public static class ErrorContext {
		private final String operation;
		private final String targetResource;
		private final Map<String, Object> arguments;
		private final Map<String, Object> attemptedValues;
		private final Map<String, Object> validationDetails;

		public ErrorContext(String operation, String targetResource, Map<String, Object> arguments,
				Map<String, Object> attemptedValues, Map<String, Object> validationDetails) {
			this.operation = operation;
			this.targetResource = targetResource;
			this.arguments = arguments;
			this.attemptedValues = attemptedValues;
			this.validationDetails = validationDetails;
		}

		@JsonProperty("operation")
		public String getOperation() {
			return operation;
		}

		@JsonProperty("target_resource")
		public String getTargetResource() {
			return targetResource;
		}

		@JsonProperty("arguments")
		public Map<String, Object> getArguments() {
			return arguments;
		}

		@JsonProperty("attempted_values")
		public Map<String, Object> getAttemptedValues() {
			return attemptedValues;
		}

		@JsonProperty("validation_details")
		public Map<String, Object> getValidationDetails() {
			return validationDetails;
		}
	}

	/**
	 * Suggestion for how to fix the error or what to try next.
	 */
	@JsonInclude(JsonInclude.Include.NON_NULL)
	@JsonPropertyOrder({ "type", "message", "action", "examples", "related_tools" })
	public static class ErrorSuggestion {
		private final SuggestionType type;
		private final String message;
		private final String action;
		private final List<String> examples;
		private final List<String> relatedTools;

		public enum SuggestionType {
			/** Fix the current request */
			FIX_REQUEST,
			/** Check available resources */
			CHECK_RESOURCES,
			/** Similar/alternative values */
			SIMILAR_VALUES
		}

		public ErrorSuggestion(SuggestionType type, String message, String action,
				List<String> examples, List<String> relatedTools) {
			this.type = type;
			this.message = message;
			this.action = action;
			this.examples = examples;
			this.relatedTools = relatedTools;
		}

		@JsonProperty("type")
		public SuggestionType getType() {
			return type;
		}

		@JsonProperty("message")
		public String getMessage() {
			return message;
		}

		@JsonProperty("action")
		public String getAction() {
			return action;
		}

		@JsonProperty("examples")
		public List<String> getExamples() {
			return examples;
		}

		@JsonProperty("related_tools")
		public List<String> getRelatedTools() {
			return relatedTools;
		}
	}

	/**
	 * Debug information for troubleshooting errors.
	 */
	@JsonInclude(JsonInclude.Include.NON_NULL)
	@JsonPropertyOrder({ "stack_trace", "tool_class", "timestamp", "additional_info" })
	public static class ErrorDebugInfo {
		private final String stackTrace;
		private final String toolClass;
		private final String timestamp;
		private final Map<String, Object> additionalInfo;

		public ErrorDebugInfo(String stackTrace, String toolClass, String timestamp,
				Map<String, Object> additionalInfo) {
			this.stackTrace = stackTrace;
			this.toolClass = toolClass;
			this.timestamp = timestamp;
			this.additionalInfo = additionalInfo;
		}

		@JsonProperty("stack_trace")
		public String getStackTrace() {
			return stackTrace;
		}

		@JsonProperty("tool_class")
		public String getToolClass() {
			return toolClass;
		}

		@JsonProperty("timestamp")
		public String getTimestamp() {
			return timestamp;
		}

		@JsonProperty("additional_info")
		public Map<String, Object> getAdditionalInfo() {
			return additionalInfo;
		}
	}

	public DrawioMcpError(ErrorType errorType, String errorCode, String message, ErrorContext context,
			List<ErrorSuggestion> suggestions, List<String> relatedResources, ErrorDebugInfo debugInfo) {
		this.errorType = errorType;
		this.errorCode = errorCode;
		this.message = message;
		this.context = context;
		this.suggestions = suggestions;
		this.relatedResources = relatedResources;
		this.debugInfo = debugInfo;
	}

	@JsonProperty("error_type")
	public ErrorType getErrorType() {
		return errorType;
	}

	@JsonProperty("error_code")
	public String getErrorCode() {
		return errorCode;
	}

	@JsonProperty("message")
	public String getMessage() {
		return message;
	}

	@JsonProperty("context")
	public ErrorContext getContext() {
		return context;
	}

	@JsonProperty("suggestions")
	public List<ErrorSuggestion> getSuggestions() {
		return suggestions;
	}

	@JsonProperty("related_resources")
	public List<String> getRelatedResources() {
		return relatedResources;
	}

	@JsonProperty("debug_info")
	public ErrorDebugInfo getDebugInfo() {
		return debugInfo;
	}

	public static class Builder {
		private ErrorType errorType;
		private ErrorCode errorCode;
		private String message;
		private ErrorContext context;
		private List<ErrorSuggestion> suggestions;
		private List<String> relatedResources;
		private ErrorDebugInfo debugInfo;

		public Builder errorType(ErrorType errorType) {
			this.errorType = errorType;
			return this;
		}

		public Builder errorCode(ErrorCode errorCode) {
			this.errorCode = errorCode;
			return this;
		}

		public Builder message(String message) {
			this.message = message;
			return this;
		}

		public Builder context(ErrorContext context) {
			this.context = context;
			return this;
		}

		public Builder suggestions(List<ErrorSuggestion> suggestions) {
			this.suggestions = suggestions;
			return this;
		}

		public Builder relatedResources(List<String> relatedResources) {
			this.relatedResources = relatedResources;
			return this;
		}

		public Builder debugInfo(ErrorDebugInfo debugInfo) {
			this.debugInfo = debugInfo;
			return this;
		}

		public DrawioMcpError build() {
			return new DrawioMcpError(
					errorType,
					errorCode != null ? errorCode.getCode() : null,
					message,
					context,
					suggestions,
					relatedResources,
					debugInfo);
		}
	}

	public static Builder validation() {
		return new Builder().errorType(ErrorType.VALIDATION);
	}

	public static Builder resourceNotFound() {
		return new Builder().errorType(ErrorType.RESOURCE_NOT_FOUND);
	}

	public static Builder documentParsing() {
		return new Builder().errorType(ErrorType.DOCUMENT_PARSING);
	}

	public static Builder internal() {
		return new Builder().errorType(ErrorType.INTERNAL);
	}

	/**
	 * Shorthand for an invalid argument value.
	 */
	public static DrawioMcpError invalid(String argumentName, Object providedValue, String requirement) {
		return validation()
				.errorCode(ErrorCode.INVALID_ARGUMENT_VALUE)
				.message("Invalid value for '" + argumentName + "': " + requirement)
				.context(new ErrorContext(
						null,
						"argument: " + argumentName,
						null,
						providedValue != null ? Map.of(argumentName, providedValue) : null,
						Map.of("requirement", requirement)))
				.build();
	}

	/**
	 * Shorthand for an unexpected internal error with only a message.
	 */
	public static DrawioMcpError error(String message) {
		return internal()
				.errorCode(ErrorCode.UNEXPECTED_ERROR)
				.message(message)
				.build();
	}
}
