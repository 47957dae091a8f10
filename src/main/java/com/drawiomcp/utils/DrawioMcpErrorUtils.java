package com.drawiomcp.utils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

import com.drawiomcp.models.DrawioMcpError;
import com.drawiomcp.models.DrawioMcpError.ErrorCode;
import com.drawiomcp.models.DrawioMcpError.ErrorContext;
import com.drawiomcp.models.DrawioMcpError.ErrorSuggestion;
import com.drawiomcp.models.DrawioMcpError.ErrorSuggestion.SuggestionType;

/**
 * Factory methods for the structured errors raised while loading and querying
 * diagrams. Each error carries context and, where possible, a suggestion the
 * caller can act on.
 */
public class DrawioMcpErrorUtils {

	private DrawioMcpErrorUtils() {
	}

	/**
	 * Creates a validation error for missing required arguments.
	 */
	public static DrawioMcpError missingRequiredArgument(String argumentName, String toolOperation,
			Map<String, Object> providedArgs) {

		ErrorContext context = new ErrorContext(
				toolOperation,
				"argument: " + argumentName,
				providedArgs,
				Map.of("missingArgument", argumentName),
				Map.of("required", true, "provided", false));

		ErrorSuggestion suggestion = new ErrorSuggestion(
				SuggestionType.FIX_REQUEST,
				"Add the required '" + argumentName + "' argument to your request",
				"Include the '" + argumentName + "' field with a valid value",
				List.of("\"" + argumentName + "\": \"example_value\""),
				null);

		return DrawioMcpError.validation()
				.errorCode(ErrorCode.MISSING_REQUIRED_ARGUMENT)
				.message("Missing required argument: '" + argumentName + "'")
				.context(context)
				.suggestions(List.of(suggestion))
				.build();
	}

	/**
	 * Creates a validation error for an argument of the wrong JSON type.
	 */
	public static DrawioMcpError invalidArgumentType(String argumentName, String expectedType,
			Object actualValue, String toolOperation) {

		String actualType = actualValue != null ? actualValue.getClass().getSimpleName() : "null";
		Map<String, Object> attempted = new LinkedHashMap<>();
		attempted.put("providedValue", String.valueOf(actualValue));
		attempted.put("providedType", actualType);

		return DrawioMcpError.validation()
				.errorCode(ErrorCode.INVALID_ARGUMENT_TYPE)
				.message("Invalid type for argument '" + argumentName + "'. Expected " + expectedType
						+ ", got " + actualType)
				.context(new ErrorContext(
						toolOperation,
						"argument: " + argumentName,
						null,
						attempted,
						Map.of("expectedType", expectedType, "actualType", actualType)))
				.suggestions(List.of(new ErrorSuggestion(
						SuggestionType.FIX_REQUEST,
						"Provide a " + expectedType + " value for '" + argumentName + "'",
						"Change the argument type to " + expectedType,
						null,
						null)))
				.build();
	}

	/**
	 * Creates a validation error for an integer outside its allowed range.
	 */
	public static DrawioMcpError argumentOutOfRange(String argumentName, long value, long min, long max,
			String toolOperation) {
		return DrawioMcpError.validation()
				.errorCode(ErrorCode.ARGUMENT_OUT_OF_RANGE)
				.message("Argument '" + argumentName + "' must be between " + min + " and " + max + ", got " + value)
				.context(new ErrorContext(
						toolOperation,
						"argument: " + argumentName,
						null,
						Map.of(argumentName, value),
						Map.of("minimum", min, "maximum", max)))
				.suggestions(List.of(new ErrorSuggestion(
						SuggestionType.FIX_REQUEST,
						"Use a value within the allowed range",
						"Set '" + argumentName + "' between " + min + " and " + max,
						List.of(String.valueOf(min), String.valueOf(max)),
						null)))
				.build();
	}

	/**
	 * Creates a resource not found error for a diagram source that does not exist.
	 */
	public static DrawioMcpError fileNotFound(String filePath, String toolOperation) {
		ErrorContext context = new ErrorContext(
				toolOperation,
				"file: " + filePath,
				Map.of("file_path", filePath),
				Map.of("requestedFile", filePath),
				Map.of("fileExists", false));

		ErrorSuggestion suggestion = new ErrorSuggestion(
				SuggestionType.FIX_REQUEST,
				"Check that the diagram path exists and is readable by the server",
				"Pass an absolute path to a .drawio or .xml file",
				List.of("/home/user/diagrams/architecture.drawio"),
				null);

		return DrawioMcpError.resourceNotFound()
				.errorCode(ErrorCode.FILE_NOT_FOUND)
				.message("Diagram file not found: " + filePath)
				.context(context)
				.suggestions(List.of(suggestion))
				.build();
	}

	/**
	 * Creates a resource error for a diagram source that exists but cannot be read.
	 */
	public static DrawioMcpError fileReadFailed(String filePath, String reason, String toolOperation) {
		return DrawioMcpError.resourceNotFound()
				.errorCode(ErrorCode.FILE_READ_FAILED)
				.message("Failed to read diagram file " + filePath + ": " + reason)
				.context(new ErrorContext(
						toolOperation,
						"file: " + filePath,
						Map.of("file_path", filePath),
						null,
						Map.of("reason", reason)))
				.build();
	}

	/**
	 * Creates a parsing error for a document that is not well-formed XML.
	 */
	public static DrawioMcpError malformedDocument(String sourceId, String reason, String toolOperation) {
		return DrawioMcpError.documentParsing()
				.errorCode(ErrorCode.MALFORMED_DOCUMENT)
				.message("Diagram document is not well-formed: " + reason)
				.context(new ErrorContext(
						toolOperation,
						"document: " + sourceId,
						null,
						null,
						Map.of("reason", reason)))
				.suggestions(List.of(new ErrorSuggestion(
						SuggestionType.FIX_REQUEST,
						"Re-export the diagram from draw.io",
						"Save the diagram as an uncompressed or compressed .drawio file",
						null,
						null)))
				.build();
	}

	/**
	 * Creates a parsing error for a well-formed document with an unexpected root element.
	 */
	public static DrawioMcpError unsupportedRootElement(String sourceId, String rootName, String toolOperation) {
		return DrawioMcpError.documentParsing()
				.errorCode(ErrorCode.UNSUPPORTED_ROOT_ELEMENT)
				.message("Unsupported root element <" + rootName + ">, expected <mxfile> or <mxGraphModel>")
				.context(new ErrorContext(
						toolOperation,
						"document: " + sourceId,
						null,
						Map.of("rootElement", rootName),
						Map.of("expected", List.of("mxfile", "mxGraphModel"))))
				.build();
	}

	/**
	 * Creates a resource not found error for a page filter that names no page,
	 * suggesting similarly named pages.
	 */
	public static DrawioMcpError pageNotFound(String pageName, List<String> availablePages, String toolOperation) {
		ErrorContext context = new ErrorContext(
				toolOperation,
				"page: " + pageName,
				Map.of("page_name", pageName),
				Map.of("requestedPage", pageName),
				Map.of("pageExists", false, "totalAvailable", availablePages.size()));

		List<ErrorSuggestion> suggestions = new ArrayList<>();
		suggestions.add(new ErrorSuggestion(
				SuggestionType.CHECK_RESOURCES,
				"Check the page names of the diagram",
				"Use the 'get_diagram_overview' tool to list every page",
				null,
				List.of("get_diagram_overview")));

		List<String> similarNames = findSimilarNames(pageName, availablePages, 3);
		if (!similarNames.isEmpty()) {
			suggestions.add(new ErrorSuggestion(
					SuggestionType.SIMILAR_VALUES,
					"Similar page names found",
					"Try one of these page names",
					similarNames,
					null));
		}

		return DrawioMcpError.resourceNotFound()
				.errorCode(ErrorCode.PAGE_NOT_FOUND)
				.message("Page not found: " + pageName)
				.context(context)
				.suggestions(suggestions)
				.relatedResources(availablePages)
				.build();
	}

	/**
	 * Creates a validation error for an operation name the query surface does not know.
	 */
	public static DrawioMcpError unknownOperation(String operation, List<String> knownOperations,
			String toolOperation) {
		return DrawioMcpError.validation()
				.errorCode(ErrorCode.UNKNOWN_OPERATION)
				.message("Unknown operation: '" + operation + "'. Must be one of: " + String.join(", ", knownOperations))
				.context(new ErrorContext(
						toolOperation,
						"operation: " + operation,
						null,
						Map.of("operation", String.valueOf(operation)),
						Map.of("validOperations", knownOperations)))
				.suggestions(List.of(new ErrorSuggestion(
						SuggestionType.FIX_REQUEST,
						"Use one of the supported operations",
						"Set 'operation' to a supported value",
						knownOperations,
						null)))
				.build();
	}

	static List<String> findSimilarNames(String target, List<String> candidates, int maxResults) {
		if (target == null || candidates == null || candidates.isEmpty()) {
			return List.of();
		}

		String lowerTarget = target.toLowerCase(Locale.ROOT);

		return candidates.stream()
				.filter(candidate -> candidate != null)
				.filter(candidate -> {
					String lowerCandidate = candidate.toLowerCase(Locale.ROOT);
					return lowerCandidate.contains(lowerTarget)
							|| lowerTarget.contains(lowerCandidate)
							|| levenshteinDistance(lowerTarget, lowerCandidate) <= 3;
				})
				.limit(maxResults)
				.collect(Collectors.toList());
	}

	private static int levenshteinDistance(String s1, String s2) {
		int len1 = s1.length();
		int len2 = s2.length();

		int[][] dp = new int[len1 + 1][len2 + 1];

		for (int i = 0; i <= len1; i++) {
			dp[i][0] = i;
		}
		for (int j = 0; j <= len2; j++) {
			dp[0][j] = j;
		}

		for (int i = 1; i <= len1; i++) {
			for (int j = 1; j <= len2; j++) {
				if (s1.charAt(i - 1) == s2.charAt(j - 1)) {
					dp[i][j] = dp[i - 1][j - 1];
				} else {
					dp[i][j] = 1 + Math.min(dp[i - 1][j], Math.min(dp[i][j - 1], dp[i - 1][j - 1]));
				}
			}
		}

		return dp[len1][len2];
	}
}
