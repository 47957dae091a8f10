package com.drawiomcp.query;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The read operations of {@link DiagramQueryService}, addressable by name.
 * Each operation also answers to the name of the MCP tool exposing it.
 */
public enum DiagramOperation {
	OVERVIEW("overview", "get_diagram_overview"),
	COMPONENTS("components", "parse_drawio"),
	TEXT_INVENTORY("text_inventory", "extract_text_content"),
	CLASSES("classes", "extract_classes"),
	RELATIONSHIPS("relationships", "extract_relationships"),
	RENDER("render", "render_diagram_hierarchy");

	private final String operationName;
	private final String toolName;

	DiagramOperation(String operationName, String toolName) {
		this.operationName = operationName;
		this.toolName = toolName;
	}

	public String getOperationName() {
		return operationName;
	}

	public String getToolName() {
		return toolName;
	}

	/**
	 * Looks an operation up by operation or tool name, ignoring case and
	 * surrounding whitespace.
	 */
	public static Optional<DiagramOperation> fromName(String name) {
		if (name == null) {
			return Optional.empty();
		}
		String normalized = name.trim().toLowerCase(Locale.ROOT);
		return Arrays.stream(values())
				.filter(op -> op.operationName.equals(normalized) || op.toolName.equals(normalized))
				.findFirst();
	}

	public static List<String> operationNames() {
		return Arrays.stream(values()).map(DiagramOperation::getOperationName).collect(Collectors.toList());
	}
}
