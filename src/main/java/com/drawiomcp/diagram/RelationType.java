package com.drawiomcp.diagram;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Relationship categories assigned to edges by {@link StyleClassifier}.
 */
public enum RelationType {
	DEPENDENCY("dependency"),
	INHERITANCE("inheritance"),
	FLOW("flow"),
	COMPOSITION("composition"),
	ASYNC_MESSAGE("async-message"),
	AGGREGATION("aggregation"),
	ASSOCIATION("association");

	private final String label;

	RelationType(String label) {
		this.label = label;
	}

	@JsonValue
	public String getLabel() {
		return label;
	}

	@Override
	public String toString() {
		return label;
	}
}
