package com.drawiomcp.diagram;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Shape categories assigned to vertices by {@link StyleClassifier}.
 */
public enum ShapeType {
	SWIMLANE("swimlane"),
	DECISION("decision"),
	START_END("start-end"),
	ELLIPSE("ellipse"),
	DATABASE("database"),
	CLOUD("cloud"),
	PROCESS("process"),
	BPMN("bpmn"),
	ICON("icon"),
	HEXAGON("hexagon"),
	PARALLELOGRAM("parallelogram"),
	DOCUMENT("document"),
	CALLOUT("callout"),
	NOTE("note"),
	TEXT("text"),
	GROUP("group"),
	ROUNDED_RECT("rounded-rect"),
	SHAPE("shape");

	private final String label;

	ShapeType(String label) {
		this.label = label;
	}

	@JsonValue
	public String getLabel() {
		return label;
	}

	/** Swimlanes and process shapes are reported by the class listing. */
	public boolean isClassLike() {
		return this == SWIMLANE || this == PROCESS;
	}

	@Override
	public String toString() {
		return label;
	}
}
