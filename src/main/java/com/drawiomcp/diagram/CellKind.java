package com.drawiomcp.diagram;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a cell was encoded in the source document.
 */
public enum CellKind {
	/** A plain {@code mxCell} element. */
	DIRECT("direct"),
	/** A {@code UserObject} or {@code object} element wrapping one {@code mxCell}. */
	WRAPPED("wrapped");

	private final String label;

	CellKind(String label) {
		this.label = label;
	}

	@JsonValue
	public String getLabel() {
		return label;
	}
}
