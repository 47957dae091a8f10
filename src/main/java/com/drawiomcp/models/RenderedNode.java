package com.drawiomcp.models;

import java.util.List;

import com.drawiomcp.diagram.ShapeType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A node of the structural render. Edge children appear as
 * {@code connections} after the non-edge {@code children}.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({ "id", "text", "type", "children", "connections" })
public record RenderedNode(
		@JsonProperty("id") String id,
		@JsonProperty("text") String text,
		@JsonProperty("type") ShapeType type,
		@JsonProperty("children") List<RenderedNode> children,
		@JsonProperty("connections") List<RelationshipInfo> connections) {

	public RenderedNode {
		children = List.copyOf(children);
		connections = List.copyOf(connections);
	}
}
