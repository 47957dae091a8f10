package com.drawiomcp.models;

import java.util.List;

import com.drawiomcp.diagram.ShapeType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A floating annotation: a textual node inside a container that shows no text
 * of its own and holds no other textual child. The orphan is left out of the
 * tree, so its own subtree is carried here.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({ "id", "text", "type", "parent_id", "children" })
public record OrphanInfo(
		@JsonProperty("id") String id,
		@JsonProperty("text") String text,
		@JsonProperty("type") ShapeType type,
		@JsonProperty("parent_id") String parentId,
		@JsonProperty("children") List<RenderedNode> children) {

	public OrphanInfo {
		children = List.copyOf(children);
	}
}
