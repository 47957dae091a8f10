package com.drawiomcp.models;

import java.util.List;

import com.drawiomcp.diagram.ShapeType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A swimlane or process shape read as a class: the first label line is the
 * name, the remaining lines and the texts of its children are members.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClassInfo(
		@JsonProperty("id") String id,
		@JsonProperty("name") String name,
		@JsonProperty("members") List<String> members,
		@JsonProperty("shape_type") ShapeType shapeType,
		@JsonProperty("page") String page) {

	public ClassInfo {
		members = List.copyOf(members);
	}
}
