package com.drawiomcp.models;

import java.util.Map;

import com.drawiomcp.diagram.ShapeType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A non-edge cell with visible text.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ComponentInfo(
		@JsonProperty("id") String id,
		@JsonProperty("text") String text,
		@JsonProperty("type") ShapeType type,
		@JsonProperty("has_link") boolean hasLink,
		@JsonProperty("link") String link,
		@JsonProperty("tooltip") String tooltip,
		@JsonProperty("parent_id") String parentId,
		@JsonProperty("properties") Map<String, String> properties) {
}
