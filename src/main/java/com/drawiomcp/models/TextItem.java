package com.drawiomcp.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TextItem(
		@JsonProperty("id") String id,
		@JsonProperty("text") String text,
		@JsonProperty("is_edge") boolean isEdge) {
}
