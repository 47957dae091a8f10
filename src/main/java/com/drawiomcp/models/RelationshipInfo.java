package com.drawiomcp.models;

import com.drawiomcp.diagram.RelationType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An edge with both endpoints resolved to display text. {@code source} and
 * {@code target} hold the raw ids, or {@code ?} when the endpoint is absent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RelationshipInfo(
		@JsonProperty("id") String id,
		@JsonProperty("source") String source,
		@JsonProperty("target") String target,
		@JsonProperty("source_name") String sourceName,
		@JsonProperty("target_name") String targetName,
		@JsonProperty("label") String label,
		@JsonProperty("type") RelationType type,
		@JsonProperty("page") String page) {
}
