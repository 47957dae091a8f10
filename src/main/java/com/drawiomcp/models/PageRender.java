package com.drawiomcp.models;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Hierarchical render of one page: the containment tree, every connection,
 * the orphan annotations and a plain-text outline of all three.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "page", "index", "cells", "decompression_failure", "tree", "connections", "orphans",
		"outline" })
public record PageRender(
		@JsonProperty("page") String page,
		@JsonProperty("index") int index,
		@JsonProperty("cells") int cells,
		@JsonProperty("decompression_failure") String decompressionFailure,
		@JsonProperty("tree") List<RenderedNode> tree,
		@JsonProperty("connections") List<RelationshipInfo> connections,
		@JsonProperty("orphans") List<OrphanInfo> orphans,
		@JsonProperty("outline") List<String> outline) {

	public PageRender {
		tree = List.copyOf(tree);
		connections = List.copyOf(connections);
		orphans = List.copyOf(orphans);
		outline = List.copyOf(outline);
	}
}
