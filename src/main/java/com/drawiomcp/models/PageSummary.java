package com.drawiomcp.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-page line of the diagram overview.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PageSummary(
		@JsonProperty("index") int index,
		@JsonProperty("name") String name,
		@JsonProperty("cells") int cells,
		@JsonProperty("compressed") boolean compressed,
		@JsonProperty("decompression_failure") String decompressionFailure) {
}
