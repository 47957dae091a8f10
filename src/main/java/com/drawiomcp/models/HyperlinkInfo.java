package com.drawiomcp.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A cell carrying a hyperlink. {@code text} is cut to 60 characters.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HyperlinkInfo(
		@JsonProperty("id") String id,
		@JsonProperty("page") String page,
		@JsonProperty("text") String text,
		@JsonProperty("link") String link) {
}
