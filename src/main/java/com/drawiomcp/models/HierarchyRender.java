package com.drawiomcp.models;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HierarchyRender(
		@JsonProperty("file_path") String filePath,
		@JsonProperty("page_filter") String pageFilter,
		@JsonProperty("pages") List<PageRender> pages) {

	public HierarchyRender {
		pages = List.copyOf(pages);
	}
}
