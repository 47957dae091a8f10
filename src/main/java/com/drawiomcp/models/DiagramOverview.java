package com.drawiomcp.models;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Aggregate statistics of a diagram file.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "file_path", "page_filter", "total_pages", "pages", "total_cells", "cells_with_text",
		"total_connections", "swimlanes", "decisions", "hyperlinks", "decompression_failures" })
public class DiagramOverview {

	private final String filePath;
	private final String pageFilter;
	private final List<PageSummary> pages;
	private final int totalCells;
	private final int cellsWithText;
	private final int totalConnections;
	private final int swimlanes;
	private final int decisions;
	private final List<HyperlinkInfo> hyperlinks;
	private final List<PageSummary> decompressionFailures;

	public DiagramOverview(String filePath, String pageFilter, List<PageSummary> pages, int totalCells,
			int cellsWithText, int totalConnections, int swimlanes, int decisions, List<HyperlinkInfo> hyperlinks,
			List<PageSummary> decompressionFailures) {
		this.filePath = filePath;
		this.pageFilter = pageFilter;
		this.pages = List.copyOf(pages);
		this.totalCells = totalCells;
		this.cellsWithText = cellsWithText;
		this.totalConnections = totalConnections;
		this.swimlanes = swimlanes;
		this.decisions = decisions;
		this.hyperlinks = List.copyOf(hyperlinks);
		this.decompressionFailures = List.copyOf(decompressionFailures);
	}

	@JsonProperty("file_path")
	public String getFilePath() {
		return filePath;
	}

	@JsonProperty("page_filter")
	public String getPageFilter() {
		return pageFilter;
	}

	@JsonProperty("total_pages")
	public int getTotalPages() {
		return pages.size();
	}

	@JsonProperty("pages")
	public List<PageSummary> getPages() {
		return pages;
	}

	@JsonProperty("total_cells")
	public int getTotalCells() {
		return totalCells;
	}

	@JsonProperty("cells_with_text")
	public int getCellsWithText() {
		return cellsWithText;
	}

	@JsonProperty("total_connections")
	public int getTotalConnections() {
		return totalConnections;
	}

	@JsonProperty("swimlanes")
	public int getSwimlanes() {
		return swimlanes;
	}

	@JsonProperty("decisions")
	public int getDecisions() {
		return decisions;
	}

	@JsonProperty("hyperlinks")
	public List<HyperlinkInfo> getHyperlinks() {
		return hyperlinks;
	}

	/** Pages whose compressed payload could not be decoded. */
	@JsonProperty("decompression_failures")
	public List<PageSummary> getDecompressionFailures() {
		return decompressionFailures;
	}
}
