package com.drawiomcp.models;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A listing grouped by page in document order, with an explicit marker when
 * the result cap cut it short.
 *
 * @param <T> entry type
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "page_filter", "total", "returned", "limit", "truncated", "pages" })
public class GroupedListing<T> {

	private final String pageFilter;
	private final int total;
	private final Integer limit;
	private final List<PageEntries<T>> pages;

	public GroupedListing(String pageFilter, int total, Integer limit, List<PageEntries<T>> pages) {
		this.pageFilter = pageFilter;
		this.total = total;
		this.limit = limit;
		this.pages = List.copyOf(pages);
	}

	@JsonProperty("page_filter")
	public String getPageFilter() {
		return pageFilter;
	}

	@JsonProperty("total")
	public int getTotal() {
		return total;
	}

	@JsonProperty("returned")
	public int getReturned() {
		return pages.stream().mapToInt(page -> page.items().size()).sum();
	}

	/** The cap applied, {@code null} when the listing is uncapped. */
	@JsonProperty("limit")
	public Integer getLimit() {
		return limit;
	}

	@JsonProperty("truncated")
	public boolean isTruncated() {
		return getReturned() < total;
	}

	@JsonProperty("pages")
	public List<PageEntries<T>> getPages() {
		return pages;
	}
}
