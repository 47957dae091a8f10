package com.drawiomcp.models;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * The entries of one page in a grouped listing. {@code total} counts every
 * match on the page, {@code items} only those that fit under the cap.
 *
 * @param <T> entry type
 */
@JsonPropertyOrder({ "page", "total", "items" })
public record PageEntries<T>(
		@JsonProperty("page") String page,
		@JsonProperty("total") int total,
		@JsonProperty("items") List<T> items) {

	public PageEntries {
		items = List.copyOf(items);
	}
}
