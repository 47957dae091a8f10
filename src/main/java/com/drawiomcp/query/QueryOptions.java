package com.drawiomcp.query;

/**
 * Per-request filters shared by every query.
 *
 * @param pageName only this page when non-null
 * @param limit    result cap when non-null; capped listings fall back to the
 *                 configured default otherwise
 */
public record QueryOptions(String pageName, Integer limit) {

	private static final QueryOptions ALL = new QueryOptions(null, null);

	public QueryOptions {
		if (limit != null && limit < 1) {
			throw new IllegalArgumentException("limit must be at least 1, got " + limit);
		}
	}

	public static QueryOptions all() {
		return ALL;
	}

	public static QueryOptions page(String pageName) {
		return new QueryOptions(pageName, null);
	}
}
