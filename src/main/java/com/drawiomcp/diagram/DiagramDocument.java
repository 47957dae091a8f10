package com.drawiomcp.diagram;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A loaded diagram file. Built once per request and never modified.
 */
public final class DiagramDocument {

	private final String sourceId;
	private final List<DiagramPage> pages;

	public DiagramDocument(String sourceId, List<DiagramPage> pages) {
		this.sourceId = sourceId;
		this.pages = Collections.unmodifiableList(pages);
	}

	/** Where the document was read from, used in error context. */
	public String getSourceId() {
		return sourceId;
	}

	public List<DiagramPage> getPages() {
		return pages;
	}

	public List<String> getPageNames() {
		return pages.stream().map(DiagramPage::getDisplayName).collect(Collectors.toList());
	}

	/** First page whose display name equals {@code pageName}. */
	public Optional<DiagramPage> findPage(String pageName) {
		return pages.stream().filter(page -> page.getDisplayName().equals(pageName)).findFirst();
	}
}
