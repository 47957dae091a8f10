package com.drawiomcp.diagram;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One page of a diagram: its cells in document order and the containment
 * tree built over them.
 */
public final class DiagramPage {

	static final String UNNAMED = "Unnamed";

	/** Endpoint names taken from node text are cut to this length. */
	public static final int ENDPOINT_NAME_LENGTH = 60;

	private final String name;
	private final int index;
	private final boolean compressed;
	private final String decompressionFailure;
	private final List<DiagramCell> cells;
	private final List<DiagramNode> nodes;
	private final Map<String, DiagramNode> nodesById;
	private final List<DiagramNode> topLevel;

	DiagramPage(String name, int index, boolean compressed, String decompressionFailure, List<DiagramCell> cells,
			List<DiagramNode> nodes, Map<String, DiagramNode> nodesById, List<DiagramNode> topLevel) {
		this.name = name;
		this.index = index;
		this.compressed = compressed;
		this.decompressionFailure = decompressionFailure;
		this.cells = Collections.unmodifiableList(cells);
		this.nodes = Collections.unmodifiableList(nodes);
		this.nodesById = Collections.unmodifiableMap(nodesById);
		this.topLevel = Collections.unmodifiableList(topLevel);
	}

	/** The {@code name} attribute of the page, {@code null} when absent. */
	public String getName() {
		return name;
	}

	public String getDisplayName() {
		return name != null && !name.isEmpty() ? name : UNNAMED;
	}

	public int getIndex() {
		return index;
	}

	/** True when the page content was stored as a compressed payload. */
	public boolean isCompressed() {
		return compressed;
	}

	/** Why the compressed payload could not be read, or {@code null}. */
	public String getDecompressionFailure() {
		return decompressionFailure;
	}

	public List<DiagramCell> getCells() {
		return cells;
	}

	/** Every node in document order, including cells without an id. */
	public List<DiagramNode> getNodes() {
		return nodes;
	}

	/** Nodes by id; the first cell carrying an id owns it. Canonical roots are excluded. */
	public Map<String, DiagramNode> getNodesById() {
		return nodesById;
	}

	public DiagramNode findNode(String id) {
		return id == null ? null : nodesById.get(id);
	}

	public List<DiagramNode> getTopLevel() {
		return topLevel;
	}

	/**
	 * Display text for an edge endpoint: the referenced node's text cut to
	 * {@link #ENDPOINT_NAME_LENGTH}, else the raw id, else {@code ?} when the
	 * endpoint is absent.
	 */
	public String resolveEndpoint(String id) {
		if (id == null) {
			return "?";
		}
		DiagramNode node = nodesById.get(id);
		return node != null && node.hasText() ? HtmlText.truncate(node.getText(), ENDPOINT_NAME_LENGTH) : id;
	}
}
