package com.drawiomcp.diagram;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a page's containment tree from its cells.
 * <p>
 * Every cell with an id lands either under a resolvable parent or at top
 * level, so {@code topLevel + attached == cells with an id}. Cells without an
 * id stay in the node list only. The builder never walks the tree, so a
 * malformed parent cycle cannot stall it.
 */
public final class HierarchyBuilder {

	/** The root cell and the default layer; neither is ever a real parent. */
	public static final Set<String> CANONICAL_ROOTS = Set.of("0", "1");

	public DiagramPage build(String name, int index, boolean compressed, String decompressionFailure,
			List<DiagramCell> cells) {
		List<DiagramNode> nodes = new ArrayList<>(cells.size());
		Map<String, DiagramNode> byId = new LinkedHashMap<>();
		for (DiagramCell cell : cells) {
			DiagramNode node = new DiagramNode(cell);
			nodes.add(node);
			if (cell.hasId() && !CANONICAL_ROOTS.contains(cell.getId())) {
				byId.putIfAbsent(cell.getId(), node);
			}
		}

		List<DiagramNode> topLevel = new ArrayList<>();
		for (DiagramNode node : nodes) {
			if (!node.getCell().hasId()) {
				continue;
			}
			String parentId = node.getCell().getParentId();
			DiagramNode parent = parentId == null || CANONICAL_ROOTS.contains(parentId) ? null : byId.get(parentId);
			if (parent != null) {
				parent.addChild(node);
			} else {
				topLevel.add(node);
			}
		}
		return new DiagramPage(name, index, compressed, decompressionFailure, cells, nodes, byId, topLevel);
	}
}
