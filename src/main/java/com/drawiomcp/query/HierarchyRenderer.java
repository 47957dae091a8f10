package com.drawiomcp.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.drawiomcp.diagram.DiagramNode;
import com.drawiomcp.diagram.DiagramPage;
import com.drawiomcp.diagram.HierarchyBuilder;
import com.drawiomcp.models.OrphanInfo;
import com.drawiomcp.models.PageRender;
import com.drawiomcp.models.RelationshipInfo;
import com.drawiomcp.models.RenderedNode;

/**
 * Renders one page as a containment tree, a connection section and an orphan
 * section.
 * <p>
 * Nodes without text are transparent: their children take their place.
 * Orphans are cut out of the tree and listed with their own subtrees. Every
 * descent carries a visited set and a depth cap because parent links come
 * from untrusted input.
 */
final class HierarchyRenderer {

	private static final Logger LOG = LoggerFactory.getLogger(HierarchyRenderer.class);

	private static final String INDENT = "  ";

	private final int maxDepth;

	HierarchyRenderer(int maxDepth) {
		this.maxDepth = maxDepth;
	}

	PageRender render(DiagramPage page) {
		Set<DiagramNode> orphans = findOrphans(page);
		Set<DiagramNode> visited = Collections.newSetFromMap(new IdentityHashMap<>());

		List<RenderedNode> tree = new ArrayList<>();
		for (DiagramNode node : page.getTopLevel()) {
			if (!node.isEdge()) {
				tree.addAll(renderNode(page, node, 0, visited, orphans));
			}
		}

		List<RelationshipInfo> connections = new ArrayList<>();
		for (DiagramNode node : page.getNodes()) {
			if (node.isEdge()) {
				connections.add(Projections.relationship(page, node));
			}
		}

		List<OrphanInfo> orphanInfos = new ArrayList<>();
		for (DiagramNode orphan : orphans) {
			List<RenderedNode> subtree = new ArrayList<>();
			if (visited.add(orphan)) {
				for (DiagramNode child : orphan.getChildren()) {
					if (!child.isEdge()) {
						subtree.addAll(renderNode(page, child, 1, visited, orphans));
					}
				}
			}
			orphanInfos.add(new OrphanInfo(orphan.getId(), orphan.getText(), orphan.getShapeType(),
					orphan.getCell().getParentId(), subtree));
		}

		return new PageRender(page.getDisplayName(), page.getIndex(), page.getCells().size(),
				page.getDecompressionFailure(), tree, connections, orphanInfos,
				outline(tree, connections, orphanInfos));
	}

	/**
	 * Textual nodes, in document order, whose real parent has no text and no
	 * other textual child.
	 */
	static Set<DiagramNode> findOrphans(DiagramPage page) {
		Set<DiagramNode> orphans = new LinkedHashSet<>();
		for (DiagramNode node : page.getNodes()) {
			if (node.isEdge() || !node.hasText() || !node.getCell().hasId()) {
				continue;
			}
			String parentId = node.getCell().getParentId();
			if (parentId == null || HierarchyBuilder.CANONICAL_ROOTS.contains(parentId)) {
				continue;
			}
			DiagramNode parent = page.findNode(parentId);
			if (parent == null || parent == node || parent.hasText()) {
				continue;
			}
			boolean hasTextualSibling = parent.getChildren().stream()
					.anyMatch(child -> child != node && child.hasText());
			if (!hasTextualSibling) {
				orphans.add(node);
			}
		}
		return orphans;
	}

	private List<RenderedNode> renderNode(DiagramPage page, DiagramNode node, int depth, Set<DiagramNode> visited,
			Set<DiagramNode> orphans) {
		if (orphans.contains(node)) {
			return List.of();
		}
		if (depth > maxDepth) {
			LOG.debug("Render depth cap {} reached at node {} on page '{}'", maxDepth, node.getId(),
					page.getDisplayName());
			return List.of();
		}
		if (!visited.add(node)) {
			return List.of();
		}

		List<RenderedNode> children = new ArrayList<>();
		List<RelationshipInfo> connections = new ArrayList<>();
		for (DiagramNode child : node.getChildren()) {
			if (!child.isEdge()) {
				children.addAll(renderNode(page, child, depth + 1, visited, orphans));
			}
		}
		for (DiagramNode child : node.getChildren()) {
			if (child.isEdge()) {
				connections.add(Projections.relationship(page, child));
			}
		}

		if (!node.hasText()) {
			return children;
		}
		return List.of(new RenderedNode(node.getId(), node.getText(), node.getShapeType(), children, connections));
	}

	private static List<String> outline(List<RenderedNode> tree, List<RelationshipInfo> connections,
			List<OrphanInfo> orphans) {
		List<String> lines = new ArrayList<>();
		for (RenderedNode node : tree) {
			appendNode(lines, node, 0);
		}
		if (!connections.isEmpty()) {
			lines.add("Connections:");
			for (RelationshipInfo connection : connections) {
				lines.add(INDENT + describe(connection));
			}
		}
		if (!orphans.isEmpty()) {
			lines.add("Orphans:");
			for (OrphanInfo orphan : orphans) {
				lines.add(INDENT + "[" + orphan.type() + "] " + orphan.text());
				for (RenderedNode child : orphan.children()) {
					appendNode(lines, child, 2);
				}
			}
		}
		return lines;
	}

	private static void appendNode(List<String> lines, RenderedNode node, int level) {
		String indent = INDENT.repeat(level);
		lines.add(indent + "[" + node.type() + "] " + node.text());
		for (RenderedNode child : node.children()) {
			appendNode(lines, child, level + 1);
		}
		for (RelationshipInfo connection : node.connections()) {
			String label = connection.label().isEmpty() ? "" : " [" + connection.label() + "]";
			lines.add(indent + INDENT + "-> " + connection.targetName() + label + " (" + connection.type() + ")");
		}
	}

	static String describe(RelationshipInfo relationship) {
		String label = relationship.label().isEmpty() ? "" : " [" + relationship.label() + "]";
		return relationship.sourceName() + " -> " + relationship.targetName() + label + " (" + relationship.type()
				+ ")";
	}
}
