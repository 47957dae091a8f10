package com.drawiomcp.query;

import java.util.ArrayList;
import java.util.List;

import com.drawiomcp.diagram.DiagramCell;
import com.drawiomcp.diagram.DiagramNode;
import com.drawiomcp.diagram.DiagramPage;
import com.drawiomcp.models.ClassInfo;
import com.drawiomcp.models.ComponentInfo;
import com.drawiomcp.models.RelationshipInfo;
import com.drawiomcp.models.TextItem;

/**
 * Node to result-model conversions shared by the listings and the render.
 */
final class Projections {

	private Projections() {
	}

	static ComponentInfo component(DiagramNode node) {
		DiagramCell cell = node.getCell();
		return new ComponentInfo(node.getId(), node.getText(), node.getShapeType(), cell.hasHyperlink(),
				cell.getHyperlink(), cell.getTooltip(), cell.getParentId(), cell.getProperties());
	}

	static TextItem text(DiagramNode node) {
		return new TextItem(node.getId(), node.getText(), node.isEdge());
	}

	/**
	 * Endpoints resolve to the referenced node's text, else the raw id, else {@code ?}.
	 */
	static RelationshipInfo relationship(DiagramPage page, DiagramNode edge) {
		DiagramCell cell = edge.getCell();
		return new RelationshipInfo(
				edge.getId(),
				cell.getSourceId() != null ? cell.getSourceId() : "?",
				cell.getTargetId() != null ? cell.getTargetId() : "?",
				page.resolveEndpoint(cell.getSourceId()),
				page.resolveEndpoint(cell.getTargetId()),
				edge.getText(),
				edge.getRelationType(),
				page.getDisplayName());
	}

	/**
	 * Name is the first label line; members are the remaining lines followed
	 * by the texts of non-edge textual children.
	 */
	static ClassInfo classInfo(DiagramPage page, DiagramNode node) {
		List<String> lines = node.getTextLines();
		String name = lines.isEmpty() ? node.getText() : lines.get(0);
		List<String> members = new ArrayList<>(lines.isEmpty() ? List.of() : lines.subList(1, lines.size()));
		for (DiagramNode child : node.getChildren()) {
			if (!child.isEdge() && child.hasText() && child != node) {
				members.add(child.getText());
			}
		}
		return new ClassInfo(node.getId(), name, members, node.getShapeType(), page.getDisplayName());
	}
}
