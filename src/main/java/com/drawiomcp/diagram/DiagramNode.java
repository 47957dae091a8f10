package com.drawiomcp.diagram;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A {@link DiagramCell} placed in its page's containment tree, with its label
 * resolved to plain text.
 * <p>
 * Children are only appended by {@link HierarchyBuilder}; the parent relation
 * comes from untrusted input, so traversals must guard against cycles.
 */
public final class DiagramNode {

	private final DiagramCell cell;
	private final String text;
	private final List<DiagramNode> children = new ArrayList<>();
	private final List<DiagramNode> childrenView = Collections.unmodifiableList(children);

	DiagramNode(DiagramCell cell) {
		this.cell = cell;
		this.text = HtmlText.stripHtml(cell.getValue());
	}

	void addChild(DiagramNode child) {
		children.add(child);
	}

	public DiagramCell getCell() {
		return cell;
	}

	public String getId() {
		return cell.getId();
	}

	/** Plain text of the label; empty when the cell has no visible text. */
	public String getText() {
		return text;
	}

	public boolean hasText() {
		return !text.isEmpty();
	}

	public boolean isEdge() {
		return cell.isEdge();
	}

	public List<DiagramNode> getChildren() {
		return childrenView;
	}

	public ShapeType getShapeType() {
		return StyleClassifier.classifyShape(cell.getStyleDescriptor());
	}

	public RelationType getRelationType() {
		return StyleClassifier.classifyRelation(cell.getStyleDescriptor());
	}

	/** Label split into visual lines, see {@link HtmlText#toLines(String)}. */
	public List<String> getTextLines() {
		return HtmlText.toLines(cell.getValue());
	}

	@Override
	public String toString() {
		return "DiagramNode{id=" + cell.getId() + ", text='" + text + "', children=" + children.size() + '}';
	}
}
