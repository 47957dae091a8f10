package com.drawiomcp.diagram;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.w3c.dom.Element;

/**
 * Flattens the children of an {@code mxGraphModel}'s {@code <root>} into
 * {@link DiagramCell}s, in document order.
 * <p>
 * For wrapped records the label comes from the container ({@code label}, then
 * {@code value}). Structural attributes come from the nested {@code mxCell}
 * and fall back to the container only where the nested cell lacks them.
 */
public final class CellNormalizer {

	static final String ATTR_ID = "id";
	static final String ATTR_VALUE = "value";
	static final String ATTR_LABEL = "label";
	static final String ATTR_STYLE = "style";
	static final String ATTR_PARENT = "parent";
	static final String ATTR_EDGE = "edge";
	static final String ATTR_VERTEX = "vertex";
	static final String ATTR_SOURCE = "source";
	static final String ATTR_TARGET = "target";
	static final String ATTR_LINK = "link";
	static final String ATTR_TOOLTIP = "tooltip";

	/** Container attributes that never become custom properties. */
	private static final Set<String> RESERVED = Set.of(
			ATTR_ID, ATTR_VALUE, ATTR_LABEL, ATTR_LINK, ATTR_TOOLTIP,
			ATTR_STYLE, ATTR_PARENT, ATTR_EDGE, ATTR_VERTEX, ATTR_SOURCE, ATTR_TARGET);

	/**
	 * Normalizes every cell of a graph model. A model without {@code <root>}
	 * yields no cells.
	 */
	public List<DiagramCell> normalize(Element graphModel) {
		List<DiagramCell> cells = new ArrayList<>();
		Element root = DiagramXml.firstChild(graphModel, DiagramXml.ROOT);
		if (root == null) {
			return cells;
		}
		for (Element child : DiagramXml.childElements(root)) {
			CellRecord record = CellRecord.from(child);
			if (record != null) {
				cells.add(normalize(record));
			}
		}
		return cells;
	}

	/**
	 * Merges one record into the uniform cell model.
	 */
	public DiagramCell normalize(CellRecord record) {
		if (record instanceof CellRecord.Direct direct) {
			return fromDirect(direct.attributes());
		}
		if (record instanceof CellRecord.Wrapped wrapped) {
			return fromWrapped(wrapped.outer(), wrapped.nested());
		}
		throw new IllegalArgumentException("Unsupported cell record: " + record);
	}

	private static DiagramCell fromDirect(Map<String, String> attrs) {
		return DiagramCell.builder(CellKind.DIRECT)
				.id(attrs.get(ATTR_ID))
				.value(attrs.get(ATTR_VALUE))
				.style(attrs.get(ATTR_STYLE))
				.parentId(attrs.get(ATTR_PARENT))
				.edge("1".equals(attrs.get(ATTR_EDGE)))
				.vertex("1".equals(attrs.get(ATTR_VERTEX)))
				.sourceId(attrs.get(ATTR_SOURCE))
				.targetId(attrs.get(ATTR_TARGET))
				.hyperlink(attrs.get(ATTR_LINK))
				.tooltip(attrs.get(ATTR_TOOLTIP))
				.build();
	}

	private static DiagramCell fromWrapped(Map<String, String> outer, Map<String, String> nested) {
		String value = outer.get(ATTR_LABEL);
		if (value == null) {
			value = outer.get(ATTR_VALUE);
		}
		String id = nested.get(ATTR_ID);
		if (id == null || id.isEmpty()) {
			id = outer.get(ATTR_ID);
		}

		DiagramCell.Builder builder = DiagramCell.builder(CellKind.WRAPPED)
				.id(id)
				.value(value != null ? value : "")
				.style(structural(ATTR_STYLE, outer, nested))
				.parentId(structural(ATTR_PARENT, outer, nested))
				.edge("1".equals(structural(ATTR_EDGE, outer, nested)))
				.vertex("1".equals(structural(ATTR_VERTEX, outer, nested)))
				.sourceId(structural(ATTR_SOURCE, outer, nested))
				.targetId(structural(ATTR_TARGET, outer, nested))
				.hyperlink(outer.get(ATTR_LINK) != null ? outer.get(ATTR_LINK) : nested.get(ATTR_LINK))
				.tooltip(outer.get(ATTR_TOOLTIP));

		for (Map.Entry<String, String> entry : outer.entrySet()) {
			if (!RESERVED.contains(entry.getKey())) {
				builder.property(entry.getKey(), entry.getValue());
			}
		}
		return builder.build();
	}

	private static String structural(String name, Map<String, String> outer, Map<String, String> nested) {
		String value = nested.get(name);
		return value != null ? value : outer.get(name);
	}
}
