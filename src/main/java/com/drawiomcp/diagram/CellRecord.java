package com.drawiomcp.diagram;

import java.util.LinkedHashMap;
import java.util.Map;

import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;

/**
 * Raw attributes of one child of {@code <root>}, before normalization.
 * The two encodings draw.io uses are {@link Direct} and {@link Wrapped}.
 */
public interface CellRecord {

	String USER_OBJECT = "UserObject";
	String OBJECT = "object";

	CellKind kind();

	/**
	 * A plain {@code mxCell}.
	 */
	record Direct(Map<String, String> attributes) implements CellRecord {
		@Override
		public CellKind kind() {
			return CellKind.DIRECT;
		}
	}

	/**
	 * A {@code UserObject}/{@code object} container and the attributes of the
	 * {@code mxCell} it nests. {@code nested} is empty when the container has
	 * no nested cell.
	 */
	record Wrapped(Map<String, String> outer, Map<String, String> nested) implements CellRecord {
		@Override
		public CellKind kind() {
			return CellKind.WRAPPED;
		}
	}

	/**
	 * Reads a child of {@code <root>}.
	 *
	 * @return the record, or {@code null} for elements that are not cells
	 */
	static CellRecord from(Element element) {
		String tag = element.getTagName();
		if (DiagramXml.CELL.equals(tag)) {
			return new Direct(attributesOf(element));
		}
		if (USER_OBJECT.equals(tag) || OBJECT.equals(tag)) {
			Element nested = DiagramXml.firstChild(element, DiagramXml.CELL);
			return new Wrapped(attributesOf(element), nested != null ? attributesOf(nested) : Map.of());
		}
		return null;
	}

	private static Map<String, String> attributesOf(Element element) {
		NamedNodeMap attrs = element.getAttributes();
		Map<String, String> result = new LinkedHashMap<>();
		for (int i = 0; i < attrs.getLength(); i++) {
			Attr attr = (Attr) attrs.item(i);
			result.put(attr.getName(), attr.getValue());
		}
		return result;
	}
}
