package com.drawiomcp.diagram;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One shape or connector after normalization. Instances are immutable.
 * <p>
 * {@code value} keeps the raw, possibly HTML-encoded label; plain text is
 * derived by {@link DiagramNode}. Empty attribute values are stored as
 * {@code null}, except {@code value} which is never {@code null}.
 */
public final class DiagramCell {

	private final String id;
	private final String value;
	private final String style;
	private final StyleDescriptor styleDescriptor;
	private final String parentId;
	private final boolean edge;
	private final boolean vertex;
	private final String sourceId;
	private final String targetId;
	private final String hyperlink;
	private final String tooltip;
	private final Map<String, String> properties;
	private final CellKind kind;

	private DiagramCell(Builder builder) {
		this.id = builder.id;
		this.value = builder.value != null ? builder.value : "";
		this.style = builder.style;
		this.styleDescriptor = StyleDescriptor.parse(builder.style);
		this.parentId = builder.parentId;
		this.sourceId = builder.sourceId;
		this.targetId = builder.targetId;
		this.edge = builder.edge || builder.sourceId != null;
		this.vertex = builder.vertex;
		this.hyperlink = builder.hyperlink;
		this.tooltip = builder.tooltip;
		this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.properties));
		this.kind = builder.kind;
	}

	public String getId() {
		return id;
	}

	public boolean hasId() {
		return id != null;
	}

	public String getValue() {
		return value;
	}

	public String getStyle() {
		return style;
	}

	public StyleDescriptor getStyleDescriptor() {
		return styleDescriptor;
	}

	public String getParentId() {
		return parentId;
	}

	/** An explicit {@code edge="1"} or any non-empty source reference. */
	public boolean isEdge() {
		return edge;
	}

	public boolean isVertex() {
		return vertex;
	}

	public String getSourceId() {
		return sourceId;
	}

	public String getTargetId() {
		return targetId;
	}

	public String getHyperlink() {
		return hyperlink;
	}

	public boolean hasHyperlink() {
		return hyperlink != null;
	}

	public String getTooltip() {
		return tooltip;
	}

	/** Custom attributes of a wrapped record; empty for direct cells. */
	public Map<String, String> getProperties() {
		return properties;
	}

	public CellKind getKind() {
		return kind;
	}

	@Override
	public String toString() {
		return "DiagramCell{id=" + id + ", kind=" + kind + ", edge=" + edge + ", parent=" + parentId + '}';
	}

	public static Builder builder(CellKind kind) {
		return new Builder(kind);
	}

	public static final class Builder {
		private final CellKind kind;
		private String id;
		private String value;
		private String style;
		private String parentId;
		private boolean edge;
		private boolean vertex;
		private String sourceId;
		private String targetId;
		private String hyperlink;
		private String tooltip;
		private final Map<String, String> properties = new LinkedHashMap<>();

		private Builder(CellKind kind) {
			this.kind = kind;
		}

		public Builder id(String id) {
			this.id = emptyToNull(id);
			return this;
		}

		public Builder value(String value) {
			this.value = value;
			return this;
		}

		public Builder style(String style) {
			this.style = style;
			return this;
		}

		public Builder parentId(String parentId) {
			this.parentId = emptyToNull(parentId);
			return this;
		}

		public Builder edge(boolean edge) {
			this.edge = edge;
			return this;
		}

		public Builder vertex(boolean vertex) {
			this.vertex = vertex;
			return this;
		}

		public Builder sourceId(String sourceId) {
			this.sourceId = emptyToNull(sourceId);
			return this;
		}

		public Builder targetId(String targetId) {
			this.targetId = emptyToNull(targetId);
			return this;
		}

		public Builder hyperlink(String hyperlink) {
			this.hyperlink = emptyToNull(hyperlink);
			return this;
		}

		public Builder tooltip(String tooltip) {
			this.tooltip = emptyToNull(tooltip);
			return this;
		}

		public Builder property(String key, String value) {
			this.properties.put(key, value);
			return this;
		}

		public DiagramCell build() {
			return new DiagramCell(this);
		}

		private static String emptyToNull(String text) {
			return text == null || text.isEmpty() ? null : text;
		}
	}
}
