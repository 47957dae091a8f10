package com.drawiomcp.diagram;

import java.util.List;
import java.util.function.Predicate;

/**
 * Ordered first-match rules mapping a {@link StyleDescriptor} to a
 * {@link ShapeType} for vertices or a {@link RelationType} for edges.
 * <p>
 * Several tokens can co-occur in one style, so the rule order decides the
 * result: a style naming both {@code swimlane} and {@code rhombus} is a
 * swimlane. Token order inside the style string never matters.
 * <p>
 * The trailing text, group, rounded and dashed rules test for the word
 * anywhere in the raw style, so {@code rounded=0} still reads as a rounded
 * rectangle and {@code shape=mxgraph.aws4.group} as a group.
 */
public final class StyleClassifier {

	private record Rule<T>(T result, Predicate<StyleDescriptor> matches) {
	}

	private static final List<Rule<ShapeType>> SHAPE_RULES = List.of(
			new Rule<>(ShapeType.SWIMLANE, s -> s.mentions("swimlane")),
			new Rule<>(ShapeType.DECISION, s -> s.mentions("rhombus")),
			new Rule<>(ShapeType.START_END, s -> s.mentions("doubleellipse")
					|| s.lowerValue("shape").equals("endstate")
					|| s.lowerValue("shape").equals("startstate")),
			new Rule<>(ShapeType.ELLIPSE, s -> s.mentions("ellipse")),
			new Rule<>(ShapeType.DATABASE, s -> s.mentions("cylinder") || s.lowerValue("shape").equals("datastore")),
			new Rule<>(ShapeType.CLOUD, s -> s.mentions("cloud")),
			new Rule<>(ShapeType.PROCESS, s -> s.lowerValue("shape").startsWith("process")),
			new Rule<>(ShapeType.BPMN, s -> s.lowerValue("shape").startsWith("mxgraph.bpmn")),
			new Rule<>(ShapeType.ICON, s -> s.lowerValue("shape").equals("image")),
			new Rule<>(ShapeType.HEXAGON, s -> s.mentions("hexagon")),
			new Rule<>(ShapeType.PARALLELOGRAM, s -> s.mentions("parallelogram")),
			new Rule<>(ShapeType.DOCUMENT, s -> s.lowerValue("shape").contains("document")),
			new Rule<>(ShapeType.CALLOUT, s -> s.lowerValue("shape").contains("callout")),
			new Rule<>(ShapeType.NOTE, s -> s.lowerValue("shape").contains("note")),
			new Rule<>(ShapeType.TEXT, s -> s.mentions("text;")),
			new Rule<>(ShapeType.GROUP, s -> s.mentions("group")),
			new Rule<>(ShapeType.ROUNDED_RECT, s -> s.mentions("rounded")));

	private static final List<Rule<RelationType>> RELATION_RULES = List.of(
			new Rule<>(RelationType.DEPENDENCY, s -> s.mentions("dashed")),
			new Rule<>(RelationType.INHERITANCE, s -> s.valueEquals("endArrow", "block") && "0".equals(s.get("endFill"))),
			new Rule<>(RelationType.FLOW, s -> s.valueEquals("endArrow", "block")),
			new Rule<>(RelationType.COMPOSITION, s -> s.valueEquals("endArrow", "diamond")
					|| s.valueEquals("endArrow", "diamondThin")),
			new Rule<>(RelationType.ASYNC_MESSAGE, s -> s.valueEquals("endArrow", "open") && s.hasKey("dashPattern")),
			new Rule<>(RelationType.AGGREGATION, s -> s.valueEquals("endArrow", "open")));

	private StyleClassifier() {
	}

	/**
	 * Classifies a vertex style. An absent style is always {@link ShapeType#SHAPE}.
	 */
	public static ShapeType classifyShape(StyleDescriptor style) {
		if (style == null || style.isAbsent()) {
			return ShapeType.SHAPE;
		}
		return firstMatch(SHAPE_RULES, style, ShapeType.SHAPE);
	}

	public static ShapeType classifyShape(String rawStyle) {
		return classifyShape(StyleDescriptor.parse(rawStyle));
	}

	/**
	 * Classifies an edge style. When no rule matches, a blank style or a
	 * headless edge ({@code endArrow=none}) is an association and any other
	 * plain edge is a flow.
	 */
	public static RelationType classifyRelation(StyleDescriptor style) {
		if (style == null || style.isBlank()) {
			return RelationType.ASSOCIATION;
		}
		RelationType matched = firstMatch(RELATION_RULES, style, null);
		if (matched != null) {
			return matched;
		}
		return style.valueEquals("endArrow", "none") ? RelationType.ASSOCIATION : RelationType.FLOW;
	}

	public static RelationType classifyRelation(String rawStyle) {
		return classifyRelation(StyleDescriptor.parse(rawStyle));
	}

	private static <T> T firstMatch(List<Rule<T>> rules, StyleDescriptor style, T fallback) {
		for (Rule<T> rule : rules) {
			if (rule.matches().test(style)) {
				return rule.result();
			}
		}
		return fallback;
	}
}
