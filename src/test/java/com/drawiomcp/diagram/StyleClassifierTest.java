package com.drawiomcp.diagram;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class StyleClassifierTest {

	@Nested
	@DisplayName("Shapes")
	class Shapes {

		@ParameterizedTest(name = "{0} -> {1}")
		@CsvSource(delimiter = '|', value = {
				"swimlane;startSize=30;               | SWIMLANE",
				"rhombus;whiteSpace=wrap;html=1;      | DECISION",
				"ellipse;shape=doubleEllipse;         | START_END",
				"shape=endState;fillColor=#000000;    | START_END",
				"ellipse;whiteSpace=wrap;             | ELLIPSE",
				"shape=cylinder3;boundedLbl=1;        | DATABASE",
				"shape=datastore;                     | DATABASE",
				"ellipse;shape=cloud;                 | ELLIPSE",
				"shape=cloud;                         | CLOUD",
				"shape=process;                       | PROCESS",
				"shape=mxgraph.bpmn.task;             | BPMN",
				"shape=image;image=img/lib/aws.svg;   | ICON",
				"shape=hexagon;perimeter=hexagonPerimeter2; | HEXAGON",
				"shape=parallelogram;                 | PARALLELOGRAM",
				"shape=document;                      | DOCUMENT",
				"shape=callout;                       | CALLOUT",
				"shape=note;                          | NOTE",
				"text;html=1;align=center;            | TEXT",
				"group                                | GROUP",
				"rounded=1;whiteSpace=wrap;           | ROUNDED_RECT",
				"rounded=0;whiteSpace=wrap;html=1;    | ROUNDED_RECT",
				"shape=mxgraph.aws4.group;            | GROUP",
				"fontStyle=1;text                     | SHAPE",
				"whiteSpace=wrap;html=1;              | SHAPE"
		})
		void classifiesByFirstMatchingRule(String style, ShapeType expected) {
			assertEquals(expected, StyleClassifier.classifyShape(style.trim()));
		}

		@Test
		void earlierRuleWinsWhenTokensCoOccur() {
			assertEquals(ShapeType.SWIMLANE, StyleClassifier.classifyShape("rhombus;swimlane;"));
			assertEquals(ShapeType.DECISION, StyleClassifier.classifyShape("rounded=1;rhombus;"));
		}

		@Test
		void tokenOrderDoesNotMatter() {
			assertEquals(StyleClassifier.classifyShape("html=1;rhombus;whiteSpace=wrap"),
					StyleClassifier.classifyShape("whiteSpace=wrap;rhombus;html=1"));
			assertEquals(ShapeType.ROUNDED_RECT, StyleClassifier.classifyShape("html=1;rounded=1"));
		}

		@Test
		void missingStyleIsPlainShape() {
			assertEquals(ShapeType.SHAPE, StyleClassifier.classifyShape((String) null));
			assertEquals(ShapeType.SHAPE, StyleClassifier.classifyShape(""));
		}
	}

	@Nested
	@DisplayName("Relations")
	class Relations {

		@ParameterizedTest(name = "{0} -> {1}")
		@CsvSource(delimiter = '|', value = {
				"dashed=1;endArrow=block;              | DEPENDENCY",
				"dashed=0;endArrow=block;              | DEPENDENCY",
				"endArrow=block;endFill=0;             | INHERITANCE",
				"endArrow=block;endFill=1;             | FLOW",
				"endArrow=diamondThin;endFill=1;       | COMPOSITION",
				"endArrow=diamond;                     | COMPOSITION",
				"endArrow=open;dashPattern=8 8;        | ASYNC_MESSAGE",
				"endArrow=open;endFill=0;              | AGGREGATION",
				"endArrow=none;                        | ASSOCIATION",
				"edgeStyle=orthogonalEdgeStyle;        | FLOW"
		})
		void classifiesByFirstMatchingRule(String style, RelationType expected) {
			assertEquals(expected, StyleClassifier.classifyRelation(style.trim()));
		}

		@Test
		void dashedBeatsAsyncMessage() {
			assertEquals(RelationType.DEPENDENCY,
					StyleClassifier.classifyRelation("endArrow=open;dashed=1;dashPattern=1 4;"));
			assertEquals(RelationType.DEPENDENCY,
					StyleClassifier.classifyRelation("endArrow=open;dashed=0;dashPattern=1 4;"));
			assertEquals(RelationType.ASYNC_MESSAGE,
					StyleClassifier.classifyRelation("endArrow=open;dashPattern=1 4;"));
		}

		@Test
		void missingStyleIsAssociation() {
			assertEquals(RelationType.ASSOCIATION, StyleClassifier.classifyRelation((String) null));
			assertEquals(RelationType.ASSOCIATION, StyleClassifier.classifyRelation(""));
		}
	}
}
