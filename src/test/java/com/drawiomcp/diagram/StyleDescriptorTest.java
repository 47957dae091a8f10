package com.drawiomcp.diagram;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;

import org.junit.jupiter.api.Test;

class StyleDescriptorTest {

	@Test
	void parsesKeysValuesAndFlags() {
		StyleDescriptor style = StyleDescriptor.parse("Rounded=1;whiteSpace=wrap;Ellipse;fillColor=#DAE8FC;");

		assertEquals("1", style.get("rounded"));
		assertEquals("#DAE8FC", style.get("FILLCOLOR"));
		assertTrue(style.hasFlag("ellipse"));
		assertTrue(style.hasKey("whitespace"));
		assertFalse(style.hasFlag("rounded"));
		assertEquals(Set.of("ellipse"), style.getFlags());
		assertEquals(3, style.getValues().size());
	}

	@Test
	void firstOccurrenceOfAKeyWins() {
		assertEquals("block", StyleDescriptor.parse("endArrow=block;endArrow=open").get("endArrow"));
	}

	@Test
	void absentAndBlankStylesAreDistinguished() {
		StyleDescriptor absent = StyleDescriptor.parse(null);
		StyleDescriptor blank = StyleDescriptor.parse(" ");

		assertTrue(absent.isAbsent());
		assertTrue(absent.isBlank());
		assertNull(absent.getRaw());
		assertFalse(blank.isAbsent());
		assertTrue(blank.isBlank());
		assertTrue(blank.getValues().isEmpty());
	}

	@Test
	void mentionsIgnoresCase() {
		StyleDescriptor style = StyleDescriptor.parse("shape=mxgraph.flowchart.Database");

		assertTrue(style.mentions("database"));
		assertEquals("mxgraph.flowchart.database", style.lowerValue("shape"));
		assertEquals("", style.lowerValue("missing"));
	}
}
