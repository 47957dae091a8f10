package com.drawiomcp.diagram;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * DOM helpers shared by the loader and the decompressor. Document type
 * declarations are rejected so external entities never resolve.
 */
final class DiagramXml {

	static final String MXFILE = "mxfile";
	static final String DIAGRAM = "diagram";
	static final String GRAPH_MODEL = "mxGraphModel";
	static final String ROOT = "root";
	static final String CELL = "mxCell";

	private static final ErrorHandler RETHROWING = new ErrorHandler() {
		@Override
		public void warning(SAXParseException exception) {
			// warnings do not affect the parsed tree
		}

		@Override
		public void error(SAXParseException exception) throws SAXException {
			throw exception;
		}

		@Override
		public void fatalError(SAXParseException exception) throws SAXException {
			throw exception;
		}
	};

	private DiagramXml() {
	}

	/**
	 * Parses XML text into a DOM document.
	 *
	 * @throws SAXException if the text is not well-formed
	 */
	static Document parse(String xml) throws SAXException, IOException {
		return parse(new InputSource(new StringReader(xml)));
	}

	/**
	 * Parses raw bytes, letting the XML declaration choose the encoding.
	 */
	static Document parse(byte[] content) throws SAXException, IOException {
		return parse(new InputSource(new ByteArrayInputStream(content)));
	}

	private static Document parse(InputSource source) throws SAXException, IOException {
		DocumentBuilder builder;
		try {
			builder = newFactory().newDocumentBuilder();
		} catch (ParserConfigurationException e) {
			throw new IllegalStateException("XML parser cannot be configured", e);
		}
		builder.setErrorHandler(RETHROWING);
		return builder.parse(source);
	}

	private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
		DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
		factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
		factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
		factory.setXIncludeAware(false);
		factory.setExpandEntityReferences(false);
		factory.setNamespaceAware(false);
		return factory;
	}

	/** Direct element children, in document order. */
	static List<Element> childElements(Element parent) {
		List<Element> result = new ArrayList<>();
		NodeList children = parent.getChildNodes();
		for (int i = 0; i < children.getLength(); i++) {
			Node child = children.item(i);
			if (child.getNodeType() == Node.ELEMENT_NODE) {
				result.add((Element) child);
			}
		}
		return result;
	}

	static List<Element> childElements(Element parent, String name) {
		List<Element> result = new ArrayList<>();
		for (Element child : childElements(parent)) {
			if (name.equals(child.getTagName())) {
				result.add(child);
			}
		}
		return result;
	}

	static Element firstChild(Element parent, String name) {
		for (Element child : childElements(parent)) {
			if (name.equals(child.getTagName())) {
				return child;
			}
		}
		return null;
	}

	/** Attribute value, or {@code null} when the attribute is not present. */
	static String attribute(Element element, String name) {
		return element.hasAttribute(name) ? element.getAttribute(name) : null;
	}

	/** Text of the element with child elements ignored. */
	static String ownText(Element element) {
		StringBuilder text = new StringBuilder();
		NodeList children = element.getChildNodes();
		for (int i = 0; i < children.getLength(); i++) {
			Node child = children.item(i);
			if (child.getNodeType() == Node.TEXT_NODE || child.getNodeType() == Node.CDATA_SECTION_NODE) {
				text.append(child.getNodeValue());
			}
		}
		return text.toString();
	}
}
