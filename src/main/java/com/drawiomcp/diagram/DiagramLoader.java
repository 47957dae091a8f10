package com.drawiomcp.diagram;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

import com.drawiomcp.exceptions.DrawioMcpException;
import com.drawiomcp.utils.DrawioMcpErrorUtils;

/**
 * Reads a draw.io file into a {@link DiagramDocument}.
 * <p>
 * An unreadable source or a document that is not well-formed aborts the
 * load with a {@link DrawioMcpException}. A page whose compressed payload
 * cannot be decoded is kept with zero cells and its failure reason.
 */
public class DiagramLoader {

	private static final Logger LOG = LoggerFactory.getLogger(DiagramLoader.class);

	/** Name given to the only page of a bare {@code mxGraphModel} document. */
	public static final String SINGLE_PAGE_NAME = "Page-1";

	private static final String ATTR_NAME = "name";

	private final DiagramDecompressor decompressor;
	private final CellNormalizer normalizer;
	private final HierarchyBuilder hierarchyBuilder;

	public DiagramLoader() {
		this(new DiagramDecompressor(), new CellNormalizer(), new HierarchyBuilder());
	}

	public DiagramLoader(DiagramDecompressor decompressor, CellNormalizer normalizer,
			HierarchyBuilder hierarchyBuilder) {
		this.decompressor = decompressor;
		this.normalizer = normalizer;
		this.hierarchyBuilder = hierarchyBuilder;
	}

	/**
	 * Loads a diagram file.
	 *
	 * @param filePath  path of the {@code .drawio} file
	 * @param operation operation name recorded in error context
	 * @throws DrawioMcpException if the file is missing, unreadable or malformed
	 */
	public DiagramDocument load(String filePath, String operation) {
		Path path;
		try {
			path = Path.of(filePath);
		} catch (InvalidPathException e) {
			throw new DrawioMcpException(DrawioMcpErrorUtils.fileNotFound(filePath, operation), e);
		}
		if (!Files.exists(path)) {
			throw new DrawioMcpException(DrawioMcpErrorUtils.fileNotFound(filePath, operation));
		}
		if (Files.isDirectory(path)) {
			throw new DrawioMcpException(
					DrawioMcpErrorUtils.fileReadFailed(filePath, "path is a directory", operation));
		}

		byte[] content;
		try {
			content = Files.readAllBytes(path);
		} catch (IOException e) {
			throw new DrawioMcpException(
					DrawioMcpErrorUtils.fileReadFailed(filePath, String.valueOf(e.getMessage()), operation), e);
		}

		Document document;
		try {
			document = DiagramXml.parse(content);
		} catch (SAXException | IOException e) {
			throw new DrawioMcpException(
					DrawioMcpErrorUtils.malformedDocument(filePath, String.valueOf(e.getMessage()), operation), e);
		}
		return build(document, filePath, operation);
	}

	/**
	 * Parses diagram XML held in memory.
	 *
	 * @param xml       the document text
	 * @param sourceId  identifier used in logs and error context
	 * @param operation operation name recorded in error context
	 * @throws DrawioMcpException if the text is not a well-formed diagram document
	 */
	public DiagramDocument parse(String xml, String sourceId, String operation) {
		Document document;
		try {
			document = DiagramXml.parse(xml);
		} catch (SAXException | IOException e) {
			throw new DrawioMcpException(
					DrawioMcpErrorUtils.malformedDocument(sourceId, String.valueOf(e.getMessage()), operation), e);
		}
		return build(document, sourceId, operation);
	}

	private DiagramDocument build(Document document, String sourceId, String operation) {
		Element root = document.getDocumentElement();
		String rootName = root.getTagName();

		List<DiagramPage> pages = new ArrayList<>();
		if (DiagramXml.MXFILE.equals(rootName)) {
			int index = 0;
			for (Element diagram : DiagramXml.childElements(root, DiagramXml.DIAGRAM)) {
				pages.add(buildPage(diagram, index++, sourceId));
			}
		} else if (DiagramXml.GRAPH_MODEL.equals(rootName)) {
			pages.add(hierarchyBuilder.build(SINGLE_PAGE_NAME, 0, false, null, normalizer.normalize(root)));
		} else {
			throw new DrawioMcpException(DrawioMcpErrorUtils.unsupportedRootElement(sourceId, rootName, operation));
		}

		LOG.debug("Loaded {} page(s) from {}", pages.size(), sourceId);
		return new DiagramDocument(sourceId, pages);
	}

	private DiagramPage buildPage(Element diagram, int index, String sourceId) {
		String name = DiagramXml.attribute(diagram, ATTR_NAME);

		Element inlineModel = DiagramXml.firstChild(diagram, DiagramXml.GRAPH_MODEL);
		if (inlineModel != null) {
			return hierarchyBuilder.build(name, index, false, null, normalizer.normalize(inlineModel));
		}

		String payload = DiagramXml.ownText(diagram);
		if (payload.isBlank()) {
			return hierarchyBuilder.build(name, index, false, null, List.of());
		}

		DecompressionResult result = decompressor.decompress(payload);
		if (!result.isDecoded()) {
			LOG.warn("Page '{}' (#{}) of {} could not be decompressed: {}",
					name != null ? name : DiagramPage.UNNAMED, index, sourceId, result.getFailureReason());
			return hierarchyBuilder.build(name, index, true, result.getFailureReason(), List.of());
		}
		return hierarchyBuilder.build(name, index, true, null, normalizer.normalize(result.getModel()));
	}
}
