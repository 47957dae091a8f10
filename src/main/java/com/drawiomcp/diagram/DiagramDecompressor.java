package com.drawiomcp.diagram;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.regex.Pattern;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

/**
 * Recovers the {@code mxGraphModel} of a compressed page.
 * <p>
 * draw.io stores compressed pages as base64 of a raw deflate stream (no zlib
 * or gzip header) whose content is the page XML passed through
 * {@code encodeURIComponent}. Every failure is reported through
 * {@link DecompressionResult#failed(String)}; this class never throws.
 */
public final class DiagramDecompressor {

	private static final Logger LOG = LoggerFactory.getLogger(DiagramDecompressor.class);

	/** Largest inflated payload accepted for one page. */
	public static final int DEFAULT_MAX_INFLATED_BYTES = 32 * 1024 * 1024;

	private static final int BUFFER_SIZE = 8192;
	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	private final int maxInflatedBytes;

	public DiagramDecompressor() {
		this(DEFAULT_MAX_INFLATED_BYTES);
	}

	public DiagramDecompressor(int maxInflatedBytes) {
		if (maxInflatedBytes < 1) {
			throw new IllegalArgumentException("maxInflatedBytes must be positive: " + maxInflatedBytes);
		}
		this.maxInflatedBytes = maxInflatedBytes;
	}

	/**
	 * Decodes one page payload.
	 *
	 * @param rawText the inner text of a {@code diagram} element
	 * @return the decoded model or the reason decoding failed
	 */
	public DecompressionResult decompress(String rawText) {
		if (rawText == null || rawText.isBlank()) {
			return DecompressionResult.failed("empty payload");
		}
		String payload = rawText.trim();

		// legacy exports keep the model as escaped text instead of compressing it
		if (payload.startsWith("<")) {
			return parseModel(payload);
		}

		byte[] compressed;
		try {
			compressed = Base64.getDecoder().decode(WHITESPACE.matcher(payload).replaceAll(""));
		} catch (IllegalArgumentException e) {
			return failure("invalid base64: " + e.getMessage());
		}
		if (compressed.length == 0) {
			return failure("invalid base64: no data");
		}

		String encoded;
		try {
			encoded = inflate(compressed);
		} catch (DataFormatException e) {
			return failure("corrupt deflate stream: " + (e.getMessage() != null ? e.getMessage() : "unknown"));
		}
		if (encoded == null) {
			return failure("inflated payload too large");
		}

		String xml;
		try {
			// encodeURIComponent leaves '+' unescaped, so it must stay literal
			xml = URLDecoder.decode(encoded.replace("+", "%2B"), StandardCharsets.UTF_8);
		} catch (IllegalArgumentException e) {
			return failure("invalid percent-encoding: " + e.getMessage());
		}
		return parseModel(xml);
	}

	/**
	 * @return the inflated text, or {@code null} once it grows past the cap
	 */
	private String inflate(byte[] compressed) throws DataFormatException {
		Inflater inflater = new Inflater(true);
		try {
			inflater.setInput(compressed);
			ByteArrayOutputStream out = new ByteArrayOutputStream(
					(int) Math.min((long) compressed.length * 4, maxInflatedBytes));
			byte[] buffer = new byte[BUFFER_SIZE];
			while (!inflater.finished()) {
				int count = inflater.inflate(buffer);
				if (count == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
					throw new DataFormatException("truncated deflate stream");
				}
				if (out.size() + count > maxInflatedBytes) {
					return null;
				}
				out.write(buffer, 0, count);
			}
			return out.toString(StandardCharsets.UTF_8);
		} finally {
			inflater.end();
		}
	}

	private static DecompressionResult parseModel(String xml) {
		Document document;
		try {
			document = DiagramXml.parse(xml);
		} catch (SAXException | IOException e) {
			return failure("decoded payload is not well-formed XML: " + e.getMessage());
		}
		Element model = document.getDocumentElement();
		if (!DiagramXml.GRAPH_MODEL.equals(model.getTagName())) {
			return failure("decoded payload has root <" + model.getTagName() + ">, expected <mxGraphModel>");
		}
		return DecompressionResult.decoded(xml, model);
	}

	private static DecompressionResult failure(String reason) {
		LOG.debug("Page payload could not be decompressed: {}", reason);
		return DecompressionResult.failed(reason);
	}
}
