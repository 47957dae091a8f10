package com.drawiomcp.diagram;

import java.util.Objects;

import org.w3c.dom.Element;

/**
 * Outcome of decoding one compressed page payload: either the recovered
 * {@code mxGraphModel} element or the reason decoding stopped.
 */
public final class DecompressionResult {

	private final String xml;
	private final Element model;
	private final String failureReason;

	private DecompressionResult(String xml, Element model, String failureReason) {
		this.xml = xml;
		this.model = model;
		this.failureReason = failureReason;
	}

	public static DecompressionResult decoded(String xml, Element model) {
		return new DecompressionResult(Objects.requireNonNull(xml), Objects.requireNonNull(model), null);
	}

	public static DecompressionResult failed(String reason) {
		return new DecompressionResult(null, null, Objects.requireNonNull(reason));
	}

	public boolean isDecoded() {
		return failureReason == null;
	}

	/** The percent-decoded XML text, {@code null} on failure. */
	public String getXml() {
		return xml;
	}

	/** The parsed {@code mxGraphModel} element, {@code null} on failure. */
	public Element getModel() {
		return model;
	}

	public String getFailureReason() {
		return failureReason;
	}

	@Override
	public String toString() {
		return isDecoded() ? "Decoded[" + xml.length() + " chars]" : "Failed[" + failureReason + "]";
	}
}
