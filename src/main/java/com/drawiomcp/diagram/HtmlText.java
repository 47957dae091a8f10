package com.drawiomcp.diagram;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts the HTML-flavoured labels draw.io stores in cell values into plain text.
 */
public final class HtmlText {

	private static final Pattern ENTITY = Pattern.compile("&(#[xX][0-9a-fA-F]+|#[0-9]+|[a-zA-Z]+);");
	private static final Pattern TAG = Pattern.compile("<[^>]*>");
	private static final Pattern WHITESPACE = Pattern.compile("\\s+");
	private static final Pattern LINE_BREAK_TAG = Pattern.compile("(?i)<br\\s*/?>|</div\\s*>|</p\\s*>");

	private static final Map<String, String> NAMED_ENTITIES = Map.of(
			"lt", "<",
			"gt", ">",
			"amp", "&",
			"quot", "\"",
			"apos", "'",
			"nbsp", " ");

	private HtmlText() {
	}

	/**
	 * Decodes named and numeric character references in a single pass, so an
	 * escaped ampersand is never decoded twice. Unknown named references are kept.
	 */
	public static String decodeHtml(String html) {
		if (html == null || html.isEmpty()) {
			return "";
		}
		Matcher matcher = ENTITY.matcher(html);
		StringBuilder out = new StringBuilder(html.length());
		while (matcher.find()) {
			matcher.appendReplacement(out, Matcher.quoteReplacement(resolveEntity(matcher.group(1), matcher.group())));
		}
		matcher.appendTail(out);
		return out.toString();
	}

	/**
	 * Decodes entities, removes tags and collapses whitespace.
	 *
	 * @return the plain text, never {@code null}
	 */
	public static String stripHtml(String html) {
		if (html == null || html.isEmpty()) {
			return "";
		}
		String withoutTags = TAG.matcher(decodeHtml(html)).replaceAll("");
		return WHITESPACE.matcher(withoutTags).replaceAll(" ").trim();
	}

	/**
	 * Splits a label into its visual lines. {@code <br>}, closing {@code div} and
	 * {@code p} tags and literal newlines all end a line. Blank lines are dropped.
	 */
	public static List<String> toLines(String html) {
		List<String> lines = new ArrayList<>();
		if (html == null || html.isEmpty()) {
			return lines;
		}
		String decoded = decodeHtml(html);
		String broken = LINE_BREAK_TAG.matcher(decoded).replaceAll("\n");
		String withoutTags = TAG.matcher(broken).replaceAll("");
		for (String line : withoutTags.split("\n")) {
			String collapsed = WHITESPACE.matcher(line).replaceAll(" ").trim();
			if (!collapsed.isEmpty()) {
				lines.add(collapsed);
			}
		}
		return lines;
	}

	/**
	 * Truncates to at most {@code maxLength} characters.
	 */
	public static String truncate(String text, int maxLength) {
		if (text == null) {
			return "";
		}
		return text.length() <= maxLength ? text : text.substring(0, maxLength);
	}

	private static String resolveEntity(String body, String original) {
		if (body.charAt(0) == '#') {
			try {
				int codePoint = body.length() > 1 && (body.charAt(1) == 'x' || body.charAt(1) == 'X')
						? Integer.parseInt(body.substring(2), 16)
						: Integer.parseInt(body.substring(1));
				if (Character.isValidCodePoint(codePoint)) {
					return new String(Character.toChars(codePoint));
				}
			} catch (NumberFormatException e) {
				// overflowing reference, keep it verbatim
				return original;
			}
			return original;
		}
		String named = NAMED_ENTITIES.get(body.toLowerCase(Locale.ROOT));
		return named != null ? named : original;
	}
}
