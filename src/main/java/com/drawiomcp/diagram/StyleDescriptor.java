package com.drawiomcp.diagram;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parsed form of a draw.io style string such as
 * {@code rounded=1;whiteSpace=wrap;html=1;dashed=1;}.
 * <p>
 * Keys and bare flags are lower-cased, values keep their case. A key whose
 * value is {@code 0} or {@code false} counts as disabled. The first occurrence
 * of a repeated key wins.
 */
public final class StyleDescriptor {

	private static final StyleDescriptor ABSENT = new StyleDescriptor(null, Map.of(), Set.of());

	private final String raw;
	private final String lowerRaw;
	private final Map<String, String> values;
	private final Set<String> flags;

	private StyleDescriptor(String raw, Map<String, String> values, Set<String> flags) {
		this.raw = raw;
		this.lowerRaw = raw != null ? raw.toLowerCase(Locale.ROOT) : "";
		this.values = values;
		this.flags = flags;
	}

	/**
	 * Parses a raw style string. {@code null} yields the absent descriptor.
	 */
	public static StyleDescriptor parse(String raw) {
		if (raw == null) {
			return ABSENT;
		}
		Map<String, String> values = new LinkedHashMap<>();
		Set<String> flags = new LinkedHashSet<>();
		for (String token : raw.split(";")) {
			String trimmed = token.trim();
			if (trimmed.isEmpty()) {
				continue;
			}
			int eq = trimmed.indexOf('=');
			if (eq < 0) {
				flags.add(trimmed.toLowerCase(Locale.ROOT));
			} else {
				String key = trimmed.substring(0, eq).trim().toLowerCase(Locale.ROOT);
				if (!key.isEmpty()) {
					values.putIfAbsent(key, trimmed.substring(eq + 1).trim());
				}
			}
		}
		return new StyleDescriptor(raw, Collections.unmodifiableMap(values), Collections.unmodifiableSet(flags));
	}

	public String getRaw() {
		return raw;
	}

	/** True when the cell carried no style attribute at all. */
	public boolean isAbsent() {
		return raw == null;
	}

	/** True when the style is absent or holds no tokens. */
	public boolean isBlank() {
		return raw == null || raw.isBlank();
	}

	public String get(String key) {
		return values.get(key.toLowerCase(Locale.ROOT));
	}

	public boolean hasFlag(String flag) {
		return flags.contains(flag.toLowerCase(Locale.ROOT));
	}

	public boolean hasKey(String key) {
		return values.containsKey(key.toLowerCase(Locale.ROOT));
	}

	public boolean valueEquals(String key, String expected) {
		String value = get(key);
		return value != null && value.equalsIgnoreCase(expected);
	}

	/** Lower-cased value of {@code key}, or an empty string. */
	public String lowerValue(String key) {
		String value = get(key);
		return value != null ? value.toLowerCase(Locale.ROOT) : "";
	}

	/**
	 * Case-insensitive substring test against the whole raw style.
	 */
	public boolean mentions(String token) {
		return lowerRaw.contains(token.toLowerCase(Locale.ROOT));
	}

	public Map<String, String> getValues() {
		return values;
	}

	public Set<String> getFlags() {
		return flags;
	}

	@Override
	public String toString() {
		return raw == null ? "<absent>" : raw;
	}
}
