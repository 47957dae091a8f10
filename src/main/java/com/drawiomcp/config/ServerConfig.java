package com.drawiomcp.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.drawiomcp.exceptions.DrawioMcpException;
import com.drawiomcp.models.DrawioMcpError;

/**
 * Server settings. Defaults come from {@code drawio-mcp.properties} on the
 * classpath; any {@code drawio.mcp.*} system property overrides the bundled
 * value of the same key.
 */
public final class ServerConfig {

	private static final Logger LOG = LoggerFactory.getLogger(ServerConfig.class);

	public static final String RESOURCE_NAME = "drawio-mcp.properties";
	public static final String PREFIX = "drawio.mcp.";

	public static final String KEY_HOST = "host";
	public static final String KEY_PORT = "port";
	public static final String KEY_DEFAULT_LIMIT = "default_limit";
	public static final String KEY_MAX_LIMIT = "max_limit";
	public static final String KEY_RENDER_MAX_DEPTH = "render.max_depth";
	private static final String TOOL_KEY_PREFIX = "tools.";
	private static final String TOOL_KEY_SUFFIX = ".enabled";

	public static final String DEFAULT_HOST = "127.0.0.1";
	public static final int DEFAULT_PORT = 8080;
	public static final int DEFAULT_LIMIT = 100;
	public static final int DEFAULT_MAX_LIMIT = 1000;
	public static final int DEFAULT_RENDER_MAX_DEPTH = 64;

	private final Properties properties;

	private ServerConfig(Properties properties) {
		this.properties = properties;
	}

	/**
	 * Bundled defaults overridden by system properties.
	 */
	public static ServerConfig load() {
		Properties merged = new Properties();
		try (InputStream in = ServerConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
			if (in != null) {
				merged.load(in);
			} else {
				LOG.info("{} not found on classpath, using built-in defaults", RESOURCE_NAME);
			}
		} catch (IOException e) {
			throw new DrawioMcpException(DrawioMcpError.internal()
					.errorCode(DrawioMcpError.ErrorCode.CONFIGURATION_ERROR)
					.message("Failed to read " + RESOURCE_NAME + ": " + e.getMessage())
					.build(), e);
		}
		for (String name : System.getProperties().stringPropertyNames()) {
			if (name.startsWith(PREFIX)) {
				merged.setProperty(name.substring(PREFIX.length()), System.getProperty(name));
			}
		}
		return new ServerConfig(merged);
	}

	/**
	 * Settings from explicit properties only, keys without the {@code drawio.mcp.} prefix.
	 */
	public static ServerConfig of(Properties properties) {
		Properties copy = new Properties();
		copy.putAll(properties);
		return new ServerConfig(copy);
	}

	public static ServerConfig defaults() {
		return new ServerConfig(new Properties());
	}

	public String getHost() {
		String host = properties.getProperty(KEY_HOST);
		return host == null || host.isBlank() ? DEFAULT_HOST : host.trim();
	}

	public int getPort() {
		return getInt(KEY_PORT, DEFAULT_PORT, 1, 65535);
	}

	/** Cap applied to capped listings when the caller gives no {@code limit}. */
	public int getDefaultLimit() {
		return Math.min(getInt(KEY_DEFAULT_LIMIT, DEFAULT_LIMIT, 1, Integer.MAX_VALUE), getMaxLimit());
	}

	/** Largest {@code limit} a caller may request. */
	public int getMaxLimit() {
		return getInt(KEY_MAX_LIMIT, DEFAULT_MAX_LIMIT, 1, Integer.MAX_VALUE);
	}

	/** Depth at which the hierarchical render stops descending. */
	public int getRenderMaxDepth() {
		return getInt(KEY_RENDER_MAX_DEPTH, DEFAULT_RENDER_MAX_DEPTH, 1, 10_000);
	}

	/**
	 * Whether the tool with the given MCP name is enabled; tools are enabled
	 * unless {@code tools.<name>.enabled} is {@code false}.
	 */
	public boolean isToolEnabled(String mcpName) {
		String value = properties.getProperty(TOOL_KEY_PREFIX + mcpName + TOOL_KEY_SUFFIX);
		return value == null || !"false".equalsIgnoreCase(value.trim());
	}

	private int getInt(String key, int defaultValue, int min, int max) {
		String raw = properties.getProperty(key);
		if (raw == null || raw.isBlank()) {
			return defaultValue;
		}
		int value;
		try {
			value = Integer.parseInt(raw.trim());
		} catch (NumberFormatException e) {
			throw new DrawioMcpException(configError(key, raw, "must be an integer"), e);
		}
		if (value < min || value > max) {
			throw new DrawioMcpException(configError(key, raw, "must be between " + min + " and " + max));
		}
		return value;
	}

	private static DrawioMcpError configError(String key, String raw, String requirement) {
		return DrawioMcpError.internal()
				.errorCode(DrawioMcpError.ErrorCode.CONFIGURATION_ERROR)
				.message("Invalid configuration value for '" + PREFIX + key + "': '" + raw + "' " + requirement)
				.build();
	}

	@Override
	public String toString() {
		return "ServerConfig{host=" + getHost() + ", port=" + getPort() + ", defaultLimit=" + getDefaultLimit()
				+ ", maxLimit=" + getMaxLimit() + ", renderMaxDepth=" + getRenderMaxDepth() + '}';
	}
}
