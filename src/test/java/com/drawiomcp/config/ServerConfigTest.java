package com.drawiomcp.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Properties;

import org.junit.jupiter.api.Test;

import com.drawiomcp.exceptions.DrawioMcpException;
import com.drawiomcp.models.DrawioMcpError;

class ServerConfigTest {

	private static ServerConfig config(String... pairs) {
		Properties properties = new Properties();
		for (int i = 0; i < pairs.length; i += 2) {
			properties.setProperty(pairs[i], pairs[i + 1]);
		}
		return ServerConfig.of(properties);
	}

	@Test
	void defaultsApplyWhenNothingIsSet() {
		ServerConfig config = ServerConfig.defaults();

		assertEquals("127.0.0.1", config.getHost());
		assertEquals(8080, config.getPort());
		assertEquals(100, config.getDefaultLimit());
		assertEquals(1000, config.getMaxLimit());
		assertEquals(64, config.getRenderMaxDepth());
		assertTrue(config.isToolEnabled("parse_drawio"));
	}

	@Test
	void bundledPropertiesAreLoaded() {
		ServerConfig config = ServerConfig.load();

		assertEquals(8080, config.getPort());
		assertEquals(100, config.getDefaultLimit());
	}

	@Test
	void systemPropertiesOverrideBundledValues() {
		String key = ServerConfig.PREFIX + ServerConfig.KEY_PORT;
		System.setProperty(key, "9191");
		try {
			assertEquals(9191, ServerConfig.load().getPort());
		} finally {
			System.clearProperty(key);
		}
	}

	@Test
	void defaultLimitNeverExceedsMaximum() {
		assertEquals(50, config("default_limit", "500", "max_limit", "50").getDefaultLimit());
	}

	@Test
	void toolsCanBeDisabled() {
		ServerConfig config = config("tools.extract_classes.enabled", " FALSE ");

		assertFalse(config.isToolEnabled("extract_classes"));
		assertTrue(config.isToolEnabled("extract_relationships"));
	}

	@Test
	void invalidValuesAreConfigurationErrors() {
		DrawioMcpException notANumber = assertThrows(DrawioMcpException.class, () -> config("port", "http").getPort());
		DrawioMcpException outOfRange = assertThrows(DrawioMcpException.class, () -> config("port", "70000").getPort());

		assertEquals(DrawioMcpError.ErrorCode.CONFIGURATION_ERROR.getCode(), notANumber.getErrorCode());
		assertEquals(DrawioMcpError.ErrorCode.CONFIGURATION_ERROR.getCode(), outOfRange.getErrorCode());
		assertTrue(outOfRange.getMessage().contains("drawio.mcp.port"));
	}
}
