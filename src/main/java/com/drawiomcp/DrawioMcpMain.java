package com.drawiomcp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.drawiomcp.config.ServerConfig;
import com.drawiomcp.diagram.DiagramLoader;
import com.drawiomcp.query.DiagramQueryService;
import com.drawiomcp.tools.DrawioToolContext;

/**
 * Command line entry point. Settings come from {@code drawio-mcp.properties}
 * and {@code -Ddrawio.mcp.*} overrides.
 */
public final class DrawioMcpMain {

	private static final Logger LOG = LoggerFactory.getLogger(DrawioMcpMain.class);

	private DrawioMcpMain() {
	}

	public static void main(String[] args) throws InterruptedException {
		ServerConfig config = ServerConfig.load();
		LOG.info("Loaded {}", config);

		DiagramQueryService queryService = new DiagramQueryService(new DiagramLoader(), config);
		DrawioMcpTools tools = new DrawioMcpTools(new DrawioToolContext(queryService, config));
		DrawioMcpServer server = new DrawioMcpServer(config, tools);

		if (!server.start()) {
			LOG.error("MCP server failed to start, exiting");
			System.exit(1);
		}
		Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "drawio-mcp-shutdown"));
		server.join();
	}
}
