package com.drawiomcp;

import java.util.List;

import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.drawiomcp.config.ServerConfig;

import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpStatelessAsyncServer;
import io.modelcontextprotocol.server.McpStatelessServerFeatures.AsyncToolSpecification;
import io.modelcontextprotocol.server.transport.HttpServletStatelessServerTransport;
import io.modelcontextprotocol.spec.McpSchema.ServerCapabilities;

/**
 * Manages the lifecycle of the embedded Jetty server with a stateless MCP server.
 */
public class DrawioMcpServer {

    private static final Logger LOG = LoggerFactory.getLogger(DrawioMcpServer.class);

    public static final String SERVER_NAME = "drawio-mcp";
    public static final String SERVER_VERSION = "0.3.0";

    /** The HTTP path spec where the MCP transport servlet will be mounted. */
    private static final String MCP_PATH_SPEC = "/*";

    private final ServerConfig config;
    private final DrawioMcpTools tools;
    private final Object lock = new Object();

    private Server jettyServer;
    private McpStatelessAsyncServer mcpServer;

    public DrawioMcpServer(ServerConfig config, DrawioMcpTools tools) {
        this.config = config;
        this.tools = tools;
    }

    /**
     * Starts the server unless it is already running.
     *
     * @return true if the server is running after the call
     */
    public boolean start() {
        synchronized (lock) {
            if (isRunning()) {
                LOG.info("MCP server already running on {}:{}", config.getHost(), config.getPort());
                return true;
            }
            try {
                startServer();
                return true;
            } catch (Exception e) {
                LOG.error("Failed to start MCP server", e);
                stopServer();
                return false;
            }
        }
    }

    /**
     * Stops the server.
     *
     * @return true if every component shut down cleanly
     */
    public boolean stop() {
        synchronized (lock) {
            return stopServer();
        }
    }

    /**
     * Blocks until the Jetty server stops.
     */
    public void join() throws InterruptedException {
        Server server;
        synchronized (lock) {
            server = jettyServer;
        }
        if (server != null) {
            server.join();
        }
    }

    private void startServer() throws Exception {
        LOG.info("Starting MCP server on {}:{}", config.getHost(), config.getPort());

        List<AsyncToolSpecification> toolSpecs = tools.getAvailableToolSpecifications();
        if (toolSpecs.isEmpty()) {
            LOG.warn("No MCP tools enabled; server will start without tool endpoints");
        }

        HttpServletStatelessServerTransport transportProvider = HttpServletStatelessServerTransport.builder()
            .build();

        mcpServer = McpServer.async(transportProvider)
            .serverInfo(SERVER_NAME, SERVER_VERSION)
            .capabilities(ServerCapabilities.builder().tools(true).build())
            .tools(toolSpecs)
            .build();

        LOG.info("Initialized stateless MCP server with {} tool endpoint(s)", toolSpecs.size());

        jettyServer = new Server();
        ServerConnector connector = new ServerConnector(jettyServer);
        connector.setHost(config.getHost());
        connector.setPort(config.getPort());
        jettyServer.addConnector(connector);

        ServletContextHandler context = new ServletContextHandler(ServletContextHandler.SESSIONS);
        context.setContextPath("/");
        jettyServer.setHandler(context);

        context.addServlet(new ServletHolder(transportProvider), MCP_PATH_SPEC);

        jettyServer.start();

        LOG.info("MCP server started on {}:{} with {} tools available via stateless HTTP transport",
            config.getHost(), config.getPort(), toolSpecs.size());
    }

    private boolean stopServer() {
        boolean success = true;

        if (mcpServer != null) {
            try {
                mcpServer.close();
                LOG.info("MCP server closed successfully");
            } catch (Exception e) {
                LOG.error("Error closing MCP server", e);
                success = false;
            } finally {
                mcpServer = null;
            }
        }

        if (jettyServer != null) {
            try {
                jettyServer.stop();
                jettyServer.join();
                LOG.info("Jetty server stopped successfully");
            } catch (Exception e) {
                LOG.error("Error stopping Jetty server", e);
                success = false;
            } finally {
                jettyServer = null;
            }
        }

        return success;
    }

    /**
     * Returns whether the MCP server is currently running.
     */
    public boolean isRunning() {
        synchronized (lock) {
            return jettyServer != null && jettyServer.isRunning() && mcpServer != null;
        }
    }
}
