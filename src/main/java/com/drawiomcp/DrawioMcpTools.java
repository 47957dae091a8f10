package com.drawiomcp;

import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.drawiomcp.annotation.DrawioMcpTool;
import com.drawiomcp.config.ServerConfig;
import com.drawiomcp.tools.BaseMcpTool;
import com.drawiomcp.tools.DrawioToolContext;

import io.modelcontextprotocol.server.McpStatelessServerFeatures.AsyncToolSpecification;

/**
 * Discovers the {@link BaseMcpTool} implementations registered with
 * {@link ServiceLoader}, drops those disabled in the {@link ServerConfig} and
 * builds the MCP specification of the rest.
 */
public class DrawioMcpTools {

	private static final Logger LOG = LoggerFactory.getLogger(DrawioMcpTools.class);

	private final DrawioToolContext context;

	/**
	 * @param context the query service and configuration handed to every tool
	 */
	public DrawioMcpTools(DrawioToolContext context) {
		this.context = context;
	}

	/**
	 * Loads every registered tool and generates its {@link AsyncToolSpecification}.
	 * Tools without the {@link DrawioMcpTool} annotation, tools disabled through
	 * {@code tools.<mcpName>.enabled=false} and tools whose specification cannot
	 * be built are left out.
	 *
	 * @return the specifications of all enabled tools
	 */
	public List<AsyncToolSpecification> getAvailableToolSpecifications() {
		return ServiceLoader.load(BaseMcpTool.class).stream()
				.filter(provider -> {
					Class<? extends BaseMcpTool> toolClass = provider.type();
					DrawioMcpTool toolAnnotation = toolClass.getAnnotation(DrawioMcpTool.class);
					if (toolAnnotation == null) {
						LOG.warn("Tool class {} is missing @DrawioMcpTool annotation. Skipping inclusion.",
								toolClass.getSimpleName());
						return false;
					}

					boolean isEnabled = context.config().isToolEnabled(toolAnnotation.mcpName());
					if (!isEnabled) {
						LOG.info("Tool '{}' is disabled via configuration.", toolAnnotation.mcpName());
					}
					return isEnabled;
				})
				.map(provider -> {
					try {
						return provider.get().specification(context);
					} catch (Exception e) {
						LOG.error("Error getting specification for tool: {}", provider.type().getSimpleName(), e);
						return null;
					}
				})
				.filter(Objects::nonNull)
				.collect(Collectors.toList());
	}
}
