package com.drawiomcp.tools;

import com.drawiomcp.config.ServerConfig;
import com.drawiomcp.query.DiagramQueryService;

/**
 * Collaborators handed to every tool invocation.
 *
 * @param queryService the diagram query facade
 * @param config       server settings, for argument bounds
 */
public record DrawioToolContext(DiagramQueryService queryService, ServerConfig config) {
}
