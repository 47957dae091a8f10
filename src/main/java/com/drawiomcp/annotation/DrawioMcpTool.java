package com.drawiomcp.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Metadata for drawio MCP tools, read at discovery time to build the MCP
 * tool specification and the configuration key that enables the tool.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface DrawioMcpTool {
	/**
	 * Human-readable tool name used in logs (e.g., "Diagram Overview").
	 */
	String name();

	/**
	 * Short description of what enabling the tool exposes.
	 */
	String description();

	/**
	 * The tool name in the MCP specification, also the key of
	 * {@code tools.<mcpName>.enabled}.
	 */
	String mcpName();

	/**
	 * The description advertised to MCP clients.
	 */
	String mcpDescription();

	/** Display title for MCP clients. */
	String title() default "";

	boolean readOnlyHint() default false;

	boolean destructiveHint() default false;

	boolean idempotentHint() default false;

	boolean openWorldHint() default false;
}
