/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpcalendar.server;

import java.util.function.Function;

import io.mcpcalendar.spec.McpSchema;
import reactor.core.publisher.Mono;

/**
 * MCP server features specification that a particular server can choose to support.
 */
public final class McpServerFeatures {

	private McpServerFeatures() {
	}

	/**
	 * Specification of a tool with its asynchronous handler function.
	 *
	 * @param tool The tool definition including name, description, and parameter schema
	 * @param callHandler The function that implements the tool's logic, receiving the
	 * call request and returning the result
	 */
	public record ToolSpecification(McpSchema.Tool tool,
			Function<McpSchema.CallToolRequest, Mono<McpSchema.CallToolResult>> callHandler) {

		public ToolSpecification {
			if (tool == null || tool.name() == null || tool.name().isBlank()) {
				throw new IllegalArgumentException("Tool must have a name");
			}
			if (callHandler == null) {
				throw new IllegalArgumentException("Tool handler must not be null");
			}
		}
	}

}
