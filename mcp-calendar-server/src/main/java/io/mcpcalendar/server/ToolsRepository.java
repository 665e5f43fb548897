/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpcalendar.server;

import java.util.List;

import io.mcpcalendar.spec.McpSchema;
import reactor.core.publisher.Mono;

/**
 * Repository of the tools a server exposes.
 */
public interface ToolsRepository {

	/**
	 * @return every registered tool, ordered by name so clients see a stable listing
	 */
	Mono<List<McpSchema.Tool>> listTools();

	/**
	 * Resolve a tool specification for execution by name.
	 * @param name The name of the tool to execute
	 * @return A {@link Mono} emitting the specification if found, otherwise empty.
	 */
	Mono<McpServerFeatures.ToolSpecification> resolveToolForCall(String name);

	/**
	 * Add a tool to the repository. A tool with the same name is replaced.
	 * @param tool The tool specification to add
	 */
	void addTool(McpServerFeatures.ToolSpecification tool);

	/**
	 * Remove a tool from the repository by name.
	 * @param name The name of the tool to remove
	 */
	void removeTool(String name);

}
