/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpcalendar.server;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

import io.mcpcalendar.spec.McpSchema;
import reactor.core.publisher.Mono;

/**
 * Default in-memory implementation of {@link ToolsRepository}, backed by a
 * {@link ConcurrentHashMap}.
 */
public class InMemoryToolsRepository implements ToolsRepository {

	private final ConcurrentHashMap<String, McpServerFeatures.ToolSpecification> tools = new ConcurrentHashMap<>();

	public InMemoryToolsRepository() {
	}

	/**
	 * @param initialTools tools to register up front
	 */
	public InMemoryToolsRepository(List<McpServerFeatures.ToolSpecification> initialTools) {
		if (initialTools != null) {
			initialTools.forEach(this::addTool);
		}
	}

	@Override
	public Mono<List<McpSchema.Tool>> listTools() {
		// ConcurrentHashMap does not guarantee iteration order
		return Mono.fromSupplier(() -> this.tools.values()
			.stream()
			.map(McpServerFeatures.ToolSpecification::tool)
			.sorted(Comparator.comparing(McpSchema.Tool::name))
			.toList());
	}

	@Override
	public Mono<McpServerFeatures.ToolSpecification> resolveToolForCall(String name) {
		return Mono.justOrEmpty(name).mapNotNull(this.tools::get);
	}

	@Override
	public void addTool(McpServerFeatures.ToolSpecification tool) {
		// Last-write-wins policy
		this.tools.put(tool.tool().name(), tool);
	}

	@Override
	public void removeTool(String name) {
		this.tools.remove(name);
	}

}
