/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.server;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

import io.vaultmcp.spec.VaultSchema;
import io.vaultmcp.util.Assert;
import reactor.core.publisher.Mono;

/**
 * Default in-memory implementation of {@link ToolRegistry}. Every registered tool is
 * visible to every session.
 */
public class InMemoryToolRegistry implements ToolRegistry {

	private final ConcurrentHashMap<String, ToolSpecification> tools = new ConcurrentHashMap<>();

	public InMemoryToolRegistry() {
	}

	public InMemoryToolRegistry(List<ToolSpecification> initialTools) {
		if (initialTools != null) {
			for (ToolSpecification tool : initialTools) {
				addTool(tool);
			}
		}
	}

	@Override
	public Mono<List<VaultSchema.Tool>> listTools(String sessionId) {
		// ConcurrentHashMap does not guarantee iteration order
		List<VaultSchema.Tool> toolList = this.tools.values()
			.stream()
			.map(ToolSpecification::tool)
			.sorted(Comparator.comparing(VaultSchema.Tool::name))
			.toList();
		return Mono.just(toolList);
	}

	@Override
	public Mono<ToolSpecification> resolveToolForCall(String name, String sessionId) {
		return Mono.justOrEmpty(name == null ? null : this.tools.get(name));
	}

	@Override
	public void addTool(ToolSpecification tool) {
		Assert.notNull(tool, "tool must not be null");
		this.tools.put(tool.tool().name(), tool);
	}

	@Override
	public void removeTool(String name) {
		this.tools.remove(name);
	}

}
