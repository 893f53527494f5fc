/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.server;

import java.util.List;

import io.vaultmcp.spec.VaultSchema;
import reactor.core.publisher.Mono;

/**
 * Repository of the tools a server exposes.
 */
public interface ToolRegistry {

	/**
	 * List tools visible to the given session.
	 * @param sessionId the calling session, may be {@code null} for context-free listing
	 * @return A {@link Mono} emitting the visible tools in a stable order
	 */
	Mono<List<VaultSchema.Tool>> listTools(String sessionId);

	/**
	 * Resolve a tool specification for execution by name.
	 * @param name The name of the tool to execute
	 * @param sessionId the calling session
	 * @return A {@link Mono} emitting the {@link ToolSpecification} if found, otherwise
	 * empty
	 */
	Mono<ToolSpecification> resolveToolForCall(String name, String sessionId);

	/**
	 * Add a tool at runtime. A tool with the same name is replaced.
	 */
	void addTool(ToolSpecification tool);

	void removeTool(String name);

}
