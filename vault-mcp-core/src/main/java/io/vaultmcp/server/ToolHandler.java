/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.server;

import java.util.Map;

import io.vaultmcp.spec.VaultSchema.CallToolResult;

/**
 * Blocking implementation of a tool.
 */
@FunctionalInterface
public interface ToolHandler {

	/**
	 * Executes the tool.
	 * @param sessionId the calling session
	 * @param arguments the call arguments, never {@code null}
	 * @return the tool result
	 * @throws Exception any failure, reported to the client as a JSON-RPC error
	 */
	CallToolResult apply(String sessionId, Map<String, Object> arguments) throws Exception;

}
