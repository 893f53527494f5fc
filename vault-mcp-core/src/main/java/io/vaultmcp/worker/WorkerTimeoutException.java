/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.worker;

import java.time.Duration;
import java.util.Map;

import io.vaultmcp.spec.McpError;
import io.vaultmcp.spec.VaultSchema;
import io.vaultmcp.spec.VaultSchema.JSONRPCResponse.JSONRPCError;

/**
 * A work item did not complete within the pool's request timeout.
 */
public class WorkerTimeoutException extends McpError {

	private static final long serialVersionUID = 1L;

	public WorkerTimeoutException(WorkItem<?> item, Duration timeout) {
		super(new JSONRPCError(VaultSchema.ErrorCodes.WORKER_TIMEOUT,
				"Request timed out after " + timeout.toMillis() + "ms: " + item.operation(),
				Map.of("workItemId", item.id(), "sessionId", item.sessionId())));
	}

}
