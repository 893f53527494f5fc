/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.worker;

import java.util.Map;

import io.vaultmcp.spec.McpError;
import io.vaultmcp.spec.VaultSchema;
import io.vaultmcp.spec.VaultSchema.JSONRPCResponse.JSONRPCError;

/**
 * The worker pool cannot admit another item. Clients should retry later.
 */
public class WorkerCapacityException extends McpError {

	private static final long serialVersionUID = 1L;

	public WorkerCapacityException(int capacity, int maxQueueSize) {
		super(new JSONRPCError(VaultSchema.ErrorCodes.CAPACITY_EXCEEDED,
				"Server at capacity, retry later",
				Map.of("capacity", capacity, "maxQueueSize", maxQueueSize)));
	}

	public WorkerCapacityException(String message) {
		super(new JSONRPCError(VaultSchema.ErrorCodes.CAPACITY_EXCEEDED, message, null));
	}

}
