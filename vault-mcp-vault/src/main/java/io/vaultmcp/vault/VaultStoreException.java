/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.vault;

import java.util.Map;

import io.vaultmcp.spec.McpError;
import io.vaultmcp.spec.VaultSchema;
import io.vaultmcp.spec.VaultSchema.JSONRPCResponse.JSONRPCError;

/**
 * A document store operation failed.
 */
public class VaultStoreException extends McpError {

	private static final long serialVersionUID = 1L;

	public VaultStoreException(int code, String message, String path) {
		super(new JSONRPCError(code, message, path == null ? null : Map.of("path", path)));
	}

	public VaultStoreException(String message, String path, Throwable cause) {
		this(VaultSchema.ErrorCodes.INTERNAL_ERROR, message, path);
		initCause(cause);
	}

	public static VaultStoreException notFound(String path) {
		return new VaultStoreException(VaultSchema.ErrorCodes.RESOURCE_NOT_FOUND, "File not found: " + path, path);
	}

	public static VaultStoreException alreadyExists(String path) {
		return new VaultStoreException(VaultSchema.ErrorCodes.INVALID_PARAMS, "File already exists: " + path, path);
	}

	public static VaultStoreException invalidPath(String path, String reason) {
		return new VaultStoreException(VaultSchema.ErrorCodes.INVALID_PARAMS, "Invalid path '" + path + "': " + reason,
				path);
	}

}
