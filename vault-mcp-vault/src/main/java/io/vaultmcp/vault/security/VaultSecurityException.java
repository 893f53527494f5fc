/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.vault.security;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import io.vaultmcp.spec.McpError;
import io.vaultmcp.spec.VaultSchema;
import io.vaultmcp.spec.VaultSchema.JSONRPCResponse.JSONRPCError;

/**
 * The vault firewall rejected an operation.
 */
public class VaultSecurityException extends McpError {

	private static final long serialVersionUID = 1L;

	/**
	 * Why an operation was rejected.
	 */
	public enum Reason {

		PERMISSION_DENIED, PATH_BLOCKED, PATH_NOT_ALLOWED, INVALID_PATH, SANDBOX_VIOLATION

	}

	private final Reason reason;

	public VaultSecurityException(Reason reason, VaultOperation operation, String path, String message) {
		super(new JSONRPCError(VaultSchema.ErrorCodes.ACCESS_DENIED, message, data(reason, operation, path)));
		this.reason = reason;
	}

	public Reason getReason() {
		return this.reason;
	}

	private static Map<String, Object> data(Reason reason, VaultOperation operation, String path) {
		Map<String, Object> data = new LinkedHashMap<>();
		data.put("reason", reason.name());
		data.put("operation", operation.name().toLowerCase(Locale.ROOT));
		if (path != null) {
			data.put("path", path);
		}
		return data;
	}

}
