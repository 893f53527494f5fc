/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.vault.security;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import io.vaultmcp.util.Assert;

/**
 * Access rules enforced by the {@link VaultSecurityManager}.
 *
 * @param permissions the operations that are allowed at all
 * @param blockedPaths glob patterns ({@code *} wildcard) of paths that are never
 * accessible
 * @param allowedPaths glob patterns restricting access to matching paths; empty allows
 * every path
 * @param sandbox folder prefix every path must start with, {@code null} for none
 */
public record SecuritySettings(Set<VaultOperation> permissions, List<String> blockedPaths, List<String> allowedPaths,
		String sandbox) {

	public SecuritySettings {
		Assert.notNull(permissions, "permissions must not be null");
		permissions = permissions.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(permissions));
		blockedPaths = blockedPaths == null ? List.of() : List.copyOf(blockedPaths);
		allowedPaths = allowedPaths == null ? List.of() : List.copyOf(allowedPaths);
	}

	/**
	 * Every operation allowed, no path restrictions.
	 */
	public static SecuritySettings permissive() {
		return new SecuritySettings(EnumSet.allOf(VaultOperation.class), List.of(), List.of(), null);
	}

	/**
	 * Only {@link VaultOperation#READ} allowed.
	 */
	public static SecuritySettings readOnly() {
		return new SecuritySettings(EnumSet.of(VaultOperation.READ), List.of(), List.of(), null);
	}

	public SecuritySettings withBlockedPaths(List<String> patterns) {
		return new SecuritySettings(this.permissions, patterns, this.allowedPaths, this.sandbox);
	}

	public SecuritySettings withAllowedPaths(List<String> patterns) {
		return new SecuritySettings(this.permissions, this.blockedPaths, patterns, this.sandbox);
	}

	public SecuritySettings withSandbox(String sandbox) {
		return new SecuritySettings(this.permissions, this.blockedPaths, this.allowedPaths, sandbox);
	}

	public boolean isAllowed(VaultOperation operation) {
		return this.permissions.contains(operation);
	}

	public boolean isReadOnly() {
		return this.permissions.equals(Set.of(VaultOperation.READ));
	}

}
