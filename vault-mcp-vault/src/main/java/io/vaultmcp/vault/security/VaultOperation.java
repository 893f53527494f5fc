/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.vault.security;

/**
 * Operation kinds checked by the {@link VaultSecurityManager}.
 */
public enum VaultOperation {

	READ, CREATE, UPDATE, DELETE

}
