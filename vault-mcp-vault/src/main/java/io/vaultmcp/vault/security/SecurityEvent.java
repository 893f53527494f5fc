/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.vault.security;

import java.time.Instant;

/**
 * Audit log entry of the {@link VaultSecurityManager}.
 *
 * @param timestamp when the check ran
 * @param operation the checked operation
 * @param path the checked path
 * @param allowed whether the operation passed
 * @param reason the rejection reason, {@code null} when allowed
 */
public record SecurityEvent(Instant timestamp, VaultOperation operation, String path, boolean allowed,
		VaultSecurityException.Reason reason) {

}
