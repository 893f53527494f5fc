/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.vault;

import java.time.Instant;

/**
 * Contents of a vault file.
 *
 * @param path vault-relative path
 * @param content the file text
 * @param size file size in bytes
 * @param modified last modification time
 */
public record VaultDocument(String path, String content, long size, Instant modified) {

}
