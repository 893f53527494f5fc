/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.vault;

import java.time.Instant;

/**
 * A file or folder listed by {@link VaultStore#list(String)}.
 *
 * @param path vault-relative path using {@code /} separators
 * @param name the last path segment
 * @param directory whether the entry is a folder
 * @param size file size in bytes, {@code 0} for folders
 * @param modified last modification time
 */
public record VaultEntry(String path, String name, boolean directory, long size, Instant modified) {

}
