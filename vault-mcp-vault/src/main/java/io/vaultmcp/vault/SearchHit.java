/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.vault;

/**
 * A line matching a search query. Matches on the file name carry line {@code 0}.
 *
 * @param path vault-relative path of the file
 * @param line 1-based line number, {@code 0} for a file name match
 * @param snippet the matching line, trimmed
 */
public record SearchHit(String path, int line, String snippet) {

}
