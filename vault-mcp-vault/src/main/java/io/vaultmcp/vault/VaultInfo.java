/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.vault;

/**
 * Summary of a vault.
 *
 * @param name the vault name, the root folder's name
 * @param path absolute location of the vault root
 * @param totalFiles number of files
 * @param markdownFiles number of Markdown files
 * @param attachments number of non-Markdown files
 */
public record VaultInfo(String name, String path, int totalFiles, int markdownFiles, int attachments) {

}
