/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.vault;

import java.util.List;

/**
 * Document store keyed by vault-relative logical paths. Failures surface as
 * {@link VaultStoreException} or, for guarded stores, as
 * {@link io.vaultmcp.vault.security.VaultSecurityException}.
 */
public interface VaultStore {

	/**
	 * Lists the direct children of a folder.
	 * @param directory the folder, empty or {@code null} for the vault root
	 */
	List<VaultEntry> list(String directory);

	VaultDocument read(String path);

	/**
	 * Creates a new file, including missing parent folders.
	 * @throws VaultStoreException if the file already exists
	 */
	VaultDocument create(String path, String content);

	/**
	 * Replaces the content of an existing file.
	 * @throws VaultStoreException if the file does not exist
	 */
	VaultDocument update(String path, String content);

	void delete(String path);

	/**
	 * Case-insensitive substring search over file names and text file contents.
	 * @param query the text to look for
	 * @param limit maximum number of hits
	 */
	List<SearchHit> search(String query, int limit);

	VaultInfo info();

}
