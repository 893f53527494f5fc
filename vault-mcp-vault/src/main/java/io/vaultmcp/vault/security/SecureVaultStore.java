/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.vault.security;

import java.util.List;

import io.vaultmcp.util.Assert;
import io.vaultmcp.vault.SearchHit;
import io.vaultmcp.vault.VaultDocument;
import io.vaultmcp.vault.VaultEntry;
import io.vaultmcp.vault.VaultInfo;
import io.vaultmcp.vault.VaultStore;

/**
 * {@link VaultStore} decorator that passes every operation through a
 * {@link VaultSecurityManager} first. Listings and search results omit paths the
 * caller could not read.
 */
public class SecureVaultStore implements VaultStore {

	private final VaultStore delegate;

	private final VaultSecurityManager securityManager;

	public SecureVaultStore(VaultStore delegate, VaultSecurityManager securityManager) {
		Assert.notNull(delegate, "delegate must not be null");
		Assert.notNull(securityManager, "securityManager must not be null");
		this.delegate = delegate;
		this.securityManager = securityManager;
	}

	public VaultSecurityManager getSecurityManager() {
		return this.securityManager;
	}

	@Override
	public List<VaultEntry> list(String directory) {
		String validated = this.securityManager.validate(VaultOperation.READ, directory);
		return this.delegate.list(validated)
			.stream()
			.filter(entry -> this.securityManager.isReadable(entry.path()))
			.toList();
	}

	@Override
	public VaultDocument read(String path) {
		return this.delegate.read(this.securityManager.validate(VaultOperation.READ, path));
	}

	@Override
	public VaultDocument create(String path, String content) {
		return this.delegate.create(this.securityManager.validate(VaultOperation.CREATE, path), content);
	}

	@Override
	public VaultDocument update(String path, String content) {
		return this.delegate.update(this.securityManager.validate(VaultOperation.UPDATE, path), content);
	}

	@Override
	public void delete(String path) {
		this.delegate.delete(this.securityManager.validate(VaultOperation.DELETE, path));
	}

	@Override
	public List<SearchHit> search(String query, int limit) {
		this.securityManager.validate(VaultOperation.READ, null);
		return this.delegate.search(query, limit)
			.stream()
			.filter(hit -> this.securityManager.isReadable(hit.path()))
			.toList();
	}

	@Override
	public VaultInfo info() {
		this.securityManager.validate(VaultOperation.READ, null);
		return this.delegate.info();
	}

}
