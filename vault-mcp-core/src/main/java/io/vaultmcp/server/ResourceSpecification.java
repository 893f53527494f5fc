/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.server;

import io.vaultmcp.spec.VaultSchema;
import io.vaultmcp.util.Assert;

/**
 * A resource definition paired with the function that reads it.
 *
 * @param resource the resource definition advertised by {@code resources/list}
 * @param reader produces the resource contents for the calling session
 */
public record ResourceSpecification(VaultSchema.Resource resource, Reader reader) {

	public ResourceSpecification {
		Assert.notNull(resource, "resource must not be null");
		Assert.hasText(resource.uri(), "resource uri must not be empty");
		Assert.notNull(reader, "reader must not be null");
	}

	@FunctionalInterface
	public interface Reader {

		VaultSchema.ReadResourceResult read(String sessionId) throws Exception;

	}

}
