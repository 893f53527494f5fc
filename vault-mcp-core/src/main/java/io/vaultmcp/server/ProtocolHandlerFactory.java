/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.server;

/**
 * Creates protocol handlers for the {@link ProtocolHandlerPool}.
 */
@FunctionalInterface
public interface ProtocolHandlerFactory {

	VaultProtocolHandler create(String ownerId);

}
