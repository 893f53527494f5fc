/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.server;

/**
 * Source of the {@link VaultProtocolHandler} serving a session.
 */
public interface ProtocolHandlerPool {

	/**
	 * Returns the handler for a session, creating it on first use. Repeated calls for the
	 * same id return the same instance until it is evicted.
	 */
	VaultProtocolHandler getOrCreate(String sessionId);

	/**
	 * Releases the handler of a session, if the pool keeps one per session.
	 */
	void evict(String sessionId);

	/**
	 * Closes every handler.
	 */
	void shutdown();

	HandlerPoolStats stats();

}
