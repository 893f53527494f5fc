/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.server;

import io.vaultmcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-handler mode: every session is served by one lazily created handler.
 */
public class SharedProtocolHandlerPool implements ProtocolHandlerPool {

	private static final Logger logger = LoggerFactory.getLogger(SharedProtocolHandlerPool.class);

	static final String SHARED_OWNER = "shared";

	private final ProtocolHandlerFactory factory;

	private volatile VaultProtocolHandler handler;

	public SharedProtocolHandlerPool(ProtocolHandlerFactory factory) {
		Assert.notNull(factory, "factory must not be null");
		this.factory = factory;
	}

	@Override
	public VaultProtocolHandler getOrCreate(String sessionId) {
		VaultProtocolHandler current = this.handler;
		if (current == null) {
			synchronized (this) {
				current = this.handler;
				if (current == null) {
					current = this.factory.create(SHARED_OWNER);
					this.handler = current;
					logger.debug("Created shared protocol handler");
				}
			}
		}
		return current;
	}

	@Override
	public void evict(String sessionId) {
		// the shared handler outlives individual sessions
	}

	@Override
	public synchronized void shutdown() {
		if (this.handler != null) {
			this.handler.close();
			this.handler = null;
		}
	}

	@Override
	public HandlerPoolStats stats() {
		VaultProtocolHandler current = this.handler;
		return new HandlerPoolStats(current == null ? 0 : 1, 1, current == null ? 0 : current.getRequestCount());
	}

}
