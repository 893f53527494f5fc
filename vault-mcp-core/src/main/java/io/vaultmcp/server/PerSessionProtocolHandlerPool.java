/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.server;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import io.vaultmcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps one protocol handler per session so negotiated state never crosses sessions.
 */
public class PerSessionProtocolHandlerPool implements ProtocolHandlerPool {

	private static final Logger logger = LoggerFactory.getLogger(PerSessionProtocolHandlerPool.class);

	private final Map<String, VaultProtocolHandler> handlers = new ConcurrentHashMap<>();

	private final ProtocolHandlerFactory factory;

	private final int maxHandlers;

	private final AtomicLong created = new AtomicLong();

	// requests served by handlers that were evicted
	private final AtomicLong retiredRequests = new AtomicLong();

	public PerSessionProtocolHandlerPool(ProtocolHandlerFactory factory, int maxHandlers) {
		Assert.notNull(factory, "factory must not be null");
		Assert.isTrue(maxHandlers > 0, "maxHandlers must be positive");
		this.factory = factory;
		this.maxHandlers = maxHandlers;
	}

	@Override
	public VaultProtocolHandler getOrCreate(String sessionId) {
		Assert.hasText(sessionId, "sessionId must not be empty");
		return this.handlers.computeIfAbsent(sessionId, id -> {
			VaultProtocolHandler handler = this.factory.create(id);
			long count = this.created.incrementAndGet();
			logger.debug("Created protocol handler for session {} ({} created so far)", id, count);
			return handler;
		});
	}

	@Override
	public void evict(String sessionId) {
		if (sessionId == null) {
			return;
		}
		VaultProtocolHandler handler = this.handlers.remove(sessionId);
		if (handler != null) {
			this.retiredRequests.addAndGet(handler.getRequestCount());
			handler.close();
			logger.debug("Evicted protocol handler of session {}", sessionId);
		}
	}

	@Override
	public void shutdown() {
		List<String> ids = new ArrayList<>(this.handlers.keySet());
		logger.info("Shutting down {} protocol handler(s)", ids.size());
		ids.forEach(this::evict);
	}

	@Override
	public HandlerPoolStats stats() {
		long live = this.handlers.values().stream().mapToLong(VaultProtocolHandler::getRequestCount).sum();
		return new HandlerPoolStats(this.handlers.size(), this.maxHandlers, live + this.retiredRequests.get());
	}

	/**
	 * Number of handlers constructed since start.
	 */
	public long createdCount() {
		return this.created.get();
	}

}
