/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.transport;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import io.vaultmcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps session ids to their live {@link SessionChannel}. The registry never constructs
 * channels; it tracks them and keeps the live-connection counter in step with the
 * mapping.
 */
public class TransportRegistry implements ChannelListener {

	private static final Logger logger = LoggerFactory.getLogger(TransportRegistry.class);

	private final Map<String, SessionChannel> channels = new ConcurrentHashMap<>();

	private final AtomicInteger liveConnections = new AtomicInteger();

	public Optional<SessionChannel> get(String sessionId) {
		if (sessionId == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(this.channels.get(sessionId));
	}

	/**
	 * Binds a channel to a session id.
	 * @throws IllegalStateException if a channel is already bound to the id
	 */
	public void bind(String sessionId, SessionChannel channel) {
		Assert.hasText(sessionId, "sessionId must not be empty");
		Assert.notNull(channel, "channel must not be null");
		SessionChannel existing = this.channels.putIfAbsent(sessionId, channel);
		if (existing != null) {
			throw new IllegalStateException("A channel is already bound to session " + sessionId);
		}
		channel.addListener(this);
		int live = this.liveConnections.incrementAndGet();
		logger.debug("Bound channel for session {} ({} live)", sessionId, live);
	}

	/**
	 * Removes the mapping for a session id. Safe to call when nothing is bound.
	 */
	public Optional<SessionChannel> unbind(String sessionId) {
		if (sessionId == null) {
			return Optional.empty();
		}
		SessionChannel removed = this.channels.remove(sessionId);
		if (removed != null) {
			int live = this.liveConnections.decrementAndGet();
			logger.debug("Unbound channel for session {} ({} live)", sessionId, live);
		}
		return Optional.ofNullable(removed);
	}

	/**
	 * Removes the mapping only while it still refers to {@code channel}.
	 * @return {@code false} when another channel, or none, is bound to the id
	 */
	public boolean unbind(String sessionId, SessionChannel channel) {
		if (sessionId == null || channel == null || !this.channels.remove(sessionId, channel)) {
			return false;
		}
		int live = this.liveConnections.decrementAndGet();
		logger.debug("Unbound channel for session {} ({} live)", sessionId, live);
		return true;
	}

	@Override
	public void onClose(SessionChannel channel) {
		detach(channel);
	}

	@Override
	public void onError(SessionChannel channel, Throwable error) {
		detach(channel);
	}

	private void detach(SessionChannel channel) {
		if (unbind(channel.getSessionId(), channel)) {
			logger.debug("Channel for session {} detached on close", channel.getSessionId());
		}
	}

	/**
	 * Closes every bound channel and clears the table.
	 */
	public void closeAll() {
		List<SessionChannel> snapshot = new ArrayList<>(this.channels.values());
		logger.info("Closing {} channel(s)", snapshot.size());
		for (SessionChannel channel : snapshot) {
			channel.close();
		}
		this.channels.clear();
		this.liveConnections.set(0);
	}

	public int liveConnections() {
		return this.liveConnections.get();
	}

	public int size() {
		return this.channels.size();
	}

}
