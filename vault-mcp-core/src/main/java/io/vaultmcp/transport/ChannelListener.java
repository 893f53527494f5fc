/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.transport;

/**
 * Receives lifecycle notifications from a {@link SessionChannel}.
 */
public interface ChannelListener {

	/**
	 * Invoked exactly once, when the channel closes.
	 * @param channel the closed channel
	 */
	void onClose(SessionChannel channel);

	/**
	 * Invoked when the channel reports a transport failure, before it closes.
	 * @param channel the failing channel
	 * @param error the failure
	 */
	default void onError(SessionChannel channel, Throwable error) {
	}

}
