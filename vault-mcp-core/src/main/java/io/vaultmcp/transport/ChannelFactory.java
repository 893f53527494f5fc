/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.transport;

import io.vaultmcp.server.VaultProtocolHandler;

/**
 * Creates the channel binding a session to its protocol handler.
 */
@FunctionalInterface
public interface ChannelFactory {

	ChannelFactory DEFAULT = SessionChannel::new;

	SessionChannel create(String sessionId, VaultProtocolHandler handler);

}
