/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.server;

import java.time.Instant;
import java.util.Map;

import io.vaultmcp.spec.VaultSchema;

/**
 * Outcome of the initialize handshake held by a protocol handler.
 *
 * @param protocolVersion the negotiated protocol version
 * @param clientInfo the client's self description, {@code null} for internal handshakes
 * @param clientCapabilities the capabilities the client declared
 * @param internal whether the handshake was performed on the client's behalf
 * @param negotiatedAt when the handshake completed
 */
public record NegotiatedState(String protocolVersion, VaultSchema.Implementation clientInfo,
		Map<String, Object> clientCapabilities, boolean internal, Instant negotiatedAt) {

}
