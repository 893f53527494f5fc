/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.server;

/**
 * Point-in-time view of a {@link ProtocolHandlerPool}.
 *
 * @param activeHandlers handlers currently alive
 * @param maxHandlers configured maximum, {@code 1} for the shared pool
 * @param totalRequests requests handled since start, by live and evicted handlers
 */
public record HandlerPoolStats(int activeHandlers, int maxHandlers, long totalRequests) {

}
