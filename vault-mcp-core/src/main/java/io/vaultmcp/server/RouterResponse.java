/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.server;

/**
 * What the HTTP endpoint writes back for a routed message.
 *
 * @param status the HTTP status
 * @param sessionId the session id to echo in the {@code Mcp-Session-Id} header, may be
 * {@code null}
 * @param body the JSON body, {@code null} for an empty response
 */
public record RouterResponse(int status, String sessionId, Object body) {

	public static RouterResponse ok(String sessionId, Object body) {
		return new RouterResponse(200, sessionId, body);
	}

	public static RouterResponse accepted(String sessionId) {
		return new RouterResponse(202, sessionId, null);
	}

}
