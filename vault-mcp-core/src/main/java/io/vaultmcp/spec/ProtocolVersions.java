/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.spec;

import java.util.List;

/**
 * Protocol revisions known to the server.
 */
public interface ProtocolVersions {

	String MCP_2024_11_05 = "2024-11-05";

	String MCP_2025_06_18 = "2025-06-18";

	/**
	 * Pre-release revision still sent by some early clients. Not negotiable, but tried
	 * last during the compatibility handshake.
	 */
	String LEGACY_1_0 = "1.0";

	String LATEST = MCP_2025_06_18;

	/**
	 * Versions accepted by an explicit {@code initialize}.
	 */
	List<String> SUPPORTED = List.of(MCP_2025_06_18, MCP_2024_11_05);

	/**
	 * Versions tried, in order, when a session has to be initialized on the client's
	 * behalf.
	 */
	List<String> COMPATIBILITY_ATTEMPTS = List.of(MCP_2025_06_18, MCP_2024_11_05, LEGACY_1_0);

}
