/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.app;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.vaultmcp.server.transport.HttpServletVaultEndpoint;
import io.vaultmcp.spec.VaultSchema;
import io.vaultmcp.util.Assert;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Answers the health check on {@code /} and the well-known discovery document that
 * points clients at the MCP endpoint.
 */
public class ServerInfoServlet extends HttpServlet {

	private static final long serialVersionUID = 1L;

	public static final String HEALTH_PATH = "/";

	public static final String DISCOVERY_PATH = "/.well-known/appspecific/com.mcp.vault-mcp";

	private final transient ObjectMapper objectMapper;

	private final VaultSchema.Implementation serverInfo;

	private final String vaultName;

	private final transient Clock clock;

	public ServerInfoServlet(ObjectMapper objectMapper, VaultSchema.Implementation serverInfo, String vaultName,
			Clock clock) {
		Assert.notNull(objectMapper, "objectMapper must not be null");
		Assert.notNull(serverInfo, "serverInfo must not be null");
		Assert.notNull(clock, "clock must not be null");
		this.objectMapper = objectMapper;
		this.serverInfo = serverInfo;
		this.vaultName = vaultName;
		this.clock = clock;
	}

	@Override
	protected void doGet(HttpServletRequest request, HttpServletResponse response)
			throws ServletException, IOException {
		String path = pathWithinContext(request);
		if (DISCOVERY_PATH.equals(path)) {
			write(response, HttpServletResponse.SC_OK, discovery(request));
		}
		else if (path.isEmpty() || HEALTH_PATH.equals(path)) {
			write(response, HttpServletResponse.SC_OK, health());
		}
		else {
			write(response, HttpServletResponse.SC_NOT_FOUND, Map.of("error", "Not found"));
		}
	}

	Map<String, Object> health() {
		Map<String, Object> health = new LinkedHashMap<>();
		health.put("name", this.serverInfo.name());
		health.put("version", this.serverInfo.version());
		health.put("status", "running");
		health.put("vault", this.vaultName);
		health.put("timestamp", Instant.now(this.clock).toString());
		return health;
	}

	Map<String, Object> discovery(HttpServletRequest request) {
		String base = request.getScheme() + "://" + request.getServerName() + ":" + request.getServerPort()
				+ request.getContextPath();
		Map<String, Object> discovery = new LinkedHashMap<>();
		discovery.put("endpoint", base + HttpServletVaultEndpoint.DEFAULT_ENDPOINT);
		discovery.put("protocol", "mcp");
		discovery.put("method", "POST");
		discovery.put("contentType", HttpServletVaultEndpoint.APPLICATION_JSON);
		return discovery;
	}

	private static String pathWithinContext(HttpServletRequest request) {
		String uri = request.getRequestURI() == null ? "" : request.getRequestURI();
		String contextPath = request.getContextPath() == null ? "" : request.getContextPath();
		return uri.startsWith(contextPath) ? uri.substring(contextPath.length()) : uri;
	}

	private void write(HttpServletResponse response, int status, Object body) throws IOException {
		response.setStatus(status);
		response.setContentType(HttpServletVaultEndpoint.APPLICATION_JSON);
		response.setCharacterEncoding(HttpServletVaultEndpoint.UTF_8);
		response.getWriter().write(this.objectMapper.writeValueAsString(body));
		response.getWriter().flush();
	}

}
