/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.server.transport;

import java.io.IOException;
import java.io.PrintWriter;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vaultmcp.server.RequestRouter;
import io.vaultmcp.server.RouterResponse;
import io.vaultmcp.server.VaultMcpServer;
import io.vaultmcp.spec.HttpHeaders;
import io.vaultmcp.spec.VaultSchema;
import io.vaultmcp.spec.VaultSchema.JSONRPCMessage;
import io.vaultmcp.spec.VaultSchema.JSONRPCNotification;
import io.vaultmcp.spec.VaultSchema.JSONRPCRequest;
import io.vaultmcp.spec.VaultSchema.JSONRPCResponse;
import io.vaultmcp.spec.VaultSchema.JSONRPCResponse.JSONRPCError;
import io.vaultmcp.util.Assert;
import jakarta.servlet.ServletException;
import jakarta.servlet.annotation.WebServlet;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Servlet exposing a {@link VaultMcpServer} over HTTP.
 * <ul>
 * <li>{@code POST} carries one JSON-RPC message. Requests are answered with a JSON-RPC
 * response, notifications with {@code 202 Accepted}.</li>
 * <li>{@code GET} describes the endpoint.</li>
 * <li>{@code DELETE} closes the session named by the {@code Mcp-Session-Id}
 * header.</li>
 * </ul>
 * The session id assigned or reused by the router is echoed in the
 * {@code Mcp-Session-Id} response header.
 */
@WebServlet(asyncSupported = true)
public class HttpServletVaultEndpoint extends HttpServlet {

	private static final Logger logger = LoggerFactory.getLogger(HttpServletVaultEndpoint.class);

	private static final long serialVersionUID = 1L;

	public static final String DEFAULT_ENDPOINT = "/mcp";

	public static final String APPLICATION_JSON = "application/json";

	public static final String UTF_8 = "UTF-8";

	// added to the worker timeout when blocking on a routed message
	private static final Duration RESPONSE_MARGIN = Duration.ofSeconds(5);

	private final transient RequestRouter router;

	private final transient ObjectMapper objectMapper;

	private final Duration responseTimeout;

	public HttpServletVaultEndpoint(VaultMcpServer server) {
		this(server.getRouter(), server.getObjectMapper(), server.getRequestTimeout().plus(RESPONSE_MARGIN));
	}

	public HttpServletVaultEndpoint(RequestRouter router, ObjectMapper objectMapper, Duration responseTimeout) {
		Assert.notNull(router, "router must not be null");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		Assert.notNull(responseTimeout, "responseTimeout must not be null");
		this.router = router;
		this.objectMapper = objectMapper;
		this.responseTimeout = responseTimeout;
	}

	@Override
	protected void doPost(HttpServletRequest request, HttpServletResponse response)
			throws ServletException, IOException {
		String sessionId = request.getHeader(HttpHeaders.MCP_SESSION_ID);

		JSONRPCMessage message;
		try {
			// Jackson detects the JSON encoding from the raw bytes, UTF-8 unless marked otherwise
			JsonNode node = this.objectMapper.readTree(request.getInputStream());
			if (node == null || node.isMissingNode()) {
				throw new IllegalArgumentException("Empty request body");
			}
			if (node.isArray()) {
				writeJson(response, 400, sessionId, JSONRPCResponse.failure(null, new JSONRPCError(
						VaultSchema.ErrorCodes.INVALID_REQUEST, "Batch requests are not supported", null)));
				return;
			}
			message = VaultSchema.deserializeJsonRpcMessage(this.objectMapper, node);
		}
		catch (JsonProcessingException | IllegalArgumentException ex) {
			logger.debug("Rejecting unparseable message: {}", ex.getMessage());
			writeJson(response, 400, sessionId, JSONRPCResponse.failure(null,
					new JSONRPCError(VaultSchema.ErrorCodes.PARSE_ERROR, "Parse error", ex.getMessage())));
			return;
		}

		Mono<RouterResponse> routed;
		if (message instanceof JSONRPCRequest jsonRpcRequest) {
			logger.debug("Request {} for session {}", jsonRpcRequest.method(), sessionId);
			routed = this.router.route(sessionId, jsonRpcRequest);
		}
		else if (message instanceof JSONRPCNotification notification) {
			routed = this.router.routeNotification(sessionId, notification);
		}
		else {
			writeJson(response, 400, sessionId, JSONRPCResponse.failure(null, new JSONRPCError(
					VaultSchema.ErrorCodes.INVALID_REQUEST, "Responses are not accepted by this endpoint", null)));
			return;
		}

		RouterResponse result;
		try {
			result = routed.block(this.responseTimeout);
		}
		catch (RuntimeException ex) {
			logger.error("Failed to process message for session {}", sessionId, ex);
			result = new RouterResponse(500, sessionId, JSONRPCResponse.failure(null, new JSONRPCError(
					VaultSchema.ErrorCodes.INTERNAL_ERROR, "Internal error: " + ex.getMessage(), null)));
		}
		if (result == null) {
			response.setStatus(HttpServletResponse.SC_ACCEPTED);
			return;
		}

		try {
			writeJson(response, result.status(), result.sessionId(), result.body());
		}
		catch (IOException ex) {
			logger.warn("Failed to write response for session {}", result.sessionId(), ex);
			this.router.reportTransportError(result.sessionId(), ex);
			throw ex;
		}
	}

	@Override
	protected void doGet(HttpServletRequest request, HttpServletResponse response)
			throws ServletException, IOException {
		Map<String, Object> discovery = new LinkedHashMap<>();
		discovery.put("message", "Vault MCP endpoint");
		discovery.put("usage", "POST JSON-RPC 2.0 messages to this endpoint");
		discovery.put("protocol", "Model Context Protocol");
		discovery.put("transport", "streamable-http");
		discovery.put("sessionHeader", HttpHeaders.MCP_SESSION_ID);
		writeJson(response, HttpServletResponse.SC_OK, null, discovery);
	}

	@Override
	protected void doDelete(HttpServletRequest request, HttpServletResponse response)
			throws ServletException, IOException {
		String sessionId = request.getHeader(HttpHeaders.MCP_SESSION_ID);
		if (this.router.closeSession(sessionId)) {
			writeJson(response, HttpServletResponse.SC_OK, null, Map.of("message", "Session closed"));
		}
		else {
			writeJson(response, HttpServletResponse.SC_NOT_FOUND, null, Map.of("error", "Session not found"));
		}
	}

	private void writeJson(HttpServletResponse response, int status, String sessionId, Object body)
			throws IOException {
		response.setStatus(status);
		if (sessionId != null) {
			response.setHeader(HttpHeaders.MCP_SESSION_ID, sessionId);
		}
		if (body == null) {
			return;
		}
		response.setContentType(APPLICATION_JSON);
		response.setCharacterEncoding(UTF_8);
		PrintWriter writer = response.getWriter();
		writer.write(this.objectMapper.writeValueAsString(body));
		writer.flush();
	}

}
