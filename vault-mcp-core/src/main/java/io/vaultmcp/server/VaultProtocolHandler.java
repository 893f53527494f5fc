/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.server;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.vaultmcp.spec.McpError;
import io.vaultmcp.spec.ProtocolVersions;
import io.vaultmcp.spec.VaultSchema;
import io.vaultmcp.spec.VaultSchema.JSONRPCNotification;
import io.vaultmcp.spec.VaultSchema.JSONRPCRequest;
import io.vaultmcp.spec.VaultSchema.JSONRPCResponse;
import io.vaultmcp.spec.VaultSchema.JSONRPCResponse.JSONRPCError;
import io.vaultmcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Protocol handler answering the MCP methods of the vault server. Holds the negotiated
 * session state; one instance serves either a single session or, in single-handler
 * mode, every session.
 */
public class VaultProtocolHandler {

	private static final Logger logger = LoggerFactory.getLogger(VaultProtocolHandler.class);

	@FunctionalInterface
	interface RequestHandler<T> {

		Mono<? extends T> handle(String sessionId, Object params);

	}

	private final String ownerId;

	private final ObjectMapper objectMapper;

	private final VaultSchema.Implementation serverInfo;

	private final String instructions;

	private final ToolRegistry tools;

	private final ToolInvoker toolInvoker;

	private final Map<String, ResourceSpecification> resources;

	private final VaultSchema.ServerCapabilities serverCapabilities;

	private final Map<String, RequestHandler<?>> requestHandlers = new HashMap<>();

	private final AtomicReference<NegotiatedState> negotiated = new AtomicReference<>();

	private final AtomicBoolean clientAcknowledged = new AtomicBoolean(false);

	private final AtomicBoolean closed = new AtomicBoolean(false);

	private final AtomicLong requestCount = new AtomicLong();

	/**
	 * Creates a handler.
	 * @param ownerId the session this handler belongs to, or a shared marker
	 * @param objectMapper mapper used to bind request parameters
	 * @param serverInfo name and version reported by {@code initialize}
	 * @param instructions optional usage hints reported by {@code initialize}
	 * @param tools the tool registry
	 * @param toolInvoker executes tool calls
	 * @param resources the readable resources
	 */
	public VaultProtocolHandler(String ownerId, ObjectMapper objectMapper, VaultSchema.Implementation serverInfo,
			String instructions, ToolRegistry tools, ToolInvoker toolInvoker, List<ResourceSpecification> resources) {
		Assert.hasText(ownerId, "ownerId must not be empty");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		Assert.notNull(serverInfo, "serverInfo must not be null");
		Assert.notNull(tools, "tools must not be null");
		Assert.notNull(toolInvoker, "toolInvoker must not be null");
		Assert.notNull(resources, "resources must not be null");
		this.ownerId = ownerId;
		this.objectMapper = objectMapper;
		this.serverInfo = serverInfo;
		this.instructions = instructions;
		this.tools = tools;
		this.toolInvoker = toolInvoker;
		this.resources = new HashMap<>();
		resources.forEach(resource -> this.resources.put(resource.resource().uri(), resource));
		this.serverCapabilities = new VaultSchema.ServerCapabilities(
				this.resources.isEmpty() ? null : new VaultSchema.ServerCapabilities.ResourceCapabilities(false, false),
				new VaultSchema.ServerCapabilities.ToolCapabilities(false));

		this.requestHandlers.put(VaultSchema.METHOD_INITIALIZE, this::initialize);
		this.requestHandlers.put(VaultSchema.METHOD_PING, (sessionId, params) -> Mono.just(Map.of()));
		this.requestHandlers.put(VaultSchema.METHOD_TOOLS_LIST, this::listTools);
		this.requestHandlers.put(VaultSchema.METHOD_TOOLS_CALL, this::callTool);
		if (!this.resources.isEmpty()) {
			this.requestHandlers.put(VaultSchema.METHOD_RESOURCES_LIST, this::listResources);
			this.requestHandlers.put(VaultSchema.METHOD_RESOURCES_READ, this::readResource);
		}
	}

	public Mono<JSONRPCResponse> handleRequest(String sessionId, JSONRPCRequest request) {
		this.requestCount.incrementAndGet();
		RequestHandler<?> requestHandler = this.requestHandlers.get(request.method());
		if (requestHandler == null) {
			JSONRPCError error = new JSONRPCError(VaultSchema.ErrorCodes.METHOD_NOT_FOUND,
					"Method not found: " + request.method(), null);
			return Mono.just(JSONRPCResponse.failure(request.id(), error));
		}
		return Mono.defer(() -> requestHandler.handle(sessionId, request.params()))
			.map(result -> JSONRPCResponse.success(request.id(), result))
			.onErrorResume(t -> {
				JSONRPCError error;
				if (t instanceof McpError mcpError && mcpError.getJsonRpcError() != null) {
					error = mcpError.getJsonRpcError();
				}
				else {
					logger.warn("Request {} of session {} failed", request.method(), sessionId, t);
					error = new JSONRPCError(VaultSchema.ErrorCodes.INTERNAL_ERROR, t.getMessage(), null);
				}
				return Mono.just(JSONRPCResponse.failure(request.id(), error));
			});
	}

	public Mono<Void> handleNotification(String sessionId, JSONRPCNotification notification) {
		if (VaultSchema.METHOD_NOTIFICATION_INITIALIZED.equals(notification.method())) {
			this.clientAcknowledged.set(true);
			logger.debug("Session {} acknowledged initialization", sessionId);
			return Mono.empty();
		}
		logger.warn("Missing handler for notification type: {}", notification.method());
		return Mono.empty();
	}

	/**
	 * Performs the initialize handshake without a client request.
	 * @param protocolVersion the version to accept
	 * @return {@code true} when the version is supported and the state was recorded
	 */
	public boolean handshakeInternally(String protocolVersion) {
		if (this.closed.get() || protocolVersion == null || !ProtocolVersions.SUPPORTED.contains(protocolVersion)) {
			logger.debug("Internal handshake with protocol version {} rejected", protocolVersion);
			return false;
		}
		this.negotiated.set(new NegotiatedState(protocolVersion, null, Map.of(), true, Instant.now()));
		return true;
	}

	private Mono<VaultSchema.InitializeResult> initialize(String sessionId, Object params) {
		VaultSchema.InitializeRequest request = bind(params, VaultSchema.InitializeRequest.class);
		String requested = request == null ? null : request.protocolVersion();
		String version = requested != null && ProtocolVersions.SUPPORTED.contains(requested) ? requested
				: ProtocolVersions.LATEST;
		if (!version.equals(requested)) {
			logger.info("Client of session {} requested protocol version {}, answering with {}", sessionId,
					requested, version);
		}
		Map<String, Object> capabilities = request == null || request.capabilities() == null ? Map.of()
				: request.capabilities();
		this.negotiated.set(new NegotiatedState(version, request == null ? null : request.clientInfo(),
				capabilities, false, Instant.now()));
		return Mono.just(new VaultSchema.InitializeResult(version, this.serverCapabilities, this.serverInfo,
				this.instructions));
	}

	private Mono<VaultSchema.ListToolsResult> listTools(String sessionId, Object params) {
		return this.tools.listTools(sessionId).map(VaultSchema.ListToolsResult::new);
	}

	private Mono<VaultSchema.CallToolResult> callTool(String sessionId, Object params) {
		VaultSchema.CallToolRequest request = bind(params, VaultSchema.CallToolRequest.class);
		if (request == null || request.name() == null) {
			return Mono.error(McpError.builder(VaultSchema.ErrorCodes.INVALID_PARAMS)
				.message("Tool name is required")
				.build());
		}
		return this.toolInvoker.invoke(sessionId, request.name(), request.arguments());
	}

	private Mono<VaultSchema.ListResourcesResult> listResources(String sessionId, Object params) {
		List<VaultSchema.Resource> list = this.resources.values()
			.stream()
			.map(ResourceSpecification::resource)
			.sorted((a, b) -> a.uri().compareTo(b.uri()))
			.toList();
		return Mono.just(new VaultSchema.ListResourcesResult(list));
	}

	private Mono<VaultSchema.ReadResourceResult> readResource(String sessionId, Object params) {
		VaultSchema.ReadResourceRequest request = bind(params, VaultSchema.ReadResourceRequest.class);
		String uri = request == null ? null : request.uri();
		ResourceSpecification specification = uri == null ? null : this.resources.get(uri);
		if (specification == null) {
			return Mono.error(McpError.RESOURCE_NOT_FOUND.apply(String.valueOf(uri)));
		}
		return Mono.fromCallable(() -> specification.reader().read(sessionId))
			.subscribeOn(Schedulers.boundedElastic());
	}

	private <T> T bind(Object params, Class<T> type) {
		if (params == null) {
			return null;
		}
		try {
			return this.objectMapper.convertValue(params, type);
		}
		catch (IllegalArgumentException ex) {
			throw McpError.builder(VaultSchema.ErrorCodes.INVALID_PARAMS)
				.message("Invalid params: " + ex.getMessage())
				.build();
		}
	}

	public Optional<NegotiatedState> getNegotiatedState() {
		return Optional.ofNullable(this.negotiated.get());
	}

	public boolean isClientAcknowledged() {
		return this.clientAcknowledged.get();
	}

	public String getOwnerId() {
		return this.ownerId;
	}

	public long getRequestCount() {
		return this.requestCount.get();
	}

	public boolean isClosed() {
		return this.closed.get();
	}

	/**
	 * Releases the handler. Closed handlers reject internal handshakes.
	 */
	public void close() {
		if (this.closed.compareAndSet(false, true)) {
			logger.debug("Closed protocol handler {}", this.ownerId);
		}
	}

}
