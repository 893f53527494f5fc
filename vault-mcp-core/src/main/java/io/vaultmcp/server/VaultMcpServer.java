/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.server;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vaultmcp.session.Session;
import io.vaultmcp.session.SessionRegistry;
import io.vaultmcp.spec.VaultSchema;
import io.vaultmcp.transport.ChannelFactory;
import io.vaultmcp.transport.TransportRegistry;
import io.vaultmcp.util.Assert;
import io.vaultmcp.worker.SessionWorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.util.annotation.Nullable;

/**
 * Assembles the session lifecycle components of a vault MCP server: the session and
 * transport registries, the protocol handler pool, the optional worker pool, the
 * {@link RequestRouter} and the periodic idle-session sweeper.
 * <p>
 * In the default single-handler mode one protocol handler serves every session and no
 * worker pool exists. With {@link Builder#concurrentSessions(boolean)} each session gets
 * its own handler, worker-eligible tool calls run on per-session execution contexts and
 * the number of live sessions is capped at {@code maxConnections}.
 */
public class VaultMcpServer implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(VaultMcpServer.class);

	public static final String SESSION_INFO_URI = "vault://session-info";

	public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofSeconds(60);

	private final ObjectMapper objectMapper;

	private final VaultSchema.Implementation serverInfo;

	private final boolean concurrentSessions;

	private final SessionRegistry sessions;

	private final TransportRegistry transports;

	private final ProtocolHandlerPool handlerPool;

	@Nullable
	private final SessionWorkerPool workerPool;

	private final RequestRouter router;

	private final Duration requestTimeout;

	private final ScheduledExecutorService sweeper;

	private final AtomicBoolean closed = new AtomicBoolean(false);

	private VaultMcpServer(Builder builder) {
		this.objectMapper = builder.objectMapper;
		this.serverInfo = builder.serverInfo;
		this.concurrentSessions = builder.concurrentSessions;
		this.requestTimeout = builder.requestTimeout;

		this.workerPool = this.concurrentSessions ? SessionWorkerPool.builder()
			.capacity(builder.maxConnections)
			.maxQueueSize(builder.maxQueueSize)
			.requestTimeout(builder.requestTimeout)
			.build() : null;

		ToolRegistry toolRegistry = new InMemoryToolRegistry(builder.tools);
		ToolInvoker toolInvoker = new ToolInvoker(toolRegistry, this.workerPool);

		List<ResourceSpecification> resources = new ArrayList<>(builder.resources);
		if (this.concurrentSessions) {
			resources.add(new ResourceSpecification(new VaultSchema.Resource(SESSION_INFO_URI, "session-info",
					"Session, connection and worker pool statistics", "application/json"), this::readSessionInfo));
		}

		ProtocolHandlerFactory handlerFactory = ownerId -> new VaultProtocolHandler(ownerId, this.objectMapper,
				this.serverInfo, builder.instructions, toolRegistry, toolInvoker, resources);
		this.handlerPool = this.concurrentSessions
				? new PerSessionProtocolHandlerPool(handlerFactory, builder.maxConnections)
				: new SharedProtocolHandlerPool(handlerFactory);

		this.sessions = new SessionRegistry(this.concurrentSessions ? builder.maxConnections : 0,
				builder.sessionIdleTimeout, builder.clock);
		this.transports = new TransportRegistry();
		this.router = RequestRouter.builder()
			.sessions(this.sessions)
			.transports(this.transports)
			.handlers(this.handlerPool)
			.workerPool(this.workerPool)
			.channelFactory(builder.channelFactory)
			.sessionIdGenerator(builder.sessionIdGenerator)
			.build();

		this.sweeper = Executors.newSingleThreadScheduledExecutor(runnable -> {
			Thread thread = new Thread(runnable, "vault-session-sweeper");
			thread.setDaemon(true);
			return thread;
		});
		long period = builder.sweepInterval.toMillis();
		this.sweeper.scheduleAtFixedRate(this::sweepIdleSessions, period, period, TimeUnit.MILLISECONDS);

		logger.info("Vault MCP server {} {} ready ({} mode)", this.serverInfo.name(), this.serverInfo.version(),
				this.concurrentSessions ? "concurrent" : "single-handler");
	}

	public static Builder builder() {
		return new Builder();
	}

	public RequestRouter getRouter() {
		return this.router;
	}

	public ObjectMapper getObjectMapper() {
		return this.objectMapper;
	}

	public VaultSchema.Implementation getServerInfo() {
		return this.serverInfo;
	}

	public boolean isConcurrentSessions() {
		return this.concurrentSessions;
	}

	public Duration getRequestTimeout() {
		return this.requestTimeout;
	}

	public SessionRegistry getSessions() {
		return this.sessions;
	}

	public TransportRegistry getTransports() {
		return this.transports;
	}

	public ProtocolHandlerPool getHandlerPool() {
		return this.handlerPool;
	}

	public Optional<SessionWorkerPool> getWorkerPool() {
		return Optional.ofNullable(this.workerPool);
	}

	void sweepIdleSessions() {
		try {
			int removed = this.router.sweepIdleSessions();
			if (removed > 0) {
				logger.info("Idle sweep removed {} session(s), {} remaining", removed, this.sessions.size());
			}
		}
		catch (RuntimeException ex) {
			logger.error("Idle session sweep failed", ex);
		}
	}

	/**
	 * Statistics reported by the {@code vault://session-info} resource.
	 * @param sessionId the calling session, may be {@code null}
	 */
	public Map<String, Object> sessionInfo(@Nullable String sessionId) {
		Map<String, Object> info = new LinkedHashMap<>();
		info.put("sessionId", sessionId);
		this.sessions.get(sessionId).ifPresent(session -> info.put("session", describe(session)));

		Map<String, Object> sessionStats = new LinkedHashMap<>();
		sessionStats.put("active", this.sessions.size());
		sessionStats.put("max", this.sessions.getMaxSessions());
		sessionStats.put("idleTimeoutSeconds", this.sessions.getIdleTimeout().toSeconds());
		info.put("sessions", sessionStats);
		info.put("liveConnections", this.transports.liveConnections());

		HandlerPoolStats handlerStats = this.handlerPool.stats();
		Map<String, Object> handlers = new LinkedHashMap<>();
		handlers.put("active", handlerStats.activeHandlers());
		handlers.put("max", handlerStats.maxHandlers());
		handlers.put("totalRequests", handlerStats.totalRequests());
		info.put("handlerPool", handlers);

		getWorkerPool().ifPresent(pool -> {
			var stats = pool.stats();
			Map<String, Object> workers = new LinkedHashMap<>();
			workers.put("activeContexts", stats.activeContexts());
			workers.put("running", stats.running());
			workers.put("queued", stats.queued());
			workers.put("capacity", stats.capacity());
			workers.put("utilization", stats.utilization());
			workers.put("completed", stats.completed());
			workers.put("failed", stats.failed());
			workers.put("timedOut", stats.timedOut());
			info.put("workerPool", workers);
		});
		return info;
	}

	private static Map<String, Object> describe(Session session) {
		Map<String, Object> map = new LinkedHashMap<>();
		map.put("createdAt", session.getCreatedAt().toString());
		map.put("lastActivity", session.getLastActivity().toString());
		map.put("requestCount", session.getRequestCount());
		return map;
	}

	private VaultSchema.ReadResourceResult readSessionInfo(String sessionId) throws JsonProcessingException {
		String text = this.objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(sessionInfo(sessionId));
		return new VaultSchema.ReadResourceResult(
				List.of(new VaultSchema.TextResourceContents(SESSION_INFO_URI, "application/json", text)));
	}

	/**
	 * Stops the sweeper and shuts the router down. Idempotent.
	 */
	@Override
	public void close() {
		if (!this.closed.compareAndSet(false, true)) {
			return;
		}
		logger.info("Closing vault MCP server");
		this.sweeper.shutdownNow();
		this.router.shutdown();
	}

	/**
	 * Builder for {@link VaultMcpServer}.
	 */
	public static class Builder {

		private ObjectMapper objectMapper = new ObjectMapper();

		private VaultSchema.Implementation serverInfo = new VaultSchema.Implementation("vault-mcp", "1.0.0");

		private String instructions;

		private boolean concurrentSessions = false;

		private int maxConnections = SessionWorkerPool.DEFAULT_CAPACITY;

		private int maxQueueSize = SessionWorkerPool.DEFAULT_MAX_QUEUE_SIZE;

		private Duration requestTimeout = SessionWorkerPool.DEFAULT_REQUEST_TIMEOUT;

		private Duration sessionIdleTimeout = SessionRegistry.DEFAULT_IDLE_TIMEOUT;

		private Duration sweepInterval = DEFAULT_SWEEP_INTERVAL;

		private final List<ToolSpecification> tools = new ArrayList<>();

		private final List<ResourceSpecification> resources = new ArrayList<>();

		private Clock clock = Clock.systemUTC();

		private Supplier<String> sessionIdGenerator = () -> UUID.randomUUID().toString();

		private ChannelFactory channelFactory = ChannelFactory.DEFAULT;

		private Builder() {
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "objectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		public Builder serverInfo(String name, String version) {
			Assert.hasText(name, "name must not be empty");
			Assert.hasText(version, "version must not be empty");
			this.serverInfo = new VaultSchema.Implementation(name, version);
			return this;
		}

		public Builder instructions(String instructions) {
			this.instructions = instructions;
			return this;
		}

		public Builder concurrentSessions(boolean concurrentSessions) {
			this.concurrentSessions = concurrentSessions;
			return this;
		}

		/**
		 * Worker pool capacity and live-session cap in concurrent mode.
		 */
		public Builder maxConnections(int maxConnections) {
			Assert.isTrue(maxConnections > 0, "maxConnections must be positive");
			this.maxConnections = maxConnections;
			return this;
		}

		public Builder maxQueueSize(int maxQueueSize) {
			Assert.isTrue(maxQueueSize >= 0, "maxQueueSize must not be negative");
			this.maxQueueSize = maxQueueSize;
			return this;
		}

		public Builder requestTimeout(Duration requestTimeout) {
			Assert.notNull(requestTimeout, "requestTimeout must not be null");
			Assert.isTrue(!requestTimeout.isNegative() && !requestTimeout.isZero(), "requestTimeout must be positive");
			this.requestTimeout = requestTimeout;
			return this;
		}

		public Builder sessionIdleTimeout(Duration sessionIdleTimeout) {
			Assert.notNull(sessionIdleTimeout, "sessionIdleTimeout must not be null");
			this.sessionIdleTimeout = sessionIdleTimeout;
			return this;
		}

		public Builder sweepInterval(Duration sweepInterval) {
			Assert.notNull(sweepInterval, "sweepInterval must not be null");
			Assert.isTrue(!sweepInterval.isNegative() && !sweepInterval.isZero(), "sweepInterval must be positive");
			this.sweepInterval = sweepInterval;
			return this;
		}

		public Builder tool(ToolSpecification tool) {
			Assert.notNull(tool, "tool must not be null");
			this.tools.add(tool);
			return this;
		}

		public Builder tools(List<ToolSpecification> tools) {
			Assert.notNull(tools, "tools must not be null");
			tools.forEach(this::tool);
			return this;
		}

		public Builder resource(ResourceSpecification resource) {
			Assert.notNull(resource, "resource must not be null");
			this.resources.add(resource);
			return this;
		}

		public Builder clock(Clock clock) {
			Assert.notNull(clock, "clock must not be null");
			this.clock = clock;
			return this;
		}

		public Builder sessionIdGenerator(Supplier<String> sessionIdGenerator) {
			Assert.notNull(sessionIdGenerator, "sessionIdGenerator must not be null");
			this.sessionIdGenerator = sessionIdGenerator;
			return this;
		}

		public Builder channelFactory(ChannelFactory channelFactory) {
			Assert.notNull(channelFactory, "channelFactory must not be null");
			this.channelFactory = channelFactory;
			return this;
		}

		public VaultMcpServer build() {
			return new VaultMcpServer(this);
		}

	}

}
