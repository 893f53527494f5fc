/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.server;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import io.vaultmcp.session.Session;
import io.vaultmcp.session.SessionRegistry;
import io.vaultmcp.spec.ChannelException;
import io.vaultmcp.spec.ProtocolVersions;
import io.vaultmcp.spec.VaultSchema;
import io.vaultmcp.spec.VaultSchema.JSONRPCNotification;
import io.vaultmcp.spec.VaultSchema.JSONRPCRequest;
import io.vaultmcp.spec.VaultSchema.JSONRPCResponse;
import io.vaultmcp.spec.VaultSchema.JSONRPCResponse.JSONRPCError;
import io.vaultmcp.transport.ChannelFactory;
import io.vaultmcp.transport.SessionChannel;
import io.vaultmcp.transport.TransportRegistry;
import io.vaultmcp.util.Assert;
import io.vaultmcp.util.StripedLocks;
import io.vaultmcp.util.Utils;
import io.vaultmcp.worker.SessionWorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

/**
 * Decides, for every incoming message, which session and channel serve it.
 * <p>
 * Resolution follows a fixed order:
 * <ol>
 * <li>{@code session/ping} and {@code status/ping} are answered directly and never
 * create anything.</li>
 * <li>A known id with a live channel reuses that channel.</li>
 * <li>A known id without a channel gets a new channel; an {@code initialize} request is
 * a reconnection, anything else is an orphaned reference that is initialized on the
 * client's behalf.</li>
 * <li>No id and an {@code initialize} request provisions a fresh session.</li>
 * <li>No id and any other request provisions a fresh session and initializes it on the
 * client's behalf, trying each known protocol version in turn. Failure of every attempt
 * is tolerated and the request is forwarded anyway.</li>
 * </ol>
 * A forwarded request that still meets an uninitialized channel is answered with HTTP
 * 400 and {@link VaultSchema.ErrorCodes#NOT_INITIALIZED}. Resolution for one id runs
 * under a per-id lock; dispatch runs outside it.
 */
public class RequestRouter {

	private static final Logger logger = LoggerFactory.getLogger(RequestRouter.class);

	static final String NO_ACTIVE_TRANSPORT_MESSAGE = "No active transport/session. Please initialize and retry.";

	private static final int DEFAULT_LOCK_STRIPES = 64;

	private final SessionRegistry sessions;

	private final TransportRegistry transports;

	private final ProtocolHandlerPool handlers;

	@Nullable
	private final SessionWorkerPool workerPool;

	private final ChannelFactory channelFactory;

	private final Supplier<String> sessionIdGenerator;

	private final StripedLocks locks;

	private final AtomicBoolean accepting = new AtomicBoolean(true);

	private RequestRouter(Builder builder) {
		this.sessions = builder.sessions;
		this.transports = builder.transports;
		this.handlers = builder.handlers;
		this.workerPool = builder.workerPool;
		this.channelFactory = builder.channelFactory;
		this.sessionIdGenerator = builder.sessionIdGenerator;
		this.locks = new StripedLocks(builder.lockStripes);
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Routes a request.
	 * @param sessionId the {@code Mcp-Session-Id} presented by the client, may be
	 * {@code null}
	 * @param request the request
	 * @return the response to write; never an error signal
	 */
	public Mono<RouterResponse> route(@Nullable String sessionId, JSONRPCRequest request) {
		String presentedId = Utils.hasText(sessionId) ? sessionId : null;
		return Mono.defer(() -> doRoute(presentedId, request)).onErrorResume(error -> {
			logger.error("Failed to route {} for session {}", request.method(), presentedId, error);
			return Mono.just(internalError(presentedId, error));
		});
	}

	private Mono<RouterResponse> doRoute(@Nullable String sessionId, JSONRPCRequest request) {
		if (!this.accepting.get()) {
			return Mono.just(noActiveTransport(sessionId, request.id()));
		}
		if (isKeepalive(request.method())) {
			this.sessions.touch(sessionId);
			Map<String, Object> result = new LinkedHashMap<>();
			result.put("ok", true);
			result.put("sessionId", sessionId);
			return Mono.just(RouterResponse.ok(sessionId, JSONRPCResponse.success(request.id(), result)));
		}

		boolean handshake = VaultSchema.METHOD_INITIALIZE.equals(request.method());
		Resolution resolution = resolve(sessionId, handshake);
		retire(resolution.evicted());
		SessionChannel channel = resolution.channel();
		String effectiveId = resolution.sessionId();
		if (channel == null) {
			return Mono.just(noActiveTransport(effectiveId, request.id()));
		}

		return channel.dispatch(request)
			.map(response -> toRouterResponse(effectiveId, response))
			.switchIfEmpty(Mono.fromSupplier(() -> noActiveTransport(effectiveId, request.id())))
			.onErrorResume(ChannelException.class, ex -> {
				channel.fail(ex);
				return Mono.just(internalError(effectiveId, ex));
			});
	}

	/**
	 * Delivers a notification. Notifications never provision sessions; those addressed
	 * to a session without a channel are dropped.
	 */
	public Mono<RouterResponse> routeNotification(@Nullable String sessionId, JSONRPCNotification notification) {
		String presentedId = Utils.hasText(sessionId) ? sessionId : null;
		return Mono.defer(() -> {
			if (isKeepalive(notification.method())) {
				this.sessions.touch(presentedId);
				return Mono.just(RouterResponse.accepted(presentedId));
			}
			Optional<SessionChannel> channel = this.transports.get(presentedId);
			if (!this.accepting.get() || channel.isEmpty()) {
				logger.debug("Dropping notification {} for session {} without a channel", notification.method(),
						presentedId);
				return Mono.just(RouterResponse.accepted(presentedId));
			}
			this.sessions.touch(presentedId);
			return channel.get().accept(notification).thenReturn(RouterResponse.accepted(presentedId));
		}).onErrorResume(error -> {
			logger.error("Failed to deliver notification {} for session {}", notification.method(), presentedId,
					error);
			return Mono.just(internalError(presentedId, error));
		});
	}

	private Resolution resolve(@Nullable String sessionId, boolean handshake) {
		if (sessionId != null) {
			return this.locks.withLock(sessionId, () -> resolveKnownId(sessionId, handshake));
		}
		String freshId = this.sessionIdGenerator.get();
		return this.locks.withLock(freshId, () -> provision(freshId, handshake));
	}

	// must hold the lock of sessionId
	private Resolution resolveKnownId(String sessionId, boolean handshake) {
		Optional<SessionChannel> existing = this.transports.get(sessionId);
		if (existing.isPresent()) {
			SessionChannel channel = existing.get();
			if (!channel.isClosed()) {
				// a swept session whose teardown has not run yet is revived here
				List<Session> evicted = List.of();
				if (this.sessions.contains(sessionId)) {
					this.sessions.touch(sessionId);
				}
				else {
					this.sessions.createOrGet(sessionId);
					evicted = this.sessions.evictIfOverCapacity(sessionId);
				}
				return new Resolution(sessionId, channel, evicted);
			}
			this.transports.unbind(sessionId, channel);
		}
		if (handshake) {
			logger.info("Re-establishing channel for session {}", sessionId);
		}
		else {
			logger.info("Request for session {} without a channel, initializing on the client's behalf", sessionId);
		}
		return provision(sessionId, handshake);
	}

	// must hold the lock of sessionId
	private Resolution provision(String sessionId, boolean handshake) {
		boolean isNew = !this.sessions.contains(sessionId);
		this.sessions.createOrGet(sessionId);
		SessionChannel channel;
		try {
			VaultProtocolHandler handler = this.handlers.getOrCreate(sessionId);
			channel = this.channelFactory.create(sessionId, handler);
			this.transports.bind(sessionId, channel);
		}
		catch (RuntimeException ex) {
			if (isNew) {
				this.sessions.remove(sessionId);
				this.handlers.evict(sessionId);
			}
			throw ex;
		}
		List<Session> evicted = List.of();
		if (isNew) {
			evicted = this.sessions.evictIfOverCapacity(sessionId);
		}
		else {
			this.sessions.touch(sessionId);
		}
		if (!handshake) {
			compatibilityHandshake(channel);
		}
		return new Resolution(sessionId, channel, evicted);
	}

	private void compatibilityHandshake(SessionChannel channel) {
		for (String version : ProtocolVersions.COMPATIBILITY_ATTEMPTS) {
			try {
				if (channel.handshakeInternally(version)) {
					logger.debug("Compatibility handshake for session {} succeeded with protocol version {}",
							channel.getSessionId(), version);
					return;
				}
				logger.debug("Compatibility handshake for session {} rejected protocol version {}",
						channel.getSessionId(), version);
			}
			catch (RuntimeException ex) {
				logger.warn("Compatibility handshake for session {} failed with protocol version {}",
						channel.getSessionId(), version, ex);
			}
		}
		logger.warn("Compatibility handshake failed for session {}, forwarding the request uninitialized",
				channel.getSessionId());
	}

	/**
	 * Closes a session on client request.
	 * @return {@code false} when no channel is bound to the id
	 */
	public boolean closeSession(@Nullable String sessionId) {
		if (!Utils.hasText(sessionId)) {
			return false;
		}
		return this.locks.withLock(sessionId, () -> {
			Optional<SessionChannel> channel = this.transports.get(sessionId);
			if (channel.isEmpty()) {
				return false;
			}
			channel.get().close();
			this.transports.unbind(sessionId);
			this.sessions.remove(sessionId);
			this.handlers.evict(sessionId);
			if (this.workerPool != null) {
				this.workerPool.terminate(sessionId);
			}
			logger.info("Closed session {} ({} live connections)", sessionId, this.transports.liveConnections());
			return true;
		});
	}

	/**
	 * Removes sessions idle past the registry's timeout and tears down their resources.
	 * @return the number of sessions removed
	 */
	public int sweepIdleSessions() {
		List<Session> swept = this.sessions.sweep(this.sessions.now());
		retire(swept);
		return swept.size();
	}

	/**
	 * Tears down the channel of a session after its HTTP exchange failed.
	 */
	public void reportTransportError(@Nullable String sessionId, Throwable error) {
		this.transports.get(sessionId).ifPresent(channel -> channel.fail(error));
	}

	/**
	 * Tears down sessions already dropped from the registry. Each id is handled under its
	 * own lock and skipped when a request re-established it in the meantime. Must not be
	 * called while holding another session's lock.
	 */
	private void retire(List<Session> removed) {
		for (Session session : removed) {
			String id = session.getId();
			SessionChannel channel = this.locks.withLock(id, () -> detach(id));
			// closed outside the lock, the mapping is already gone
			if (channel != null) {
				channel.close();
			}
		}
	}

	// must hold the lock of id
	@Nullable
	private SessionChannel detach(String id) {
		if (this.sessions.contains(id)) {
			logger.debug("Session {} was re-established before its teardown, keeping it", id);
			return null;
		}
		SessionChannel channel = this.transports.get(id).orElse(null);
		if (channel != null) {
			this.transports.unbind(id, channel);
		}
		this.handlers.evict(id);
		if (this.workerPool != null) {
			this.workerPool.terminate(id);
		}
		return channel;
	}

	/**
	 * Stops accepting requests, closes every channel and releases the pools.
	 */
	public void shutdown() {
		if (!this.accepting.compareAndSet(true, false)) {
			return;
		}
		logger.info("Shutting down router: {} session(s), {} channel(s)", this.sessions.size(),
				this.transports.size());
		this.transports.closeAll();
		this.sessions.clear();
		if (this.workerPool != null) {
			this.workerPool.shutdown();
		}
		this.handlers.shutdown();
	}

	public boolean isAccepting() {
		return this.accepting.get();
	}

	private static boolean isKeepalive(String method) {
		return VaultSchema.METHOD_SESSION_PING.equals(method) || VaultSchema.METHOD_STATUS_PING.equals(method);
	}

	private static RouterResponse toRouterResponse(String sessionId, JSONRPCResponse response) {
		if (response.error() != null && response.error().code() != null
				&& response.error().code() == VaultSchema.ErrorCodes.NOT_INITIALIZED) {
			return new RouterResponse(400, sessionId, response);
		}
		return RouterResponse.ok(sessionId, response);
	}

	private static RouterResponse noActiveTransport(@Nullable String sessionId, Object requestId) {
		Object data = sessionId == null ? null : Map.of("sessionId", sessionId);
		return RouterResponse.ok(sessionId, JSONRPCResponse.failure(requestId,
				new JSONRPCError(VaultSchema.ErrorCodes.NO_ACTIVE_TRANSPORT, NO_ACTIVE_TRANSPORT_MESSAGE, data)));
	}

	static RouterResponse internalError(@Nullable String sessionId, Throwable error) {
		String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
		return new RouterResponse(500, sessionId, JSONRPCResponse.failure(null,
				new JSONRPCError(VaultSchema.ErrorCodes.INTERNAL_ERROR, "Internal error: " + message, null)));
	}

	private record Resolution(String sessionId, @Nullable SessionChannel channel, List<Session> evicted) {
	}

	/**
	 * Builder for {@link RequestRouter}.
	 */
	public static class Builder {

		private SessionRegistry sessions;

		private TransportRegistry transports;

		private ProtocolHandlerPool handlers;

		private SessionWorkerPool workerPool;

		private ChannelFactory channelFactory = ChannelFactory.DEFAULT;

		private Supplier<String> sessionIdGenerator = () -> UUID.randomUUID().toString();

		private int lockStripes = DEFAULT_LOCK_STRIPES;

		private Builder() {
		}

		public Builder sessions(SessionRegistry sessions) {
			this.sessions = sessions;
			return this;
		}

		public Builder transports(TransportRegistry transports) {
			this.transports = transports;
			return this;
		}

		public Builder handlers(ProtocolHandlerPool handlers) {
			this.handlers = handlers;
			return this;
		}

		/**
		 * Worker pool whose session contexts are terminated together with their
		 * sessions. Optional.
		 */
		public Builder workerPool(@Nullable SessionWorkerPool workerPool) {
			this.workerPool = workerPool;
			return this;
		}

		public Builder channelFactory(ChannelFactory channelFactory) {
			Assert.notNull(channelFactory, "channelFactory must not be null");
			this.channelFactory = channelFactory;
			return this;
		}

		public Builder sessionIdGenerator(Supplier<String> sessionIdGenerator) {
			Assert.notNull(sessionIdGenerator, "sessionIdGenerator must not be null");
			this.sessionIdGenerator = sessionIdGenerator;
			return this;
		}

		public Builder lockStripes(int lockStripes) {
			Assert.isTrue(lockStripes > 0, "lockStripes must be positive");
			this.lockStripes = lockStripes;
			return this;
		}

		public RequestRouter build() {
			Assert.notNull(this.sessions, "sessions must not be null");
			Assert.notNull(this.transports, "transports must not be null");
			Assert.notNull(this.handlers, "handlers must not be null");
			return new RequestRouter(this);
		}

	}

}
