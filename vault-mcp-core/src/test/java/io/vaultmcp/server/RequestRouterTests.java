/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.server;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import io.vaultmcp.session.SessionRegistry;
import io.vaultmcp.spec.ChannelException;
import io.vaultmcp.spec.ProtocolVersions;
import io.vaultmcp.spec.VaultSchema;
import io.vaultmcp.spec.VaultSchema.JSONRPCRequest;
import io.vaultmcp.spec.VaultSchema.JSONRPCResponse;
import io.vaultmcp.transport.ChannelFactory;
import io.vaultmcp.transport.SessionChannel;
import io.vaultmcp.transport.TransportRegistry;
import io.vaultmcp.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import static io.vaultmcp.server.ProtocolHandlerFixtures.initialize;
import static io.vaultmcp.server.ProtocolHandlerFixtures.request;
import static io.vaultmcp.server.ProtocolHandlerFixtures.toolsList;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link RequestRouter}.
 */
class RequestRouterTests {

	private static final Duration IDLE_TIMEOUT = Duration.ofMinutes(30);

	private MutableClock clock;

	private SessionRegistry sessions;

	private TransportRegistry transports;

	private AtomicInteger constructed;

	private PerSessionProtocolHandlerPool handlers;

	private AtomicInteger ids;

	private RequestRouter router;

	@BeforeEach
	void setUp() {
		this.clock = MutableClock.startingAt("2025-06-18T10:00:00Z");
		this.transports = new TransportRegistry();
		this.constructed = new AtomicInteger();
		this.ids = new AtomicInteger();
		this.router = newRouter(0, ChannelFactory.DEFAULT);
	}

	private RequestRouter newRouter(int maxSessions, ChannelFactory channelFactory) {
		this.sessions = new SessionRegistry(maxSessions, IDLE_TIMEOUT, this.clock);
		this.handlers = new PerSessionProtocolHandlerPool(ownerId -> {
			this.constructed.incrementAndGet();
			return ProtocolHandlerFixtures.handler(ownerId);
		}, 8);
		return RequestRouter.builder()
			.sessions(this.sessions)
			.transports(this.transports)
			.handlers(this.handlers)
			.channelFactory(channelFactory)
			.sessionIdGenerator(() -> "session-" + this.ids.incrementAndGet())
			.build();
	}

	private RouterResponse route(String sessionId, JSONRPCRequest request) {
		return this.router.route(sessionId, request).block(Duration.ofSeconds(5));
	}

	private static JSONRPCResponse body(RouterResponse response) {
		return (JSONRPCResponse) response.body();
	}

	@Test
	void initializeWithoutIdProvisionsAFreshSession() {
		RouterResponse response = route(null, initialize(1, ProtocolVersions.LATEST));

		assertThat(response.status()).isEqualTo(200);
		assertThat(response.sessionId()).isEqualTo("session-1");
		assertThat(body(response).result()).isInstanceOf(VaultSchema.InitializeResult.class);
		assertThat(this.sessions.contains("session-1")).isTrue();
		assertThat(this.transports.get("session-1")).hasValueSatisfying(ch -> assertThat(ch.isInitialized()).isTrue());
		assertThat(this.transports.liveConnections()).isEqualTo(1);
		assertThat(this.constructed).hasValue(1);
	}

	@Test
	void requestWithoutIdIsInitializedOnTheClientsBehalf() {
		RouterResponse response = route(null, toolsList(1));

		assertThat(response.status()).isEqualTo(200);
		assertThat(response.sessionId()).isEqualTo("session-1");
		assertThat(body(response).error()).isNull();
		assertThat(body(response).result()).isInstanceOf(VaultSchema.ListToolsResult.class);
		SessionChannel channel = this.transports.get("session-1").orElseThrow();
		assertThat(channel.isInitialized()).isTrue();
		assertThat(channel.getHandler().getNegotiatedState()).hasValueSatisfying(state -> {
			assertThat(state.internal()).isTrue();
			assertThat(state.protocolVersion()).isEqualTo(ProtocolVersions.COMPATIBILITY_ATTEMPTS.get(0));
		});
	}

	@Test
	void knownSessionReusesItsChannelAndHandler() {
		String sessionId = route(null, initialize(1, ProtocolVersions.LATEST)).sessionId();
		SessionChannel channel = this.transports.get(sessionId).orElseThrow();

		for (int i = 2; i <= 6; i++) {
			RouterResponse response = route(sessionId, toolsList(i));
			assertThat(response.status()).isEqualTo(200);
			assertThat(response.sessionId()).isEqualTo(sessionId);
			assertThat(body(response).id()).isEqualTo(i);
		}

		assertThat(this.transports.get(sessionId)).containsSame(channel);
		assertThat(this.constructed).hasValue(1);
		assertThat(this.transports.liveConnections()).isEqualTo(1);
		assertThat(this.sessions.get(sessionId)).hasValueSatisfying(s -> assertThat(s.getRequestCount()).isEqualTo(5));
	}

	@Test
	void unknownIdGetsAChannelUnderTheSameId() {
		RouterResponse response = route("client-chosen", toolsList(1));

		assertThat(response.status()).isEqualTo(200);
		assertThat(response.sessionId()).isEqualTo("client-chosen");
		assertThat(body(response).result()).isInstanceOf(VaultSchema.ListToolsResult.class);
		assertThat(this.sessions.contains("client-chosen")).isTrue();
		assertThat(this.ids).hasValue(0);
	}

	@Test
	void failedCompatibilityHandshakeStillYieldsAStructuredResponse() {
		this.router = newRouter(0, RefusingHandshakeChannel::new);

		RouterResponse response = route("ghost", toolsList(9));

		assertThat(response.status()).isEqualTo(400);
		assertThat(response.sessionId()).isEqualTo("ghost");
		JSONRPCResponse rpc = body(response);
		assertThat(rpc.id()).isEqualTo(9);
		assertThat(rpc.error().code()).isEqualTo(VaultSchema.ErrorCodes.NOT_INITIALIZED);
		assertThat(rpc.error().data()).isEqualTo(Map.of("sessionId", "ghost"));
		assertThat(this.transports.get("ghost")).isPresent();
	}

	@Test
	void clientInitializeRecoversAfterFailedCompatibilityHandshake() {
		this.router = newRouter(0, RefusingHandshakeChannel::new);
		route("ghost", toolsList(1));

		RouterResponse init = route("ghost", initialize(2, ProtocolVersions.LATEST));
		RouterResponse list = route("ghost", toolsList(3));

		assertThat(init.status()).isEqualTo(200);
		assertThat(list.status()).isEqualTo(200);
		assertThat(body(list).result()).isInstanceOf(VaultSchema.ListToolsResult.class);
	}

	@Test
	void evictionAtCapacityClosesTheOldestChannelOnce() {
		this.router = newRouter(2, ChannelFactory.DEFAULT);
		String first = route(null, initialize(1, ProtocolVersions.LATEST)).sessionId();
		this.clock.advance(Duration.ofSeconds(1));
		String second = route(null, initialize(1, ProtocolVersions.LATEST)).sessionId();
		this.clock.advance(Duration.ofSeconds(1));
		SessionChannel oldest = this.transports.get(first).orElseThrow();
		VaultProtocolHandler oldestHandler = oldest.getHandler();
		AtomicInteger closes = new AtomicInteger();
		oldest.addListener(channel -> closes.incrementAndGet());
		assertThat(this.transports.liveConnections()).isEqualTo(2);

		String third = route(null, initialize(1, ProtocolVersions.LATEST)).sessionId();

		assertThat(closes).hasValue(1);
		assertThat(oldest.isClosed()).isTrue();
		assertThat(oldestHandler.isClosed()).isTrue();
		assertThat(this.sessions.contains(first)).isFalse();
		assertThat(this.transports.get(first)).isEmpty();
		assertThat(this.transports.liveConnections()).isEqualTo(2);
		assertThat(this.sessions.snapshot()).extracting(s -> s.getId()).containsExactly(second, third);
	}

	@Test
	void closeSessionOfUnknownIdReportsNotFound() {
		assertThat(this.router.closeSession("nope")).isFalse();
		assertThat(this.router.closeSession(null)).isFalse();
	}

	@Test
	void closeSessionTearsEverythingDown() {
		String sessionId = route(null, initialize(1, ProtocolVersions.LATEST)).sessionId();
		SessionChannel channel = this.transports.get(sessionId).orElseThrow();

		assertThat(this.router.closeSession(sessionId)).isTrue();

		assertThat(channel.isClosed()).isTrue();
		assertThat(channel.getHandler().isClosed()).isTrue();
		assertThat(this.sessions.contains(sessionId)).isFalse();
		assertThat(this.transports.liveConnections()).isZero();
		assertThat(this.router.closeSession(sessionId)).isFalse();
	}

	@Test
	void keepaliveCreatesNothing() {
		for (String method : List.of(VaultSchema.METHOD_SESSION_PING, VaultSchema.METHOD_STATUS_PING)) {
			RouterResponse response = route(null, request(method, 1, null));

			assertThat(response.status()).isEqualTo(200);
			@SuppressWarnings("unchecked")
			Map<String, Object> result = (Map<String, Object>) body(response).result();
			assertThat(result).containsEntry("ok", true).containsKey("sessionId");
		}
		RouterResponse unknown = route("unknown", request(VaultSchema.METHOD_SESSION_PING, 2, null));

		assertThat(unknown.sessionId()).isEqualTo("unknown");
		assertThat(this.sessions.size()).isZero();
		assertThat(this.transports.size()).isZero();
		assertThat(this.constructed).hasValue(0);
		assertThat(this.ids).hasValue(0);
	}

	@Test
	void keepaliveTouchesAKnownSession() {
		String sessionId = route(null, initialize(1, ProtocolVersions.LATEST)).sessionId();
		this.clock.advance(Duration.ofMinutes(10));

		route(sessionId, request(VaultSchema.METHOD_STATUS_PING, 2, null));

		assertThat(this.sessions.get(sessionId))
			.hasValueSatisfying(s -> assertThat(s.getLastActivity()).isEqualTo(this.clock.instant()));
	}

	@Test
	void concurrentFirstUseBindsOneChannelAndOneHandler() throws Exception {
		int threads = 16;
		ExecutorService executor = Executors.newFixedThreadPool(threads);
		CountDownLatch start = new CountDownLatch(1);
		List<Future<RouterResponse>> futures = new ArrayList<>();
		try {
			for (int i = 0; i < threads; i++) {
				int id = i;
				futures.add(executor.submit(() -> {
					start.await();
					return route("shared", toolsList(id));
				}));
			}
			start.countDown();
			for (Future<RouterResponse> future : futures) {
				RouterResponse response = future.get(10, TimeUnit.SECONDS);
				assertThat(response.status()).isEqualTo(200);
				assertThat(body(response).result()).isInstanceOf(VaultSchema.ListToolsResult.class);
			}
		}
		finally {
			executor.shutdownNow();
		}

		assertThat(this.constructed).hasValue(1);
		assertThat(this.transports.liveConnections()).isEqualTo(1);
		assertThat(this.sessions.size()).isEqualTo(1);
	}

	@Test
	void sweptSessionIsReprovisionedOnNextRequest() {
		String sessionId = route(null, initialize(1, ProtocolVersions.LATEST)).sessionId();
		SessionChannel original = this.transports.get(sessionId).orElseThrow();
		this.clock.advance(IDLE_TIMEOUT.plusMinutes(1));

		assertThat(this.router.sweepIdleSessions()).isEqualTo(1);
		assertThat(original.isClosed()).isTrue();
		assertThat(this.transports.get(sessionId)).isEmpty();

		RouterResponse response = route(sessionId, toolsList(2));

		assertThat(response.status()).isEqualTo(200);
		assertThat(response.sessionId()).isEqualTo(sessionId);
		assertThat(body(response).result()).isInstanceOf(VaultSchema.ListToolsResult.class);
		assertThat(this.transports.get(sessionId)).hasValueSatisfying(ch -> assertThat(ch).isNotSameAs(original));
		assertThat(this.constructed).hasValue(2);
	}

	@Test
	void reconnectDuringSweepTeardownKeepsTheNewChannel() throws Exception {
		ExecutorService client = Executors.newSingleThreadExecutor();
		AtomicInteger created = new AtomicInteger();
		List<Future<RouterResponse>> reconnects = new ArrayList<>();
		try {
			this.router = newRouter(0, (sessionId, handler) -> {
				if (created.incrementAndGet() > 1) {
					return new SessionChannel(sessionId, handler);
				}
				return new SessionChannel(sessionId, handler) {

					@Override
					public void close() {
						// the client reconnects while the old channel is being torn down
						Future<RouterResponse> reconnect = client
							.submit(() -> route(sessionId, initialize(2, ProtocolVersions.LATEST)));
						reconnects.add(reconnect);
						try {
							reconnect.get(5, TimeUnit.SECONDS);
						}
						catch (Exception ex) {
							throw new IllegalStateException(ex);
						}
						super.close();
					}

				};
			});
			String sessionId = route(null, initialize(1, ProtocolVersions.LATEST)).sessionId();
			SessionChannel original = this.transports.get(sessionId).orElseThrow();
			this.clock.advance(IDLE_TIMEOUT.plusMinutes(1));

			assertThat(this.router.sweepIdleSessions()).isEqualTo(1);

			assertThat(reconnects).hasSize(1);
			RouterResponse reconnected = reconnects.get(0).get(5, TimeUnit.SECONDS);
			assertThat(reconnected.status()).isEqualTo(200);
			assertThat(body(reconnected).result()).isInstanceOf(VaultSchema.InitializeResult.class);
			assertThat(original.isClosed()).isTrue();
			assertThat(this.sessions.contains(sessionId)).isTrue();
			assertThat(this.transports.get(sessionId)).hasValueSatisfying(channel -> {
				assertThat(channel).isNotSameAs(original);
				assertThat(channel.isClosed()).isFalse();
				assertThat(channel.getHandler().isClosed()).isFalse();
			});
			assertThat(this.transports.liveConnections()).isEqualTo(1);
			assertThat(this.handlers.stats().activeHandlers()).isEqualTo(1);
		}
		finally {
			client.shutdownNow();
		}
	}

	@Test
	void initializeOnKnownIdWithoutChannelReconnects() {
		String sessionId = route(null, initialize(1, ProtocolVersions.LATEST)).sessionId();
		this.transports.get(sessionId).orElseThrow().close();

		RouterResponse response = route(sessionId, initialize(2, ProtocolVersions.MCP_2024_11_05));

		assertThat(response.status()).isEqualTo(200);
		assertThat(response.sessionId()).isEqualTo(sessionId);
		assertThat(((VaultSchema.InitializeResult) body(response).result()).protocolVersion())
			.isEqualTo(ProtocolVersions.MCP_2024_11_05);
		assertThat(this.transports.liveConnections()).isEqualTo(1);
	}

	@Test
	void handlerConstructionFailureIsAnInternalError() {
		this.sessions = new SessionRegistry(0, IDLE_TIMEOUT, this.clock);
		this.router = RequestRouter.builder()
			.sessions(this.sessions)
			.transports(this.transports)
			.handlers(new PerSessionProtocolHandlerPool(ownerId -> {
				throw new IllegalStateException("no handler for you");
			}, 8))
			.build();

		RouterResponse response = route(null, toolsList(1));

		assertThat(response.status()).isEqualTo(500);
		assertThat(body(response).id()).isNull();
		assertThat(body(response).error().code()).isEqualTo(VaultSchema.ErrorCodes.INTERNAL_ERROR);
		assertThat(body(response).error().message()).isEqualTo("Internal error: no handler for you");
		assertThat(this.sessions.size()).isZero();
		assertThat(this.transports.liveConnections()).isZero();
	}

	@Test
	void channelFailureDuringDispatchIsAnInternalError() {
		this.router = newRouter(0, failingDispatch(request -> Mono.error(new ChannelException("write failed"))));

		RouterResponse response = route(null, initialize(1, ProtocolVersions.LATEST));

		assertThat(response.status()).isEqualTo(500);
		assertThat(body(response).error().message()).isEqualTo("Internal error: write failed");
		assertThat(this.transports.get(response.sessionId())).isEmpty();
		assertThat(this.transports.liveConnections()).isZero();
	}

	@Test
	void emptyDispatchReportsNoActiveTransport() {
		this.router = newRouter(0, failingDispatch(request -> Mono.empty()));

		RouterResponse response = route("quiet", toolsList(4));

		assertThat(response.status()).isEqualTo(200);
		assertThat(body(response).id()).isEqualTo(4);
		assertThat(body(response).error().code()).isEqualTo(VaultSchema.ErrorCodes.NO_ACTIVE_TRANSPORT);
		assertThat(body(response).error().message()).isEqualTo(RequestRouter.NO_ACTIVE_TRANSPORT_MESSAGE);
		assertThat(body(response).error().data()).isEqualTo(Map.of("sessionId", "quiet"));
	}

	@Test
	void afterShutdownRequestsReportNoActiveTransport() {
		String sessionId = route(null, initialize(1, ProtocolVersions.LATEST)).sessionId();
		SessionChannel channel = this.transports.get(sessionId).orElseThrow();

		this.router.shutdown();
		RouterResponse response = route(sessionId, toolsList(2));

		assertThat(this.router.isAccepting()).isFalse();
		assertThat(channel.isClosed()).isTrue();
		assertThat(response.status()).isEqualTo(200);
		assertThat(body(response).error().code()).isEqualTo(VaultSchema.ErrorCodes.NO_ACTIVE_TRANSPORT);
		assertThat(this.sessions.size()).isZero();
	}

	@Test
	void notificationsNeverProvisionSessions() {
		RouterResponse response = this.router.routeNotification(null, ProtocolHandlerFixtures.initialized())
			.block(Duration.ofSeconds(5));
		RouterResponse unknown = this.router.routeNotification("nope", ProtocolHandlerFixtures.initialized())
			.block(Duration.ofSeconds(5));

		assertThat(response.status()).isEqualTo(202);
		assertThat(unknown.status()).isEqualTo(202);
		assertThat(this.sessions.size()).isZero();
		assertThat(this.transports.size()).isZero();
	}

	@Test
	void notificationsReachTheBoundHandler() {
		String sessionId = route(null, initialize(1, ProtocolVersions.LATEST)).sessionId();

		RouterResponse response = this.router.routeNotification(sessionId, ProtocolHandlerFixtures.initialized())
			.block(Duration.ofSeconds(5));

		assertThat(response.status()).isEqualTo(202);
		assertThat(this.transports.get(sessionId).orElseThrow().getHandler().isClientAcknowledged()).isTrue();
	}

	@Test
	void transportErrorTearsDownTheChannel() {
		String sessionId = route(null, initialize(1, ProtocolVersions.LATEST)).sessionId();
		SessionChannel channel = this.transports.get(sessionId).orElseThrow();

		this.router.reportTransportError(sessionId, new IllegalStateException("client went away"));

		assertThat(channel.isClosed()).isTrue();
		assertThat(this.transports.get(sessionId)).isEmpty();
		assertThat(this.sessions.contains(sessionId)).isTrue();
	}

	private static ChannelFactory failingDispatch(Function<JSONRPCRequest, Mono<JSONRPCResponse>> dispatch) {
		return (sessionId, handler) -> new SessionChannel(sessionId, handler) {

			@Override
			public Mono<JSONRPCResponse> dispatch(JSONRPCRequest request) {
				return dispatch.apply(request);
			}

		};
	}

	/**
	 * Channel on which every handshake on the client's behalf blows up.
	 */
	static class RefusingHandshakeChannel extends SessionChannel {

		RefusingHandshakeChannel(String sessionId, VaultProtocolHandler handler) {
			super(sessionId, handler);
		}

		@Override
		public boolean handshakeInternally(String protocolVersion) {
			throw new IllegalStateException("handshake refused for " + protocolVersion);
		}

	}

}
