/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.server;

import java.time.Duration;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vaultmcp.spec.ProtocolVersions;
import io.vaultmcp.spec.VaultSchema;
import io.vaultmcp.spec.VaultSchema.JSONRPCResponse;
import io.vaultmcp.util.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static io.vaultmcp.server.ProtocolHandlerFixtures.initialize;
import static io.vaultmcp.server.ProtocolHandlerFixtures.request;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Tests for {@link VaultMcpServer}.
 */
class VaultMcpServerTests {

	private VaultMcpServer server;

	@AfterEach
	void tearDown() {
		if (this.server != null) {
			this.server.close();
		}
	}

	private JSONRPCResponse send(String sessionId, VaultSchema.JSONRPCRequest request) {
		return (JSONRPCResponse) this.server.getRouter().route(sessionId, request).block(Duration.ofSeconds(5)).body();
	}

	@Test
	void singleHandlerModeSharesOneHandler() {
		this.server = VaultMcpServer.builder().tool(ProtocolHandlerFixtures.echoTool()).build();

		String first = this.server.getRouter().route(null, initialize(1, ProtocolVersions.LATEST)).block().sessionId();
		String second = this.server.getRouter().route(null, initialize(1, ProtocolVersions.LATEST)).block().sessionId();

		assertThat(first).isNotEqualTo(second);
		assertThat(this.server.isConcurrentSessions()).isFalse();
		assertThat(this.server.getWorkerPool()).isEmpty();
		assertThat(this.server.getHandlerPool()).isInstanceOf(SharedProtocolHandlerPool.class);
		assertThat(this.server.getHandlerPool().stats().activeHandlers()).isEqualTo(1);
		assertThat(this.server.getSessions().getMaxSessions()).isZero();
		assertThat(this.server.getTransports().get(first).orElseThrow().getHandler())
			.isSameAs(this.server.getTransports().get(second).orElseThrow().getHandler());
	}

	@Test
	void concurrentModeIsolatesHandlersAndCapsSessions() {
		this.server = VaultMcpServer.builder().concurrentSessions(true).maxConnections(4).build();

		String first = this.server.getRouter().route(null, initialize(1, ProtocolVersions.LATEST)).block().sessionId();
		String second = this.server.getRouter().route(null, initialize(1, ProtocolVersions.LATEST)).block().sessionId();

		assertThat(this.server.getWorkerPool()).hasValueSatisfying(pool -> assertThat(pool.getCapacity()).isEqualTo(4));
		assertThat(this.server.getHandlerPool()).isInstanceOf(PerSessionProtocolHandlerPool.class);
		assertThat(this.server.getSessions().getMaxSessions()).isEqualTo(4);
		assertThat(this.server.getTransports().get(first).orElseThrow().getHandler())
			.isNotSameAs(this.server.getTransports().get(second).orElseThrow().getHandler());
	}

	@Test
	void sessionInfoResourceReportsStatistics() throws Exception {
		this.server = VaultMcpServer.builder().concurrentSessions(true).maxConnections(4).build();
		String sessionId = this.server.getRouter()
			.route(null, initialize(1, ProtocolVersions.LATEST))
			.block()
			.sessionId();

		JSONRPCResponse response = send(sessionId,
				request(VaultSchema.METHOD_RESOURCES_READ, 2, Map.of("uri", VaultMcpServer.SESSION_INFO_URI)));

		VaultSchema.ReadResourceResult result = (VaultSchema.ReadResourceResult) response.result();
		Map<String, Object> info = new ObjectMapper().readValue(result.contents().get(0).text(),
				new TypeReference<Map<String, Object>>() {
				});
		assertThat(info).containsEntry("sessionId", sessionId).containsEntry("liveConnections", 1);
		assertThat(info).containsKeys("session", "sessions", "handlerPool", "workerPool");
		assertThat(info.get("sessions")).isEqualTo(Map.of("active", 1, "max", 4, "idleTimeoutSeconds", 3600));
	}

	@Test
	void sessionInfoResourceIsOnlyOfferedInConcurrentMode() {
		this.server = VaultMcpServer.builder().build();
		String sessionId = this.server.getRouter()
			.route(null, initialize(1, ProtocolVersions.LATEST))
			.block()
			.sessionId();

		JSONRPCResponse response = send(sessionId,
				request(VaultSchema.METHOD_RESOURCES_READ, 2, Map.of("uri", VaultMcpServer.SESSION_INFO_URI)));

		assertThat(response.error().code()).isEqualTo(VaultSchema.ErrorCodes.METHOD_NOT_FOUND);
	}

	@Test
	void sweeperRemovesIdleSessions() {
		MutableClock clock = MutableClock.startingAt("2025-06-18T10:00:00Z");
		this.server = VaultMcpServer.builder()
			.clock(clock)
			.sessionIdleTimeout(Duration.ofMinutes(1))
			.sweepInterval(Duration.ofMillis(50))
			.build();
		String sessionId = this.server.getRouter()
			.route(null, initialize(1, ProtocolVersions.LATEST))
			.block()
			.sessionId();

		clock.advance(Duration.ofMinutes(2));

		await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
			assertThat(this.server.getSessions().contains(sessionId)).isFalse();
			assertThat(this.server.getTransports().get(sessionId)).isEmpty();
		});
	}

	@Test
	void closeIsIdempotentAndStopsRouting() {
		this.server = VaultMcpServer.builder().build();

		this.server.close();
		this.server.close();

		assertThat(this.server.getRouter().isAccepting()).isFalse();
		JSONRPCResponse response = send(null, ProtocolHandlerFixtures.toolsList(1));
		assertThat(response.error().code()).isEqualTo(VaultSchema.ErrorCodes.NO_ACTIVE_TRANSPORT);
	}

	@Test
	void requestTimeoutMustBePositive() {
		assertThatThrownBy(() -> VaultMcpServer.builder().requestTimeout(Duration.ZERO))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessage("requestTimeout must be positive");
		assertThatThrownBy(() -> VaultMcpServer.builder().requestTimeout(Duration.ofSeconds(-1)))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessage("requestTimeout must be positive");
	}

}
