/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.worker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import io.vaultmcp.spec.McpError;
import io.vaultmcp.spec.VaultSchema;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Tests for {@link SessionWorkerPool}.
 */
class SessionWorkerPoolTests {

	private final CountDownLatch release = new CountDownLatch(1);

	private final List<Disposable> subscriptions = new ArrayList<>();

	private SessionWorkerPool pool;

	@AfterEach
	void tearDown() {
		this.release.countDown();
		this.subscriptions.forEach(Disposable::dispose);
		if (this.pool != null) {
			this.pool.shutdown();
		}
	}

	private WorkItem<String> blocking(String sessionId) {
		return WorkItem.of(sessionId, "blocking", null, () -> {
			this.release.await(10, TimeUnit.SECONDS);
			return "released " + sessionId;
		});
	}

	@Test
	void runsItemAndReturnsItsResult() {
		this.pool = SessionWorkerPool.builder().build();

		StepVerifier.create(this.pool.submit(WorkItem.of("s1", "answer", null, () -> 42)))
			.expectNext(42)
			.verifyComplete();

		assertThat(this.pool.stats().completed()).isEqualTo(1);
	}

	@Test
	void propagatesTaskFailure() {
		this.pool = SessionWorkerPool.builder().build();

		StepVerifier.create(this.pool.submit(WorkItem.of("s1", "boom", null, () -> {
			throw new IllegalStateException("boom");
		}))).expectErrorMessage("boom").verify();

		assertThat(this.pool.stats().failed()).isEqualTo(1);
	}

	@Test
	void itemsOfOneSessionRunOnTheSameThreadInOrder() {
		this.pool = SessionWorkerPool.builder().capacity(4).build();
		List<Integer> order = new CopyOnWriteArrayList<>();
		Set<String> threads = ConcurrentHashMap.newKeySet();

		List<Mono<Integer>> items = new ArrayList<>();
		for (int i = 0; i < 5; i++) {
			int value = i;
			items.add(this.pool.submit(WorkItem.of("s1", "step", null, () -> {
				order.add(value);
				threads.add(Thread.currentThread().getName());
				return value;
			})));
		}

		StepVerifier.create(Flux.concat(items)).expectNext(0, 1, 2, 3, 4).verifyComplete();
		assertThat(order).containsExactly(0, 1, 2, 3, 4);
		assertThat(threads).hasSize(1).allSatisfy(name -> assertThat(name).startsWith("vault-worker-"));
	}

	@Test
	void sessionsGetSeparateContexts() {
		this.pool = SessionWorkerPool.builder().capacity(4).build();

		String first = this.pool.submit(WorkItem.of("s1", "thread", null, () -> Thread.currentThread().getName()))
			.block(Duration.ofSeconds(5));
		String second = this.pool.submit(WorkItem.of("s2", "thread", null, () -> Thread.currentThread().getName()))
			.block(Duration.ofSeconds(5));

		assertThat(first).isNotEqualTo(second);
		assertThat(this.pool.stats().activeContexts()).isEqualTo(2);
	}

	@Test
	void rejectsItemsBeyondCapacityAndQueue() {
		this.pool = SessionWorkerPool.builder().capacity(1).maxQueueSize(1).build();
		this.subscriptions.add(this.pool.submit(blocking("s1")).subscribe());
		this.subscriptions.add(this.pool.submit(blocking("s2")).subscribe());

		await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
			WorkerPoolStats stats = this.pool.stats();
			assertThat(stats.running()).isEqualTo(1);
			assertThat(stats.queued()).isEqualTo(1);
		});

		StepVerifier.create(this.pool.submit(WorkItem.of("s3", "rejected", null, () -> "never")))
			.expectErrorSatisfies(error -> {
				assertThat(error).isInstanceOf(WorkerCapacityException.class);
				assertThat(((McpError) error).getJsonRpcError().code())
					.isEqualTo(VaultSchema.ErrorCodes.CAPACITY_EXCEEDED);
				assertThat(((McpError) error).getJsonRpcError().data())
					.isEqualTo(Map.of("capacity", 1, "maxQueueSize", 1));
			})
			.verify();
	}

	@Test
	void queuedItemsRunOnceASlotFrees() {
		this.pool = SessionWorkerPool.builder().capacity(1).maxQueueSize(5).build();
		Mono<String> first = this.pool.submit(blocking("s1"));
		Mono<String> second = this.pool.submit(WorkItem.of("s1", "after", null, () -> "second"));

		StepVerifier.create(Flux.merge(first, second))
			.then(() -> await().atMost(Duration.ofSeconds(5))
				.untilAsserted(() -> assertThat(this.pool.stats().queued()).isEqualTo(1)))
			.then(this.release::countDown)
			.expectNext("released s1", "second")
			.verifyComplete();
	}

	@Test
	void noItemIsDroppedUnderLoad() {
		this.pool = SessionWorkerPool.builder().capacity(4).maxQueueSize(100).build();

		List<Mono<String>> items = new ArrayList<>();
		for (int i = 0; i < 40; i++) {
			String sessionId = "s" + (i % 8);
			int value = i;
			items.add(this.pool.submit(WorkItem.of(sessionId, "load", null, () -> sessionId + "-" + value)));
		}

		StepVerifier.create(Flux.merge(items).collectList())
			.assertNext(results -> assertThat(results).hasSize(40).doesNotHaveDuplicates())
			.verifyComplete();

		WorkerPoolStats stats = this.pool.stats();
		assertThat(stats.completed()).isEqualTo(40);
		assertThat(stats.running()).isZero();
		assertThat(stats.queued()).isZero();
		assertThat(stats.activeContexts()).isLessThanOrEqualTo(4);
	}

	@Test
	void timesOutSlowItemsAndFreesTheirSlot() {
		this.pool = SessionWorkerPool.builder().capacity(1).requestTimeout(Duration.ofMillis(200)).build();
		WorkItem<String> slow = blocking("s1");

		StepVerifier.create(this.pool.submit(slow)).expectErrorSatisfies(error -> {
			assertThat(error).isInstanceOf(WorkerTimeoutException.class);
			McpError mcpError = (McpError) error;
			assertThat(mcpError.getJsonRpcError().code()).isEqualTo(VaultSchema.ErrorCodes.WORKER_TIMEOUT);
			assertThat(mcpError.getJsonRpcError().data())
				.isEqualTo(Map.of("workItemId", slow.id(), "sessionId", "s1"));
		}).verify(Duration.ofSeconds(5));

		assertThat(this.pool.stats().timedOut()).isEqualTo(1);
		assertThat(this.pool.stats().running()).isZero();
		StepVerifier.create(this.pool.submit(WorkItem.of("s2", "fast", null, () -> "ok")))
			.expectNext("ok")
			.verifyComplete();
	}

	@Test
	void terminateFailsPendingItemsOfTheSession() {
		this.pool = SessionWorkerPool.builder().capacity(2).build();

		StepVerifier.create(this.pool.submit(blocking("s1")))
			.then(() -> await().atMost(Duration.ofSeconds(5))
				.untilAsserted(() -> assertThat(this.pool.stats().running()).isEqualTo(1)))
			.then(() -> this.pool.terminate("s1"))
			.expectErrorSatisfies(error -> assertThat(error).isInstanceOf(McpError.class)
				.hasMessage("Session s1 terminated"))
			.verify(Duration.ofSeconds(5));

		WorkerPoolStats stats = this.pool.stats();
		assertThat(stats.running()).isZero();
		assertThat(stats.activeContexts()).isZero();
	}

	@Test
	void idleContextIsRetiredWhenTheCapIsReached() {
		this.pool = SessionWorkerPool.builder().capacity(2).build();

		for (String sessionId : List.of("s1", "s2", "s3")) {
			StepVerifier.create(this.pool.submit(WorkItem.of(sessionId, "noop", null, () -> sessionId)))
				.expectNext(sessionId)
				.verifyComplete();
		}

		assertThat(this.pool.stats().activeContexts()).isEqualTo(2);
	}

	@Test
	void shutdownRejectsFurtherSubmissions() {
		this.pool = SessionWorkerPool.builder().build();
		this.pool.shutdown();

		assertThat(this.pool.isShutdown()).isTrue();
		StepVerifier.create(this.pool.submit(WorkItem.of("s1", "late", null, () -> "never")))
			.expectError(WorkerCapacityException.class)
			.verify();
	}

	@Test
	void statsReportUtilization() {
		this.pool = SessionWorkerPool.builder().capacity(4).build();
		this.subscriptions.add(this.pool.submit(blocking("s1")).subscribe());

		await().atMost(Duration.ofSeconds(5))
			.untilAsserted(() -> assertThat(this.pool.stats().utilization()).isEqualTo(0.25));
	}

}
