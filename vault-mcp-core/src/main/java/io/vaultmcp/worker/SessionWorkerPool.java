/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.worker;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import io.vaultmcp.spec.McpError;
import io.vaultmcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Bounded pool of per-session execution contexts.
 * <p>
 * Each session runs its items on its own single-threaded {@link Scheduler}, created on
 * first use. At most {@code capacity} items run at once and at most {@code capacity}
 * contexts exist; when a new context is needed at the cap, an idle one is retired.
 * Items beyond the running capacity wait in a FIFO queue of {@code maxQueueSize}
 * entries, anything beyond that is rejected with a {@link WorkerCapacityException}.
 * Every item either completes or fails with a {@link WorkerTimeoutException} after
 * {@code requestTimeout}.
 */
public class SessionWorkerPool {

	private static final Logger logger = LoggerFactory.getLogger(SessionWorkerPool.class);

	public static final int DEFAULT_CAPACITY = 32;

	public static final int DEFAULT_MAX_QUEUE_SIZE = 100;

	public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

	private static final AtomicLong INSTANCE_COUNTER = new AtomicLong(0);

	private final int capacity;

	private final int maxQueueSize;

	private final Duration requestTimeout;

	private final long instanceId = INSTANCE_COUNTER.incrementAndGet();

	private final AtomicInteger contextCounter = new AtomicInteger();

	private final Object lock = new Object();

	// guarded by lock
	private final Deque<PendingItem<?>> queue = new ArrayDeque<>();

	// guarded by lock, access ordered so the eldest entry is the least recently used
	private final LinkedHashMap<String, SessionContext> contexts = new LinkedHashMap<>(16, 0.75f, true);

	// guarded by lock
	private int running;

	private volatile boolean shutdown;

	private final AtomicLong completed = new AtomicLong();

	private final AtomicLong failed = new AtomicLong();

	private final AtomicLong timedOut = new AtomicLong();

	private SessionWorkerPool(Builder builder) {
		this.capacity = builder.capacity;
		this.maxQueueSize = builder.maxQueueSize;
		this.requestTimeout = builder.requestTimeout;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Submits an item for execution on its session's context.
	 * @param item the work item
	 * @return a {@link Mono} completing with the task's result, failing with the task's
	 * exception, a {@link WorkerCapacityException} when the pool is full or a
	 * {@link WorkerTimeoutException} when the item does not finish in time
	 */
	public <T> Mono<T> submit(WorkItem<T> item) {
		Assert.notNull(item, "item must not be null");
		Mono<T> execution = Mono.create(sink -> {
			PendingItem<T> pending = new PendingItem<>(item, sink);
			synchronized (this.lock) {
				if (this.shutdown) {
					sink.error(new WorkerCapacityException("Worker pool is shut down"));
					return;
				}
				if (this.running + this.queue.size() >= this.capacity + this.maxQueueSize) {
					logger.warn("Rejecting {} for session {}: {} running, {} queued", item.operation(),
							item.sessionId(), this.running, this.queue.size());
					this.failed.incrementAndGet();
					sink.error(new WorkerCapacityException(this.capacity, this.maxQueueSize));
					return;
				}
				this.queue.addLast(pending);
			}
			sink.onCancel(pending::cancel);
			drain();
		});
		return execution.timeout(this.requestTimeout, Mono.defer(() -> {
			this.timedOut.incrementAndGet();
			this.failed.incrementAndGet();
			logger.warn("Work item {} ({}) for session {} timed out after {}", item.id(), item.operation(),
					item.sessionId(), this.requestTimeout);
			return Mono.error(new WorkerTimeoutException(item, this.requestTimeout));
		}));
	}

	/**
	 * Disposes the execution context of one session and fails its pending items.
	 */
	public void terminate(String sessionId) {
		SessionContext context;
		List<PendingItem<?>> aborted = new ArrayList<>();
		synchronized (this.lock) {
			context = this.contexts.remove(sessionId);
			Iterator<PendingItem<?>> iterator = this.queue.iterator();
			while (iterator.hasNext()) {
				PendingItem<?> pending = iterator.next();
				if (pending.item.sessionId().equals(sessionId)) {
					iterator.remove();
					aborted.add(pending);
				}
			}
		}
		if (context != null) {
			aborted.addAll(context.runningItems);
			context.scheduler.dispose();
			logger.debug("Terminated worker context {} of session {}", context.name, sessionId);
		}
		McpError error = new McpError("Session " + sessionId + " terminated");
		aborted.forEach(pending -> pending.abort(error));
	}

	/**
	 * Rejects further submissions, fails every queued and running item and disposes all
	 * contexts.
	 */
	public void shutdown() {
		List<PendingItem<?>> aborted = new ArrayList<>();
		List<SessionContext> disposed;
		synchronized (this.lock) {
			if (this.shutdown) {
				return;
			}
			this.shutdown = true;
			aborted.addAll(this.queue);
			this.queue.clear();
			disposed = new ArrayList<>(this.contexts.values());
			this.contexts.clear();
		}
		logger.info("Shutting down worker pool {}: {} queued item(s), {} context(s)", this.instanceId,
				aborted.size(), disposed.size());
		for (SessionContext context : disposed) {
			aborted.addAll(context.runningItems);
			context.scheduler.dispose();
		}
		McpError error = new McpError("Worker pool shut down");
		aborted.forEach(pending -> pending.abort(error));
	}

	public boolean isShutdown() {
		return this.shutdown;
	}

	public WorkerPoolStats stats() {
		synchronized (this.lock) {
			return new WorkerPoolStats(this.contexts.size(), this.running, this.queue.size(), this.capacity,
					this.maxQueueSize, this.completed.get(), this.failed.get(), this.timedOut.get());
		}
	}

	public int getCapacity() {
		return this.capacity;
	}

	public Duration getRequestTimeout() {
		return this.requestTimeout;
	}

	private void drain() {
		List<PendingItem<?>> ready = new ArrayList<>();
		synchronized (this.lock) {
			while (!this.shutdown && this.running < this.capacity && !this.queue.isEmpty()) {
				PendingItem<?> next = this.queue.peekFirst();
				SessionContext context = contextFor(next.item.sessionId());
				if (context == null) {
					break;
				}
				this.queue.pollFirst();
				this.running++;
				context.runningItems.add(next);
				next.context = context;
				ready.add(next);
			}
		}
		ready.forEach(PendingItem::start);
	}

	// must hold lock
	private SessionContext contextFor(String sessionId) {
		SessionContext context = this.contexts.get(sessionId);
		if (context != null) {
			return context;
		}
		if (this.contexts.size() >= this.capacity) {
			SessionContext idle = null;
			for (SessionContext candidate : this.contexts.values()) {
				if (candidate.runningItems.isEmpty()) {
					idle = candidate;
					break;
				}
			}
			if (idle == null) {
				return null;
			}
			this.contexts.remove(idle.sessionId);
			idle.scheduler.dispose();
			logger.debug("Retired idle worker context {} of session {}", idle.name, idle.sessionId);
		}
		String name = "vault-worker-" + this.instanceId + "-" + this.contextCounter.incrementAndGet();
		context = new SessionContext(sessionId, name, Schedulers.newSingle(name, true));
		this.contexts.put(sessionId, context);
		logger.debug("Created worker context {} for session {}", name, sessionId);
		return context;
	}

	private void release(PendingItem<?> pending) {
		synchronized (this.lock) {
			SessionContext context = pending.context;
			if (context != null && context.runningItems.remove(pending)) {
				this.running--;
			}
		}
		drain();
	}

	private static final class SessionContext {

		private final String sessionId;

		private final String name;

		private final Scheduler scheduler;

		private final Set<PendingItem<?>> runningItems = ConcurrentHashMap.newKeySet();

		private SessionContext(String sessionId, String name, Scheduler scheduler) {
			this.sessionId = sessionId;
			this.name = name;
			this.scheduler = scheduler;
		}

	}

	private final class PendingItem<T> {

		private final WorkItem<T> item;

		private final MonoSink<T> sink;

		private final AtomicBoolean finished = new AtomicBoolean(false);

		// assigned under lock when the item leaves the queue
		private volatile SessionContext context;

		private volatile Disposable execution;

		private PendingItem(WorkItem<T> item, MonoSink<T> sink) {
			this.item = item;
			this.sink = sink;
		}

		private void start() {
			if (this.finished.get()) {
				release(this);
				return;
			}
			this.execution = Mono.fromCallable(this.item.task())
				.subscribeOn(this.context.scheduler)
				.subscribe(this::succeed, this::fail, this::completeEmpty);
			if (this.finished.get()) {
				this.execution.dispose();
			}
		}

		private void succeed(T value) {
			if (this.finished.compareAndSet(false, true)) {
				completed.incrementAndGet();
				release(this);
				this.sink.success(value);
			}
		}

		private void completeEmpty() {
			if (this.finished.compareAndSet(false, true)) {
				completed.incrementAndGet();
				release(this);
				this.sink.success();
			}
		}

		private void fail(Throwable error) {
			if (this.finished.compareAndSet(false, true)) {
				failed.incrementAndGet();
				logger.debug("Work item {} ({}) of session {} failed: {}", this.item.id(), this.item.operation(),
						this.item.sessionId(), error.getMessage());
				release(this);
				this.sink.error(error);
			}
		}

		// downstream cancelled, e.g. by the timeout
		private void cancel() {
			if (!this.finished.compareAndSet(false, true)) {
				return;
			}
			boolean wasQueued;
			synchronized (lock) {
				wasQueued = queue.remove(this);
			}
			if (!wasQueued) {
				Disposable current = this.execution;
				if (current != null) {
					current.dispose();
				}
				release(this);
			}
		}

		private void abort(Throwable error) {
			if (!this.finished.compareAndSet(false, true)) {
				return;
			}
			failed.incrementAndGet();
			Disposable current = this.execution;
			if (current != null) {
				current.dispose();
			}
			release(this);
			this.sink.error(error);
		}

	}

	/**
	 * Builder for {@link SessionWorkerPool}.
	 */
	public static class Builder {

		private int capacity = DEFAULT_CAPACITY;

		private int maxQueueSize = DEFAULT_MAX_QUEUE_SIZE;

		private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;

		private Builder() {
		}

		/**
		 * Maximum number of concurrently running items, and of execution contexts.
		 */
		public Builder capacity(int capacity) {
			Assert.isTrue(capacity > 0, "capacity must be positive");
			this.capacity = capacity;
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

		public SessionWorkerPool build() {
			return new SessionWorkerPool(this);
		}

	}

}
