/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.worker;

/**
 * Point-in-time view of a {@link SessionWorkerPool}.
 *
 * @param activeContexts execution contexts currently alive
 * @param running items currently executing
 * @param queued items waiting for a slot
 * @param capacity maximum number of concurrently running items and contexts
 * @param maxQueueSize maximum number of waiting items
 * @param completed items completed successfully since start
 * @param failed items that ended with an error, timeouts included
 * @param timedOut items that exceeded the request timeout
 */
public record WorkerPoolStats(int activeContexts, int running, int queued, int capacity, int maxQueueSize,
		long completed, long failed, long timedOut) {

	public double utilization() {
		return this.capacity == 0 ? 0.0 : (double) this.running / this.capacity;
	}

}
