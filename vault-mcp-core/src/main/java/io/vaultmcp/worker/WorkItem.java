/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.worker;

import java.util.UUID;
import java.util.concurrent.Callable;

import io.vaultmcp.util.Assert;

/**
 * A unit of work submitted to the {@link SessionWorkerPool}.
 *
 * @param id unique identifier of the item
 * @param sessionId the session whose execution context runs the item
 * @param operation name of the operation, used in logs and errors
 * @param params opaque operation parameters, may be {@code null}
 * @param task the work itself
 * @param <T> the result type
 */
public record WorkItem<T>(String id, String sessionId, String operation, Object params, Callable<T> task) {

	public WorkItem {
		Assert.hasText(id, "id must not be empty");
		Assert.hasText(sessionId, "sessionId must not be empty");
		Assert.hasText(operation, "operation must not be empty");
		Assert.notNull(task, "task must not be null");
	}

	public static <T> WorkItem<T> of(String sessionId, String operation, Object params, Callable<T> task) {
		return new WorkItem<>(UUID.randomUUID().toString(), sessionId, operation, params, task);
	}

}
