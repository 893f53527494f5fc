/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.server;

import java.util.Map;
import java.util.function.Predicate;

import io.vaultmcp.spec.VaultSchema;
import io.vaultmcp.util.Assert;

/**
 * A tool definition paired with its implementation.
 *
 * @param tool the tool definition advertised by {@code tools/list}
 * @param handler the implementation
 * @param workerEligible decides, per call, whether the call runs on the session worker
 * pool (when one is configured) instead of the shared blocking scheduler
 */
public record ToolSpecification(VaultSchema.Tool tool, ToolHandler handler,
		Predicate<Map<String, Object>> workerEligible) {

	public ToolSpecification {
		Assert.notNull(tool, "tool must not be null");
		Assert.notNull(handler, "handler must not be null");
		Assert.notNull(workerEligible, "workerEligible must not be null");
	}

	public static ToolSpecification of(VaultSchema.Tool tool, ToolHandler handler) {
		return new ToolSpecification(tool, handler, arguments -> false);
	}

	public boolean runsOnWorker(Map<String, Object> arguments) {
		return this.workerEligible.test(arguments);
	}

}
