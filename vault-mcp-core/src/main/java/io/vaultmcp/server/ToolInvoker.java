/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.server;

import java.util.Map;

import io.vaultmcp.spec.McpError;
import io.vaultmcp.spec.VaultSchema;
import io.vaultmcp.spec.VaultSchema.CallToolResult;
import io.vaultmcp.util.Assert;
import io.vaultmcp.worker.SessionWorkerPool;
import io.vaultmcp.worker.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.annotation.Nullable;

/**
 * Resolves and executes tool calls. Calls flagged for the worker pool run on the
 * calling session's execution context; everything else runs on the bounded elastic
 * scheduler.
 */
public class ToolInvoker {

	private static final Logger logger = LoggerFactory.getLogger(ToolInvoker.class);

	private final ToolRegistry tools;

	@Nullable
	private final SessionWorkerPool workerPool;

	public ToolInvoker(ToolRegistry tools, @Nullable SessionWorkerPool workerPool) {
		Assert.notNull(tools, "tools must not be null");
		this.tools = tools;
		this.workerPool = workerPool;
	}

	public Mono<CallToolResult> invoke(String sessionId, String toolName, @Nullable Map<String, Object> arguments) {
		Map<String, Object> args = arguments == null ? Map.of() : arguments;
		return this.tools.resolveToolForCall(toolName, sessionId)
			.switchIfEmpty(Mono.error(() -> McpError.builder(VaultSchema.ErrorCodes.INVALID_PARAMS)
				.message("Unknown tool: " + toolName)
				.build()))
			.flatMap(specification -> execute(specification, sessionId, args));
	}

	private Mono<CallToolResult> execute(ToolSpecification specification, String sessionId, Map<String, Object> args) {
		String name = specification.tool().name();
		if (this.workerPool != null && specification.runsOnWorker(args)) {
			logger.debug("Offloading tool {} of session {} to the worker pool", name, sessionId);
			return this.workerPool.submit(WorkItem.of(sessionId, "tools/call " + name, args,
					() -> specification.handler().apply(sessionId, args)));
		}
		return Mono.fromCallable(() -> specification.handler().apply(sessionId, args))
			.subscribeOn(Schedulers.boundedElastic());
	}

}
