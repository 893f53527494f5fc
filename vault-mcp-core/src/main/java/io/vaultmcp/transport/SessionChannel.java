/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.transport;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import io.vaultmcp.server.VaultProtocolHandler;
import io.vaultmcp.spec.ChannelException;
import io.vaultmcp.spec.VaultSchema;
import io.vaultmcp.spec.VaultSchema.JSONRPCNotification;
import io.vaultmcp.spec.VaultSchema.JSONRPCRequest;
import io.vaultmcp.spec.VaultSchema.JSONRPCResponse;
import io.vaultmcp.spec.VaultSchema.JSONRPCResponse.JSONRPCError;
import io.vaultmcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Stateful binding between one session and one {@link VaultProtocolHandler}.
 * <p>
 * A channel starts uninitialized and refuses every request other than
 * {@code initialize} with {@link VaultSchema.ErrorCodes#NOT_INITIALIZED} until a
 * handshake succeeds, either sent by the client or performed on its behalf through
 * {@link #handshakeInternally(String)}. Closing is idempotent and listeners hear about
 * it once.
 */
public class SessionChannel {

	private static final Logger logger = LoggerFactory.getLogger(SessionChannel.class);

	static final String NOT_INITIALIZED_MESSAGE = "Bad Request: Server not initialized";

	private final String sessionId;

	private final VaultProtocolHandler handler;

	private final AtomicBoolean initialized = new AtomicBoolean(false);

	private final AtomicBoolean closed = new AtomicBoolean(false);

	private final List<ChannelListener> listeners = new CopyOnWriteArrayList<>();

	public SessionChannel(String sessionId, VaultProtocolHandler handler) {
		Assert.hasText(sessionId, "sessionId must not be empty");
		Assert.notNull(handler, "handler must not be null");
		this.sessionId = sessionId;
		this.handler = handler;
	}

	public String getSessionId() {
		return this.sessionId;
	}

	public VaultProtocolHandler getHandler() {
		return this.handler;
	}

	public boolean isInitialized() {
		return this.initialized.get();
	}

	public boolean isClosed() {
		return this.closed.get();
	}

	public void addListener(ChannelListener listener) {
		Assert.notNull(listener, "listener must not be null");
		this.listeners.add(listener);
	}

	/**
	 * Dispatches a request to the bound handler.
	 * @param request the request
	 * @return the handler's response, or a not-initialized error response when no
	 * handshake has completed yet
	 */
	public Mono<JSONRPCResponse> dispatch(JSONRPCRequest request) {
		if (this.closed.get()) {
			return Mono.error(new ChannelException("Channel for session " + this.sessionId + " is closed"));
		}
		if (VaultSchema.METHOD_INITIALIZE.equals(request.method())) {
			return this.handler.handleRequest(this.sessionId, request).doOnNext(response -> {
				if (response.error() == null && this.initialized.compareAndSet(false, true)) {
					logger.debug("Session {} initialized by client handshake", this.sessionId);
				}
			});
		}
		if (!this.initialized.get()) {
			return Mono.just(notInitialized(request.id()));
		}
		return this.handler.handleRequest(this.sessionId, request);
	}

	/**
	 * Delivers a notification to the bound handler.
	 */
	public Mono<Void> accept(JSONRPCNotification notification) {
		if (this.closed.get()) {
			return Mono.error(new ChannelException("Channel for session " + this.sessionId + " is closed"));
		}
		return this.handler.handleNotification(this.sessionId, notification);
	}

	/**
	 * Runs the initialize handshake on the client's behalf. No response is produced.
	 * @param protocolVersion the version to offer
	 * @return {@code true} if the handler accepted the version
	 */
	public boolean handshakeInternally(String protocolVersion) {
		if (this.closed.get()) {
			return false;
		}
		if (this.handler.handshakeInternally(protocolVersion)) {
			this.initialized.set(true);
			return true;
		}
		return false;
	}

	/**
	 * Reports a transport failure to the listeners, then closes the channel.
	 */
	public void fail(Throwable error) {
		if (this.closed.get()) {
			return;
		}
		logger.warn("Channel for session {} failed: {}", this.sessionId, error.getMessage());
		for (ChannelListener listener : this.listeners) {
			listener.onError(this, error);
		}
		close();
	}

	public void close() {
		if (!this.closed.compareAndSet(false, true)) {
			return;
		}
		logger.debug("Closing channel for session {}", this.sessionId);
		for (ChannelListener listener : this.listeners) {
			try {
				listener.onClose(this);
			}
			catch (RuntimeException ex) {
				logger.warn("Close listener failed for session {}", this.sessionId, ex);
			}
		}
	}

	JSONRPCResponse notInitialized(Object requestId) {
		return JSONRPCResponse.failure(requestId, new JSONRPCError(VaultSchema.ErrorCodes.NOT_INITIALIZED,
				NOT_INITIALIZED_MESSAGE, Map.of("sessionId", this.sessionId)));
	}

	@Override
	public String toString() {
		return "SessionChannel{sessionId=" + this.sessionId + ", initialized=" + this.initialized.get() + ", closed="
				+ this.closed.get() + "}";
	}

}
