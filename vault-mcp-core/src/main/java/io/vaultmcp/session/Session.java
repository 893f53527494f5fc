/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.session;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

import io.vaultmcp.util.Assert;

/**
 * Bookkeeping record of one client session. The identifier never changes; activity
 * fields are updated by {@link SessionRegistry#touch(String)}.
 */
public final class Session {

	private final String id;

	private final Instant createdAt;

	private volatile Instant lastActivity;

	private final AtomicLong requestCount = new AtomicLong();

	Session(String id, Instant createdAt) {
		Assert.hasText(id, "Session id must not be empty");
		Assert.notNull(createdAt, "createdAt must not be null");
		this.id = id;
		this.createdAt = createdAt;
		this.lastActivity = createdAt;
	}

	public String getId() {
		return this.id;
	}

	public Instant getCreatedAt() {
		return this.createdAt;
	}

	public Instant getLastActivity() {
		return this.lastActivity;
	}

	public long getRequestCount() {
		return this.requestCount.get();
	}

	void touch(Instant now) {
		this.lastActivity = now;
		this.requestCount.incrementAndGet();
	}

	@Override
	public String toString() {
		return "Session{id=" + this.id + ", createdAt=" + this.createdAt + ", lastActivity=" + this.lastActivity
				+ ", requestCount=" + this.requestCount.get() + "}";
	}

}
