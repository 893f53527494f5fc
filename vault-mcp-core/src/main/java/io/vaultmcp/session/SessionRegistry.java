/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.vaultmcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory table of live {@link Session sessions} together with the idle-timeout and
 * capacity eviction policies. Holds no channels and performs no I/O; callers cascade the
 * returned evictions to the other registries.
 */
public class SessionRegistry {

	private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

	public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofHours(1);

	private static final Comparator<Session> EVICTION_ORDER = Comparator.comparing(Session::getLastActivity)
		.thenComparing(Session::getCreatedAt);

	private final Map<String, Session> sessions = new ConcurrentHashMap<>();

	private final int maxSessions;

	private final Duration idleTimeout;

	private final Clock clock;

	/**
	 * Creates a registry with no capacity bound and the default idle timeout.
	 */
	public SessionRegistry() {
		this(0, DEFAULT_IDLE_TIMEOUT, Clock.systemUTC());
	}

	/**
	 * Creates a new registry.
	 * @param maxSessions maximum number of live sessions, {@code 0} for unbounded
	 * @param idleTimeout inactivity period after which {@link #sweep(Instant)} removes a
	 * session
	 * @param clock source of activity timestamps
	 */
	public SessionRegistry(int maxSessions, Duration idleTimeout, Clock clock) {
		Assert.isTrue(maxSessions >= 0, "maxSessions must not be negative");
		Assert.notNull(idleTimeout, "idleTimeout must not be null");
		Assert.isTrue(!idleTimeout.isNegative() && !idleTimeout.isZero(), "idleTimeout must be positive");
		Assert.notNull(clock, "clock must not be null");
		this.maxSessions = maxSessions;
		this.idleTimeout = idleTimeout;
		this.clock = clock;
	}

	/**
	 * Returns the session for {@code id}, creating it with a zero request count when
	 * absent.
	 */
	public Session createOrGet(String id) {
		Assert.hasText(id, "Session id must not be empty");
		return this.sessions.computeIfAbsent(id, key -> {
			logger.debug("Created session {}", key);
			return new Session(key, this.clock.instant());
		});
	}

	public Optional<Session> get(String id) {
		return id == null ? Optional.empty() : Optional.ofNullable(this.sessions.get(id));
	}

	public boolean contains(String id) {
		return id != null && this.sessions.containsKey(id);
	}

	/**
	 * Records activity on a session. Does nothing for unknown ids.
	 */
	public void touch(String id) {
		if (id == null) {
			return;
		}
		Session session = this.sessions.get(id);
		if (session != null) {
			session.touch(this.clock.instant());
		}
	}

	public Optional<Session> remove(String id) {
		return id == null ? Optional.empty() : Optional.ofNullable(this.sessions.remove(id));
	}

	/**
	 * Removes every session idle for longer than the configured timeout.
	 * @param now the reference instant
	 * @return the removed sessions
	 */
	public List<Session> sweep(Instant now) {
		List<Session> removed = new ArrayList<>();
		for (Session session : this.sessions.values()) {
			if (Duration.between(session.getLastActivity(), now).compareTo(this.idleTimeout) > 0
					&& this.sessions.remove(session.getId(), session)) {
				removed.add(session);
			}
		}
		if (!removed.isEmpty()) {
			logger.info("Swept {} idle session(s)", removed.size());
		}
		return removed;
	}

	/**
	 * Evicts least recently active sessions, ties broken by creation time, until the
	 * registry is back within its capacity. The session {@code protectedId} is never
	 * chosen.
	 * @param protectedId the session that triggered the check
	 * @return one entry per evicted session
	 */
	public synchronized List<Session> evictIfOverCapacity(String protectedId) {
		if (this.maxSessions == 0 || this.sessions.size() <= this.maxSessions) {
			return List.of();
		}
		List<Session> candidates = new ArrayList<>(this.sessions.values());
		candidates.removeIf(session -> session.getId().equals(protectedId));
		candidates.sort(EVICTION_ORDER);

		List<Session> evicted = new ArrayList<>();
		for (Session candidate : candidates) {
			if (this.sessions.size() <= this.maxSessions) {
				break;
			}
			if (this.sessions.remove(candidate.getId(), candidate)) {
				logger.info("Evicted session {} (capacity {})", candidate.getId(), this.maxSessions);
				evicted.add(candidate);
			}
		}
		return evicted;
	}

	public int size() {
		return this.sessions.size();
	}

	public int getMaxSessions() {
		return this.maxSessions;
	}

	public Duration getIdleTimeout() {
		return this.idleTimeout;
	}

	public Instant now() {
		return this.clock.instant();
	}

	/**
	 * Current sessions ordered by creation time.
	 */
	public List<Session> snapshot() {
		List<Session> copy = new ArrayList<>(this.sessions.values());
		copy.sort(Comparator.comparing(Session::getCreatedAt));
		return copy;
	}

	/**
	 * Drops every session without cascading.
	 */
	public void clear() {
		this.sessions.clear();
	}

}
