/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.util;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * A fixed set of locks addressed by key hash. Two callers holding the same key always
 * contend on the same lock; callers with different keys usually do not.
 */
public final class StripedLocks {

	private final ReentrantLock[] stripes;

	public StripedLocks(int stripes) {
		Assert.isTrue(stripes > 0, "stripes must be positive");
		this.stripes = new ReentrantLock[stripes];
		for (int i = 0; i < stripes; i++) {
			this.stripes[i] = new ReentrantLock();
		}
	}

	/**
	 * Runs the supplier while holding the lock for {@code key}.
	 * @param key the key to serialize on
	 * @param action the action to run
	 * @param <T> the result type
	 * @return the value produced by the action
	 */
	public <T> T withLock(String key, Supplier<T> action) {
		ReentrantLock lock = lockFor(key);
		lock.lock();
		try {
			return action.get();
		}
		finally {
			lock.unlock();
		}
	}

	ReentrantLock lockFor(String key) {
		int index = (key.hashCode() & 0x7fffffff) % this.stripes.length;
		return this.stripes[index];
	}

}
