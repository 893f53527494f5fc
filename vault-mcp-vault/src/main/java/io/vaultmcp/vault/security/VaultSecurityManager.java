/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.vault.security;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

import io.vaultmcp.util.Assert;
import io.vaultmcp.vault.security.VaultSecurityException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single checkpoint for every vault operation: verifies the operation is permitted,
 * normalizes and validates the path and applies the configured path rules.
 * Every decision is recorded in a bounded audit log.
 */
public class VaultSecurityManager {

	private static final Logger logger = LoggerFactory.getLogger(VaultSecurityManager.class);

	static final int MAX_AUDIT_ENTRIES = 1000;

	private final SecuritySettings settings;

	private final Clock clock;

	private final Map<String, Pattern> patternCache = new ConcurrentHashMap<>();

	// guarded by itself
	private final Deque<SecurityEvent> auditLog = new ArrayDeque<>();

	public VaultSecurityManager(SecuritySettings settings) {
		this(settings, Clock.systemUTC());
	}

	public VaultSecurityManager(SecuritySettings settings, Clock clock) {
		Assert.notNull(settings, "settings must not be null");
		Assert.notNull(clock, "clock must not be null");
		this.settings = settings;
		this.clock = clock;
	}

	public SecuritySettings getSettings() {
		return this.settings;
	}

	/**
	 * Validates an operation on a path.
	 * @param operation the operation
	 * @param path the vault-relative path, {@code null} or empty for the vault root
	 * @return the normalized path
	 * @throws VaultSecurityException if the operation is rejected
	 */
	public String validate(VaultOperation operation, String path) {
		Assert.notNull(operation, "operation must not be null");
		if (!this.settings.isAllowed(operation)) {
			throw reject(operation, path, Reason.PERMISSION_DENIED,
					"Operation '" + operation.name().toLowerCase(Locale.ROOT)
							+ "' is not permitted in the current security mode");
		}
		String normalized = normalize(operation, path);
		if (isBlocked(normalized)) {
			throw reject(operation, normalized, Reason.PATH_BLOCKED, "Access to path '" + normalized + "' is blocked");
		}
		if (!normalized.isEmpty() && !isAllowedPath(normalized)) {
			throw reject(operation, normalized, Reason.PATH_NOT_ALLOWED,
					"Access to path '" + normalized + "' is not allowed");
		}
		String sandbox = this.settings.sandbox();
		if (!normalized.isEmpty() && !isInSandbox(normalized)) {
			throw reject(operation, normalized, Reason.SANDBOX_VIOLATION, "Path must be within sandbox: " + sandbox);
		}
		record(new SecurityEvent(this.clock.instant(), operation, normalized, true, null));
		return normalized;
	}

	/**
	 * Whether a path would pass a {@link VaultOperation#READ} check, without recording
	 * anything.
	 */
	public boolean isReadable(String path) {
		if (!this.settings.isAllowed(VaultOperation.READ)) {
			return false;
		}
		String normalized;
		try {
			normalized = normalize(VaultOperation.READ, path);
		}
		catch (VaultSecurityException ex) {
			return false;
		}
		return !isBlocked(normalized) && isAllowedPath(normalized) && isInSandbox(normalized);
	}

	public List<SecurityEvent> getAuditLog() {
		synchronized (this.auditLog) {
			return List.copyOf(this.auditLog);
		}
	}

	public void clearAuditLog() {
		synchronized (this.auditLog) {
			this.auditLog.clear();
		}
	}

	private String normalize(VaultOperation operation, String path) {
		if (path == null) {
			return "";
		}
		if (path.indexOf('\0') >= 0) {
			throw reject(operation, path, Reason.INVALID_PATH, "Path contains a null byte");
		}
		String normalized = path.trim().replace('\\', '/');
		if (normalized.matches("^[A-Za-z]:.*")) {
			throw reject(operation, path, Reason.INVALID_PATH, "Absolute paths are not allowed: " + path);
		}
		while (normalized.startsWith("/")) {
			normalized = normalized.substring(1);
		}
		StringBuilder result = new StringBuilder();
		for (String segment : normalized.split("/")) {
			if (segment.isEmpty() || segment.equals(".")) {
				continue;
			}
			if (segment.equals("..")) {
				throw reject(operation, path, Reason.INVALID_PATH, "Path traversal is not allowed: " + path);
			}
			if (result.length() > 0) {
				result.append('/');
			}
			result.append(segment);
		}
		return result.toString();
	}

	private boolean isBlocked(String path) {
		return this.settings.blockedPaths().stream().anyMatch(pattern -> matches(path, pattern));
	}

	private boolean isAllowedPath(String path) {
		List<String> allowed = this.settings.allowedPaths();
		return allowed.isEmpty() || allowed.stream().anyMatch(pattern -> matches(path, pattern));
	}

	private boolean isInSandbox(String path) {
		String sandbox = this.settings.sandbox();
		return sandbox == null || sandbox.isEmpty() || path.startsWith(sandbox);
	}

	boolean matches(String path, String glob) {
		Pattern pattern = this.patternCache.computeIfAbsent(glob, key -> {
			String[] parts = key.split("\\*", -1);
			StringBuilder regex = new StringBuilder("^");
			for (int i = 0; i < parts.length; i++) {
				if (i > 0) {
					regex.append(".*");
				}
				regex.append(Pattern.quote(parts[i]));
			}
			return Pattern.compile(regex.append('$').toString());
		});
		return pattern.matcher(path).matches();
	}

	private VaultSecurityException reject(VaultOperation operation, String path, Reason reason, String message) {
		logger.info("Security blocked {} on '{}': {}", operation, path, reason);
		record(new SecurityEvent(this.clock.instant(), operation, path, false, reason));
		return new VaultSecurityException(reason, operation, path, message);
	}

	private void record(SecurityEvent event) {
		synchronized (this.auditLog) {
			this.auditLog.addLast(event);
			if (this.auditLog.size() > MAX_AUDIT_ENTRIES) {
				this.auditLog.removeFirst();
			}
		}
	}

}
