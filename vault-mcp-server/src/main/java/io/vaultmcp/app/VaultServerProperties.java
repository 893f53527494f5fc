/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.app;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

import io.vaultmcp.util.Assert;
import io.vaultmcp.util.Utils;

/**
 * Settings of the standalone server. Every value is looked up as a system property
 * first ({@code vault.port}), then as an environment variable ({@code VAULT_PORT}), and
 * falls back to a default.
 */
public final class VaultServerProperties {

	public static final int DEFAULT_PORT = 3001;

	public static final int DEFAULT_MAX_CONNECTIONS = 32;

	public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

	public static final Duration DEFAULT_SESSION_IDLE_TIMEOUT = Duration.ofHours(1);

	private final Path vaultPath;

	private final int port;

	private final String apiKey;

	private final boolean authDisabled;

	private final boolean readOnly;

	private final boolean concurrentSessions;

	private final int maxConnections;

	private final Duration requestTimeout;

	private final Duration sessionIdleTimeout;

	private final List<String> blockedPaths;

	private VaultServerProperties(Source source) {
		this.vaultPath = Path.of(source.get("vault.path", "VAULT_PATH", "."));
		this.port = source.getInt("vault.port", "PORT", DEFAULT_PORT);
		this.apiKey = source.get("vault.api-key", "VAULT_API_KEY", null);
		this.authDisabled = source.getBoolean("vault.auth-disabled", "VAULT_AUTH_DISABLED", false);
		this.readOnly = source.getBoolean("vault.read-only", "VAULT_READ_ONLY", false);
		this.concurrentSessions = source.getBoolean("vault.concurrent-sessions", "VAULT_CONCURRENT_SESSIONS", false);
		this.maxConnections = source.getInt("vault.max-connections", "VAULT_MAX_CONNECTIONS",
				DEFAULT_MAX_CONNECTIONS);
		this.requestTimeout = Duration.ofMillis(source.getInt("vault.request-timeout-ms", "VAULT_REQUEST_TIMEOUT_MS",
				(int) DEFAULT_REQUEST_TIMEOUT.toMillis()));
		this.sessionIdleTimeout = Duration.ofSeconds(source.getInt("vault.session-idle-timeout-seconds",
				"VAULT_SESSION_IDLE_TIMEOUT_SECONDS", (int) DEFAULT_SESSION_IDLE_TIMEOUT.toSeconds()));
		String blocked = source.get("vault.blocked-paths", "VAULT_BLOCKED_PATHS", "");
		this.blockedPaths = Arrays.stream(blocked.split(",")).map(String::trim).filter(Utils::hasText).toList();

		Assert.isTrue(this.port >= 0 && this.port <= 65535, "vault.port must be between 0 and 65535");
		Assert.isTrue(this.maxConnections > 0, "vault.max-connections must be positive");
		Assert.isTrue(!this.requestTimeout.isZero() && !this.requestTimeout.isNegative(),
				"vault.request-timeout-ms must be positive");
		Assert.isTrue(!this.sessionIdleTimeout.isZero() && !this.sessionIdleTimeout.isNegative(),
				"vault.session-idle-timeout-seconds must be positive");
	}

	/**
	 * Reads the settings of the running JVM.
	 */
	public static VaultServerProperties load() {
		return load(System::getProperty, System::getenv);
	}

	public static VaultServerProperties load(Function<String, String> systemProperties,
			Function<String, String> environment) {
		Assert.notNull(systemProperties, "systemProperties must not be null");
		Assert.notNull(environment, "environment must not be null");
		return new VaultServerProperties(new Source(systemProperties, environment));
	}

	public Path getVaultPath() {
		return this.vaultPath;
	}

	public int getPort() {
		return this.port;
	}

	public String getApiKey() {
		return this.apiKey;
	}

	public boolean isAuthDisabled() {
		return this.authDisabled;
	}

	/**
	 * Whether requests have to present the API key.
	 */
	public boolean isAuthRequired() {
		return !this.authDisabled && Utils.hasText(this.apiKey);
	}

	public boolean isReadOnly() {
		return this.readOnly;
	}

	public boolean isConcurrentSessions() {
		return this.concurrentSessions;
	}

	public int getMaxConnections() {
		return this.maxConnections;
	}

	public Duration getRequestTimeout() {
		return this.requestTimeout;
	}

	public Duration getSessionIdleTimeout() {
		return this.sessionIdleTimeout;
	}

	public List<String> getBlockedPaths() {
		return this.blockedPaths;
	}

	@Override
	public String toString() {
		return "VaultServerProperties[vaultPath=" + this.vaultPath + ", port=" + this.port + ", authRequired="
				+ isAuthRequired() + ", readOnly=" + this.readOnly + ", concurrentSessions=" + this.concurrentSessions
				+ ", maxConnections=" + this.maxConnections + ", requestTimeout=" + this.requestTimeout
				+ ", sessionIdleTimeout=" + this.sessionIdleTimeout + ", blockedPaths=" + this.blockedPaths + "]";
	}

	private static final class Source {

		private final Function<String, String> systemProperties;

		private final Function<String, String> environment;

		private Source(Function<String, String> systemProperties, Function<String, String> environment) {
			this.systemProperties = systemProperties;
			this.environment = environment;
		}

		String get(String property, String variable, String defaultValue) {
			String value = this.systemProperties.apply(property);
			if (!Utils.hasText(value)) {
				value = this.environment.apply(variable);
			}
			return Utils.hasText(value) ? value.trim() : defaultValue;
		}

		int getInt(String property, String variable, int defaultValue) {
			String value = get(property, variable, null);
			if (value == null) {
				return defaultValue;
			}
			try {
				return Integer.parseInt(value);
			}
			catch (NumberFormatException ex) {
				throw new IllegalArgumentException("Invalid value for " + property + ": " + value, ex);
			}
		}

		boolean getBoolean(String property, String variable, boolean defaultValue) {
			String value = get(property, variable, null);
			if (value == null) {
				return defaultValue;
			}
			return switch (value.toLowerCase(Locale.ROOT)) {
				case "true", "yes", "1" -> true;
				case "false", "no", "0" -> false;
				default -> throw new IllegalArgumentException("Invalid value for " + property + ": " + value);
			};
		}

	}

}
