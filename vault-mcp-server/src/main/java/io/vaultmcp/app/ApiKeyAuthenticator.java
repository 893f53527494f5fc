/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.app;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;

import io.vaultmcp.util.Assert;

/**
 * Checks an {@code Authorization} header against the configured API key. The key is
 * accepted as a bearer token or as the password of Basic credentials, the user name is
 * ignored.
 */
public class ApiKeyAuthenticator {

	private static final String BEARER_PREFIX = "Bearer ";

	private static final String BASIC_PREFIX = "Basic ";

	private final byte[] apiKey;

	public ApiKeyAuthenticator(String apiKey) {
		Assert.hasText(apiKey, "apiKey must not be empty");
		this.apiKey = apiKey.getBytes(StandardCharsets.UTF_8);
	}

	/**
	 * Authenticate a request.
	 * @param authHeader the Authorization header value
	 * @throws AuthenticationException when the header is missing, malformed or carries
	 * the wrong key
	 */
	public void authenticate(String authHeader) throws AuthenticationException {
		if (authHeader == null || authHeader.isBlank()) {
			throw new AuthenticationException("Missing Authorization header");
		}

		if (authHeader.startsWith(BEARER_PREFIX)) {
			String token = authHeader.substring(BEARER_PREFIX.length()).trim();
			if (token.isEmpty()) {
				throw new AuthenticationException("Empty bearer token");
			}
			verify(token);
		}
		else if (authHeader.startsWith(BASIC_PREFIX)) {
			verify(basicPassword(authHeader.substring(BASIC_PREFIX.length()).trim()));
		}
		else {
			throw new AuthenticationException("Unsupported authorization scheme");
		}
	}

	private static String basicPassword(String encoded) throws AuthenticationException {
		String credentials;
		try {
			credentials = new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
		}
		catch (IllegalArgumentException ex) {
			throw new AuthenticationException("Malformed Basic credentials");
		}
		int colon = credentials.indexOf(':');
		if (colon < 0) {
			throw new AuthenticationException("Malformed Basic credentials");
		}
		return credentials.substring(colon + 1);
	}

	private void verify(String candidate) throws AuthenticationException {
		if (!MessageDigest.isEqual(this.apiKey, candidate.getBytes(StandardCharsets.UTF_8))) {
			throw new AuthenticationException("Invalid API key");
		}
	}

	/**
	 * Exception thrown when API key authentication fails.
	 */
	public static class AuthenticationException extends Exception {

		private static final long serialVersionUID = 1L;

		public AuthenticationException(String message) {
			super(message);
		}

	}

}
