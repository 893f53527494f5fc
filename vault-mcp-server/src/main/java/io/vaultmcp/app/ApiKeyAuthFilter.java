/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.app;

import java.io.IOException;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.vaultmcp.app.ApiKeyAuthenticator.AuthenticationException;
import io.vaultmcp.util.Assert;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rejects requests without a valid API key with {@code 401}. CORS preflight
 * ({@code OPTIONS}) requests pass through unauthenticated.
 */
public class ApiKeyAuthFilter implements Filter {

	private static final Logger logger = LoggerFactory.getLogger(ApiKeyAuthFilter.class);

	public static final String WWW_AUTHENTICATE = "WWW-Authenticate";

	private final ApiKeyAuthenticator authenticator;

	private final ObjectMapper objectMapper;

	public ApiKeyAuthFilter(ApiKeyAuthenticator authenticator, ObjectMapper objectMapper) {
		Assert.notNull(authenticator, "authenticator must not be null");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		this.authenticator = authenticator;
		this.objectMapper = objectMapper;
	}

	@Override
	public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
			throws IOException, ServletException {
		if (!(request instanceof HttpServletRequest httpRequest)
				|| !(response instanceof HttpServletResponse httpResponse)) {
			chain.doFilter(request, response);
			return;
		}
		if ("OPTIONS".equalsIgnoreCase(httpRequest.getMethod())) {
			chain.doFilter(request, response);
			return;
		}

		try {
			this.authenticator.authenticate(httpRequest.getHeader("Authorization"));
		}
		catch (AuthenticationException ex) {
			logger.debug("Rejected {} {} from {}: {}", httpRequest.getMethod(), httpRequest.getRequestURI(),
					httpRequest.getRemoteAddr(), ex.getMessage());
			httpResponse.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
			httpResponse.setHeader(WWW_AUTHENTICATE, "Bearer, Basic realm=\"vault-mcp\"");
			httpResponse.setContentType("application/json");
			httpResponse.setCharacterEncoding("UTF-8");
			httpResponse.getWriter().write(this.objectMapper.writeValueAsString(Map.of("error", ex.getMessage())));
			httpResponse.getWriter().flush();
			return;
		}
		chain.doFilter(request, response);
	}

}
