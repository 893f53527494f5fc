/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.app;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.vaultmcp.server.VaultMcpServer;
import io.vaultmcp.server.transport.HttpServletVaultEndpoint;
import io.vaultmcp.spec.VaultSchema.Implementation;
import io.vaultmcp.util.Assert;
import io.vaultmcp.vault.FileSystemVaultStore;
import io.vaultmcp.vault.VaultStore;
import io.vaultmcp.vault.security.SecureVaultStore;
import io.vaultmcp.vault.security.SecuritySettings;
import io.vaultmcp.vault.security.VaultSecurityManager;
import io.vaultmcp.vault.tools.VaultResources;
import io.vaultmcp.vault.tools.VaultTools;
import jakarta.servlet.Servlet;
import org.apache.catalina.Context;
import org.apache.catalina.LifecycleException;
import org.apache.catalina.Wrapper;
import org.apache.catalina.startup.Tomcat;
import org.apache.tomcat.util.descriptor.web.FilterDef;
import org.apache.tomcat.util.descriptor.web.FilterMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Standalone vault MCP server on embedded Tomcat.
 */
public class VaultServerApplication implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(VaultServerApplication.class);

	public static final String SERVER_NAME = "vault-mcp";

	public static final String SERVER_VERSION = "1.0.0";

	static final String INSTRUCTIONS = "Use the 'vault' tool to list, read, create, update, delete and search "
			+ "documents of the vault. Paths are relative to the vault root.";

	private final VaultServerProperties properties;

	private final VaultMcpServer mcpServer;

	private final Tomcat tomcat;

	private boolean started;

	private boolean closed;

	public VaultServerApplication(VaultServerProperties properties) {
		Assert.notNull(properties, "properties must not be null");
		Assert.isTrue(Files.isDirectory(properties.getVaultPath()),
				"Vault path is not a directory: " + properties.getVaultPath());
		this.properties = properties;
		this.mcpServer = createMcpServer(properties, new ObjectMapper());
		this.tomcat = createTomcat(properties, this.mcpServer);
	}

	static VaultMcpServer createMcpServer(VaultServerProperties properties, ObjectMapper objectMapper) {
		SecuritySettings settings = properties.isReadOnly() ? SecuritySettings.readOnly()
				: SecuritySettings.permissive();
		if (!properties.getBlockedPaths().isEmpty()) {
			settings = settings.withBlockedPaths(properties.getBlockedPaths());
		}
		VaultStore store = new SecureVaultStore(new FileSystemVaultStore(properties.getVaultPath()),
				new VaultSecurityManager(settings));

		VaultMcpServer.Builder builder = VaultMcpServer.builder()
			.objectMapper(objectMapper)
			.serverInfo(SERVER_NAME, SERVER_VERSION)
			.instructions(INSTRUCTIONS)
			.concurrentSessions(properties.isConcurrentSessions())
			.maxConnections(properties.getMaxConnections())
			.requestTimeout(properties.getRequestTimeout())
			.sessionIdleTimeout(properties.getSessionIdleTimeout());
		Implementation serverInfo = new Implementation(SERVER_NAME, SERVER_VERSION);
		return builder.tools(new VaultTools(store, serverInfo).specifications())
			.resource(VaultResources.vaultInfo(store, serverInfo, objectMapper))
			.build();
	}

	private static Tomcat createTomcat(VaultServerProperties properties, VaultMcpServer mcpServer) {
		Tomcat tomcat = new Tomcat();
		tomcat.setPort(properties.getPort());

		String baseDir = System.getProperty("java.io.tmpdir");
		tomcat.setBaseDir(baseDir);

		Context context = tomcat.addContext("", baseDir);

		addServlet(context, "vaultEndpoint", new HttpServletVaultEndpoint(mcpServer));
		context.addServletMappingDecoded(HttpServletVaultEndpoint.DEFAULT_ENDPOINT, "vaultEndpoint");

		Path vaultName = properties.getVaultPath().toAbsolutePath().normalize().getFileName();
		addServlet(context, "serverInfo", new ServerInfoServlet(mcpServer.getObjectMapper(),
				mcpServer.getServerInfo(), vaultName == null ? "" : vaultName.toString(), Clock.systemUTC()));
		context.addServletMappingDecoded(ServerInfoServlet.HEALTH_PATH, "serverInfo");
		context.addServletMappingDecoded(ServerInfoServlet.DISCOVERY_PATH, "serverInfo");

		if (properties.isAuthRequired()) {
			FilterDef filterDef = new FilterDef();
			filterDef.setFilterName("apiKeyAuth");
			filterDef.setFilter(new ApiKeyAuthFilter(new ApiKeyAuthenticator(properties.getApiKey()),
					mcpServer.getObjectMapper()));
			filterDef.setAsyncSupported("true");
			context.addFilterDef(filterDef);
			FilterMap filterMap = new FilterMap();
			filterMap.setFilterName("apiKeyAuth");
			filterMap.addURLPattern("/*");
			context.addFilterMap(filterMap);
		}
		else if (properties.isAuthDisabled()) {
			logger.warn("Authentication is disabled, the vault is reachable without an API key");
		}
		else {
			logger.warn("No API key configured, the vault is reachable without authentication");
		}

		tomcat.getConnector().setAsyncTimeout(properties.getRequestTimeout().toMillis() * 2);
		return tomcat;
	}

	private static void addServlet(Context context, String name, Servlet servlet) {
		Wrapper wrapper = context.createWrapper();
		wrapper.setName(name);
		wrapper.setServlet(servlet);
		wrapper.setLoadOnStartup(1);
		wrapper.setAsyncSupported(true);
		context.addChild(wrapper);
	}

	public synchronized void start() throws LifecycleException {
		Assert.isTrue(!this.closed, "Application is closed");
		if (this.started) {
			return;
		}
		this.tomcat.start();
		this.started = true;
		logger.info("Vault MCP server started on port {} serving {}", getPort(), this.properties.getVaultPath());
		logger.info("Server URL: http://localhost:{}{}", getPort(), HttpServletVaultEndpoint.DEFAULT_ENDPOINT);
	}

	/**
	 * The port the connector listens on, the actual one when configured with port 0.
	 */
	public int getPort() {
		int localPort = this.tomcat.getConnector().getLocalPort();
		return localPort > 0 ? localPort : this.properties.getPort();
	}

	public VaultMcpServer getMcpServer() {
		return this.mcpServer;
	}

	public void await() {
		this.tomcat.getServer().await();
	}

	@Override
	public synchronized void close() {
		if (this.closed) {
			return;
		}
		this.closed = true;
		logger.info("Shutting down vault MCP server...");
		this.mcpServer.close();
		try {
			this.tomcat.stop();
			this.tomcat.destroy();
		}
		catch (LifecycleException e) {
			logger.error("Error during Tomcat shutdown", e);
		}
	}

	public static void main(String[] args) throws LifecycleException {
		VaultServerProperties properties = VaultServerProperties.load();
		logger.info("Starting vault MCP server with {}", properties);

		VaultServerApplication application = new VaultServerApplication(properties);
		Runtime.getRuntime().addShutdownHook(new Thread(application::close, "vault-mcp-shutdown"));
		try {
			application.start();
			application.await();
		}
		catch (LifecycleException e) {
			logger.error("Failed to start Tomcat server", e);
			throw e;
		}
		finally {
			application.close();
		}
	}

}
