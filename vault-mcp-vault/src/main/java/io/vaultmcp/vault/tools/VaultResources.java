/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.vault.tools;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.vaultmcp.server.ResourceSpecification;
import io.vaultmcp.spec.VaultSchema;
import io.vaultmcp.vault.VaultInfo;
import io.vaultmcp.vault.VaultStore;

/**
 * Resources describing the vault.
 */
public final class VaultResources {

	public static final String VAULT_INFO_URI = "vault://vault-info";

	private VaultResources() {
	}

	public static ResourceSpecification vaultInfo(VaultStore store, VaultSchema.Implementation serverInfo,
			ObjectMapper objectMapper) {
		VaultSchema.Resource resource = new VaultSchema.Resource(VAULT_INFO_URI, "Vault Information",
				"Current vault status, file counts and metadata", "application/json");
		return new ResourceSpecification(resource, sessionId -> {
			VaultInfo info = store.info();
			Map<String, Object> vault = new LinkedHashMap<>();
			vault.put("name", info.name());
			vault.put("path", info.path());
			Map<String, Object> files = new LinkedHashMap<>();
			files.put("total", info.totalFiles());
			files.put("markdown", info.markdownFiles());
			files.put("attachments", info.attachments());
			Map<String, Object> server = new LinkedHashMap<>();
			server.put("name", serverInfo.name());
			server.put("version", serverInfo.version());
			server.put("status", "Connected and operational");

			Map<String, Object> body = new LinkedHashMap<>();
			body.put("vault", vault);
			body.put("files", files);
			body.put("server", server);
			body.put("timestamp", Instant.now().toString());
			String text = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(body);
			return new VaultSchema.ReadResourceResult(
					List.of(new VaultSchema.TextResourceContents(VAULT_INFO_URI, "application/json", text)));
		});
	}

}
