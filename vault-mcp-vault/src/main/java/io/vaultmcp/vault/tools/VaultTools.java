/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.vault.tools;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.vaultmcp.server.ToolSpecification;
import io.vaultmcp.spec.McpError;
import io.vaultmcp.spec.VaultSchema;
import io.vaultmcp.spec.VaultSchema.CallToolResult;
import io.vaultmcp.util.Assert;
import io.vaultmcp.vault.VaultDocument;
import io.vaultmcp.vault.VaultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The tool catalog of the vault server: a {@code vault} tool for document operations
 * and a {@code system} tool describing the server.
 */
public class VaultTools {

	private static final Logger logger = LoggerFactory.getLogger(VaultTools.class);

	public static final String VAULT_TOOL = "vault";

	public static final String SYSTEM_TOOL = "system";

	static final int DEFAULT_SEARCH_LIMIT = 50;

	private final VaultStore store;

	private final VaultSchema.Implementation serverInfo;

	public VaultTools(VaultStore store, VaultSchema.Implementation serverInfo) {
		Assert.notNull(store, "store must not be null");
		Assert.notNull(serverInfo, "serverInfo must not be null");
		this.store = store;
		this.serverInfo = serverInfo;
	}

	public List<ToolSpecification> specifications() {
		return List.of(vaultTool(), systemTool());
	}

	ToolSpecification vaultTool() {
		Map<String, Object> properties = new LinkedHashMap<>();
		properties.put("action", Map.of("type", "string", "enum",
				List.of("list", "read", "create", "update", "delete", "search"), "description",
				"The document operation to perform"));
		properties.put("path", Map.of("type", "string", "description", "Vault-relative path of a file or folder"));
		properties.put("content", Map.of("type", "string", "description", "File content for create and update"));
		properties.put("query", Map.of("type", "string", "description", "Text to search for"));
		properties.put("limit", Map.of("type", "integer", "description", "Maximum number of search results"));
		VaultSchema.Tool tool = new VaultSchema.Tool(VAULT_TOOL,
				"List, read, create, update, delete and search documents in the vault", objectSchema(properties));
		// searches walk the whole vault and run on the session's worker context
		return new ToolSpecification(tool, (sessionId, arguments) -> vault(arguments),
				arguments -> "search".equals(arguments.get("action")));
	}

	ToolSpecification systemTool() {
		Map<String, Object> properties = new LinkedHashMap<>();
		properties.put("action",
				Map.of("type", "string", "enum", List.of("info"), "description", "The system operation to perform"));
		VaultSchema.Tool tool = new VaultSchema.Tool(SYSTEM_TOOL, "Server and vault information",
				objectSchema(properties));
		return ToolSpecification.of(tool, (sessionId, arguments) -> system(arguments));
	}

	CallToolResult vault(Map<String, Object> arguments) {
		String action = requireString(arguments, "action");
		logger.debug("vault.{} {}", action, arguments.get("path"));
		switch (action) {
			case "list": {
				String path = optionalString(arguments, "path");
				return CallToolResult.text(VaultFormatters.fileList(path, this.store.list(path)));
			}
			case "read":
				return CallToolResult.text(VaultFormatters.fileRead(this.store.read(requireString(arguments, "path"))));
			case "create": {
				VaultDocument created = this.store.create(requireString(arguments, "path"),
						optionalString(arguments, "content"));
				return CallToolResult.text(VaultFormatters.fileWrite(created, "Created"));
			}
			case "update": {
				VaultDocument updated = this.store.update(requireString(arguments, "path"),
						requireString(arguments, "content"));
				return CallToolResult.text(VaultFormatters.fileWrite(updated, "Updated"));
			}
			case "delete": {
				String path = requireString(arguments, "path");
				this.store.delete(path);
				return CallToolResult.text(VaultFormatters.fileDelete(path));
			}
			case "search": {
				String query = requireString(arguments, "query");
				int limit = optionalInt(arguments, "limit", DEFAULT_SEARCH_LIMIT);
				return CallToolResult.text(VaultFormatters.searchResults(query, this.store.search(query, limit)));
			}
			default:
				throw invalidParams("Unknown vault action: " + action);
		}
	}

	CallToolResult system(Map<String, Object> arguments) {
		String action = optionalString(arguments, "action");
		if (action != null && !"info".equals(action)) {
			throw invalidParams("Unknown system action: " + action);
		}
		return CallToolResult
			.text(VaultFormatters.systemInfo(this.serverInfo.name(), this.serverInfo.version(), this.store.info()));
	}

	private static Map<String, Object> objectSchema(Map<String, Object> properties) {
		Map<String, Object> schema = new LinkedHashMap<>();
		schema.put("type", "object");
		schema.put("properties", properties);
		schema.put("required", List.of("action"));
		return schema;
	}

	private static String requireString(Map<String, Object> arguments, String name) {
		String value = optionalString(arguments, name);
		if (value == null || value.isEmpty()) {
			throw invalidParams("Missing required argument: " + name);
		}
		return value;
	}

	private static String optionalString(Map<String, Object> arguments, String name) {
		Object value = arguments.get(name);
		if (value == null) {
			return null;
		}
		if (!(value instanceof String text)) {
			throw invalidParams("Argument '" + name + "' must be a string");
		}
		return text;
	}

	private static int optionalInt(Map<String, Object> arguments, String name, int defaultValue) {
		Object value = arguments.get(name);
		if (value == null) {
			return defaultValue;
		}
		if (!(value instanceof Number number) || number.intValue() <= 0) {
			throw invalidParams("Argument '" + name + "' must be a positive integer");
		}
		return number.intValue();
	}

	private static McpError invalidParams(String message) {
		return McpError.builder(VaultSchema.ErrorCodes.INVALID_PARAMS).message(message).build();
	}

}
