/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.vault.tools;

import java.util.List;
import java.util.Locale;

import io.vaultmcp.vault.SearchHit;
import io.vaultmcp.vault.VaultDocument;
import io.vaultmcp.vault.VaultEntry;
import io.vaultmcp.vault.VaultInfo;

/**
 * Renders store results as Markdown text for tool responses.
 */
final class VaultFormatters {

	static final int MAX_LISTED_ENTRIES = 50;

	private VaultFormatters() {
	}

	static String fileList(String directory, List<VaultEntry> entries) {
		StringBuilder text = new StringBuilder();
		text.append("# Directory: ").append(directory == null || directory.isEmpty() ? "/" : directory).append("\n\n");
		long folders = entries.stream().filter(VaultEntry::directory).count();
		text.append(folders).append(" folders, ").append(entries.size() - folders).append(" files\n\n");
		entries.stream().limit(MAX_LISTED_ENTRIES).forEach(entry -> {
			text.append("- ").append(entry.name());
			if (entry.directory()) {
				text.append('/');
			}
			else {
				text.append(" (").append(fileSize(entry.size())).append(')');
			}
			text.append('\n');
		});
		if (entries.size() > MAX_LISTED_ENTRIES) {
			text.append("- ... and ").append(entries.size() - MAX_LISTED_ENTRIES).append(" more\n");
		}
		return text.toString();
	}

	static String fileRead(VaultDocument document) {
		return "# " + document.path() + "\n\n" + document.content();
	}

	static String fileWrite(VaultDocument document, String verb) {
		return "# " + verb + ": " + document.path() + "\n\nSize: " + fileSize(document.size()) + "\n";
	}

	static String fileDelete(String path) {
		return "# Deleted: " + path + "\n\nFile successfully deleted.\n";
	}

	static String searchResults(String query, List<SearchHit> hits) {
		StringBuilder text = new StringBuilder();
		text.append("# Search: ").append(query).append("\n\n");
		if (hits.isEmpty()) {
			return text.append("No matches found.\n").toString();
		}
		text.append("Found ").append(hits.size()).append(hits.size() == 1 ? " match" : " matches").append("\n\n");
		for (SearchHit hit : hits) {
			text.append("- ").append(hit.path());
			if (hit.line() > 0) {
				text.append(':').append(hit.line()).append(" `").append(hit.snippet()).append('`');
			}
			text.append('\n');
		}
		return text.toString();
	}

	static String systemInfo(String serverName, String serverVersion, VaultInfo info) {
		return "# " + serverName + " " + serverVersion + "\n\n" + "Vault: " + info.name() + "\nPath: " + info.path()
				+ "\nFiles: " + info.totalFiles() + " (" + info.markdownFiles() + " markdown, " + info.attachments()
				+ " attachments)\n";
	}

	static String fileSize(long bytes) {
		if (bytes < 1024) {
			return bytes + " B";
		}
		if (bytes < 1024 * 1024) {
			return String.format(Locale.ROOT, "%.1f KB", bytes / 1024.0);
		}
		return String.format(Locale.ROOT, "%.1f MB", bytes / (1024.0 * 1024.0));
	}

}
