/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.vaultmcp.vault;

import java.io.IOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import io.vaultmcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link VaultStore} backed by a folder on the local file system. Tooling folders such
 * as {@code .git} and {@code node_modules} are invisible.
 */
public class FileSystemVaultStore implements VaultStore {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemVaultStore.class);

	static final Set<String> EXCLUDED_DIRECTORIES = Set.of(".git", "node_modules");

	private static final Set<String> TEXT_EXTENSIONS = Set.of("md", "markdown", "txt");

	private final Path root;

	public FileSystemVaultStore(Path root) {
		Assert.notNull(root, "root must not be null");
		Assert.isTrue(Files.isDirectory(root), "Vault root is not a directory: " + root);
		this.root = root.toAbsolutePath().normalize();
		logger.info("Serving vault from {}", this.root);
	}

	public Path getRoot() {
		return this.root;
	}

	@Override
	public List<VaultEntry> list(String directory) {
		Path folder = resolve(directory);
		if (!Files.isDirectory(folder)) {
			throw VaultStoreException.notFound(logical(folder));
		}
		try (Stream<Path> children = Files.list(folder)) {
			List<VaultEntry> entries = new ArrayList<>();
			children.filter(child -> !isExcluded(child)).forEach(child -> entries.add(toEntry(child)));
			entries.sort(Comparator.comparing(VaultEntry::directory).reversed().thenComparing(VaultEntry::name));
			return entries;
		}
		catch (IOException ex) {
			throw new VaultStoreException("Failed to list " + directory, logical(folder), ex);
		}
	}

	@Override
	public VaultDocument read(String path) {
		Path file = resolve(path);
		if (!Files.isRegularFile(file)) {
			throw VaultStoreException.notFound(logical(file));
		}
		try {
			return toDocument(file, Files.readString(file, StandardCharsets.UTF_8));
		}
		catch (IOException ex) {
			throw new VaultStoreException("Failed to read " + path, logical(file), ex);
		}
	}

	@Override
	public VaultDocument create(String path, String content) {
		Path file = resolve(path);
		requireFilePath(path, file);
		if (Files.exists(file)) {
			throw VaultStoreException.alreadyExists(logical(file));
		}
		try {
			Files.createDirectories(file.getParent());
			Files.writeString(file, content == null ? "" : content, StandardCharsets.UTF_8,
					StandardOpenOption.CREATE_NEW);
			logger.debug("Created {}", logical(file));
			return toDocument(file, content == null ? "" : content);
		}
		catch (IOException ex) {
			throw new VaultStoreException("Failed to create " + path, logical(file), ex);
		}
	}

	@Override
	public VaultDocument update(String path, String content) {
		Path file = resolve(path);
		if (!Files.isRegularFile(file)) {
			throw VaultStoreException.notFound(logical(file));
		}
		try {
			Files.writeString(file, content == null ? "" : content, StandardCharsets.UTF_8,
					StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
			logger.debug("Updated {}", logical(file));
			return toDocument(file, content == null ? "" : content);
		}
		catch (IOException ex) {
			throw new VaultStoreException("Failed to update " + path, logical(file), ex);
		}
	}

	@Override
	public void delete(String path) {
		Path file = resolve(path);
		requireFilePath(path, file);
		if (Files.isDirectory(file)) {
			throw VaultStoreException.invalidPath(path, "folders cannot be deleted");
		}
		try {
			if (!Files.deleteIfExists(file)) {
				throw VaultStoreException.notFound(logical(file));
			}
			logger.debug("Deleted {}", logical(file));
		}
		catch (IOException ex) {
			throw new VaultStoreException("Failed to delete " + path, logical(file), ex);
		}
	}

	@Override
	public List<SearchHit> search(String query, int limit) {
		Assert.hasText(query, "query must not be empty");
		Assert.isTrue(limit > 0, "limit must be positive");
		String needle = query.toLowerCase(Locale.ROOT);
		List<SearchHit> hits = new ArrayList<>();
		try {
			Files.walkFileTree(this.root, new SimpleFileVisitor<Path>() {

				@Override
				public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
					return isExcluded(dir) ? FileVisitResult.SKIP_SUBTREE : FileVisitResult.CONTINUE;
				}

				@Override
				public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
					String path = logical(file);
					if (hits.size() < limit && file.getFileName().toString().toLowerCase(Locale.ROOT).contains(needle)) {
						hits.add(new SearchHit(path, 0, file.getFileName().toString()));
					}
					if (hits.size() < limit && isText(file)) {
						scan(file, path, needle, limit, hits);
					}
					return hits.size() >= limit ? FileVisitResult.TERMINATE : FileVisitResult.CONTINUE;
				}

				@Override
				public FileVisitResult visitFileFailed(Path file, IOException ex) {
					logger.debug("Skipping unreadable file {}: {}", file, ex.getMessage());
					return FileVisitResult.CONTINUE;
				}

			});
		}
		catch (IOException ex) {
			throw new VaultStoreException("Search failed", null, ex);
		}
		return hits;
	}

	private void scan(Path file, String path, String needle, int limit, List<SearchHit> hits) throws IOException {
		List<String> lines;
		try {
			lines = Files.readAllLines(file, StandardCharsets.UTF_8);
		}
		catch (MalformedInputException ex) {
			logger.debug("Skipping non UTF-8 file {}", path);
			return;
		}
		for (int i = 0; i < lines.size() && hits.size() < limit; i++) {
			String line = lines.get(i);
			if (line.toLowerCase(Locale.ROOT).contains(needle)) {
				hits.add(new SearchHit(path, i + 1, line.trim()));
			}
		}
	}

	@Override
	public VaultInfo info() {
		AtomicInteger total = new AtomicInteger();
		AtomicInteger markdown = new AtomicInteger();
		try {
			Files.walkFileTree(this.root, new SimpleFileVisitor<Path>() {

				@Override
				public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
					return isExcluded(dir) ? FileVisitResult.SKIP_SUBTREE : FileVisitResult.CONTINUE;
				}

				@Override
				public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
					total.incrementAndGet();
					if (extension(file).equals("md")) {
						markdown.incrementAndGet();
					}
					return FileVisitResult.CONTINUE;
				}

			});
		}
		catch (IOException ex) {
			throw new VaultStoreException("Failed to inspect vault", null, ex);
		}
		Path name = this.root.getFileName();
		return new VaultInfo(name == null ? this.root.toString() : name.toString(), this.root.toString(), total.get(),
				markdown.get(), total.get() - markdown.get());
	}

	/**
	 * Maps a logical path onto the file system, refusing anything outside the root.
	 */
	Path resolve(String logicalPath) {
		String normalized = logicalPath == null ? "" : logicalPath.replace('\\', '/');
		while (normalized.startsWith("/")) {
			normalized = normalized.substring(1);
		}
		if (normalized.indexOf('\0') >= 0) {
			throw VaultStoreException.invalidPath(logicalPath, "contains a null byte");
		}
		Path resolved = this.root.resolve(normalized).normalize();
		if (!resolved.startsWith(this.root)) {
			throw VaultStoreException.invalidPath(logicalPath, "escapes the vault root");
		}
		return resolved;
	}

	private void requireFilePath(String path, Path file) {
		if (file.equals(this.root)) {
			throw VaultStoreException.invalidPath(path, "a file path is required");
		}
	}

	private boolean isExcluded(Path path) {
		if (path.equals(this.root)) {
			return false;
		}
		return EXCLUDED_DIRECTORIES.contains(path.getFileName().toString())
				&& Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS);
	}

	private static boolean isText(Path file) {
		return TEXT_EXTENSIONS.contains(extension(file));
	}

	private static String extension(Path file) {
		String name = file.getFileName().toString();
		int dot = name.lastIndexOf('.');
		return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
	}

	private String logical(Path file) {
		return this.root.relativize(file).toString().replace('\\', '/');
	}

	private VaultEntry toEntry(Path child) {
		try {
			BasicFileAttributes attributes = Files.readAttributes(child, BasicFileAttributes.class);
			return new VaultEntry(logical(child), child.getFileName().toString(), attributes.isDirectory(),
					attributes.isDirectory() ? 0 : attributes.size(), attributes.lastModifiedTime().toInstant());
		}
		catch (IOException ex) {
			throw new VaultStoreException("Failed to stat " + logical(child), logical(child), ex);
		}
	}

	private VaultDocument toDocument(Path file, String content) throws IOException {
		BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
		return new VaultDocument(logical(file), content, attributes.size(),
				attributes.lastModifiedTime().toInstant());
	}

}
