package org.javai.scenario.io;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * A folder of script dumps processed as one batch. Scripts are found
 * recursively; companion files (string lists, merged or pruned scripts) live
 * at the same relative path under a target folder, with their own extension.
 */
public final class ScriptDirectory {

	public static final String SCRIPT_EXTENSION = "ast";

	private final Path root;

	public ScriptDirectory(Path root) {
		if (root == null) {
			throw new IllegalArgumentException("Root cannot be null");
		}
		this.root = root;
	}

	public Path root() {
		return root;
	}

	/**
	 * Every {@code *.ast} file under the root, in path order.
	 *
	 * @throws UncheckedIOException if the folder cannot be walked
	 */
	public List<Path> scripts() {
		try (Stream<Path> paths = Files.walk(root)) {
			return paths.filter(Files::isRegularFile)
					.filter(path -> hasExtension(path, SCRIPT_EXTENSION))
					.sorted()
					.toList();
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to list scripts under path: " + root, e);
		}
	}

	/**
	 * Path of the companion of {@code script} under {@code targetRoot}, with the
	 * script extension replaced by {@code extension} (a leading dot is optional).
	 */
	public Path companion(Path script, Path targetRoot, String extension) {
		Path relative = root.relativize(script);
		String name = relative.getFileName().toString();
		String stem = name.substring(0, name.length() - SCRIPT_EXTENSION.length() - 1);
		String suffix = extension.startsWith(".") ? extension.substring(1) : extension;
		return targetRoot.resolve(relative).resolveSibling(stem + "." + suffix);
	}

	/**
	 * Creates the parent folders of {@code path}.
	 *
	 * @return {@code path}
	 */
	public static Path prepare(Path path) {
		Path parent = path.toAbsolutePath().getParent();
		try {
			Files.createDirectories(parent);
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to create folder: " + parent, e);
		}
		return path;
	}

	private static boolean hasExtension(Path path, String extension) {
		return path.getFileName().toString().endsWith("." + extension);
	}
}
