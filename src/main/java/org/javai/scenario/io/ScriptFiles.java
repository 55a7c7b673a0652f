package org.javai.scenario.io;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.javai.scenario.script.ScriptDocument;
import org.javai.scenario.script.ScriptParser;
import org.javai.scenario.script.ScriptWriter;

/**
 * Reads and writes script dump files (UTF-8).
 */
public final class ScriptFiles {

	private ScriptFiles() {
		// Utility class - no instantiation
	}

	/**
	 * Parses a script file.
	 *
	 * @throws UncheckedIOException if the file cannot be read
	 * @throws org.javai.scenario.script.ScriptException if the content is not a valid script
	 */
	public static ScriptDocument read(Path path) {
		String text;
		try {
			text = Files.readString(path, StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to read script from path: " + path, e);
		}
		return ScriptParser.parse(text);
	}

	public static void write(ScriptDocument document, Path path) {
		write(document, path, new ScriptWriter());
	}

	public static void write(ScriptDocument document, Path path, ScriptWriter writer) {
		try {
			Files.writeString(path, writer.render(document), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to write script to path: " + path, e);
		}
	}
}
