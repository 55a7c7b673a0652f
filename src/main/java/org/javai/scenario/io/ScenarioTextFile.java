package org.javai.scenario.io;

import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.representer.Representer;

/**
 * Reads and writes the ordered list of scenario strings handed to translators,
 * as a YAML sequence of strings:
 *
 * <pre>
 * - 「お兄、あさー……むふー……」
 * - second line
 * </pre>
 */
public class ScenarioTextFile {

	/**
	 * Largest list file accepted, in code points. A whole game's script fits
	 * comfortably; SnakeYAML's own default stops at 3 MB.
	 */
	public static final int MAX_CODE_POINTS = 256 * 1024 * 1024;

	private final Yaml yaml;

	public ScenarioTextFile() {
		this(MAX_CODE_POINTS);
	}

	public ScenarioTextFile(int maxCodePoints) {
		DumperOptions dumperOptions = new DumperOptions();
		dumperOptions.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
		dumperOptions.setAllowUnicode(true);
		dumperOptions.setSplitLines(false);
		LoaderOptions loaderOptions = new LoaderOptions();
		loaderOptions.setCodePointLimit(maxCodePoints);
		this.yaml = new Yaml(new SafeConstructor(loaderOptions), new Representer(dumperOptions),
				dumperOptions, loaderOptions);
	}

	/**
	 * Read a string list from a path.
	 */
	public List<String> read(Path path) {
		try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			return toStrings(yaml.load(reader));
		} catch (ScenarioTextFileException e) {
			throw new ScenarioTextFileException(e.getMessage() + " in " + path, e);
		} catch (Exception e) {
			throw new ScenarioTextFileException("Failed to read scenario texts from path: " + path, e);
		}
	}

	/**
	 * Read a string list from YAML content.
	 */
	public List<String> parseString(String content) {
		try {
			return toStrings(yaml.load(content));
		} catch (YAMLException e) {
			throw new ScenarioTextFileException("Failed to parse scenario texts", e);
		}
	}

	public void write(List<String> texts, Path path) {
		try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
			yaml.dump(texts, writer);
		} catch (Exception e) {
			throw new ScenarioTextFileException("Failed to write scenario texts to path: " + path, e);
		}
	}

	public String toYaml(List<String> texts) {
		return yaml.dump(texts);
	}

	private static List<String> toStrings(Object data) {
		if (data == null) {
			return List.of();
		}
		if (!(data instanceof List<?> items)) {
			throw new ScenarioTextFileException("Expected a YAML sequence of strings but found "
					+ data.getClass().getSimpleName());
		}
		List<String> texts = new ArrayList<>(items.size());
		for (int i = 0; i < items.size(); i++) {
			if (!(items.get(i) instanceof String text)) {
				Object item = items.get(i);
				throw new ScenarioTextFileException("Entry " + i + " is not a string: "
						+ (item == null ? "null" : item.getClass().getSimpleName() + " " + item));
			}
			texts.add(text);
		}
		return texts;
	}
}
