package org.javai.scenario.cli;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import org.javai.scenario.io.ScenarioTextFile;
import org.javai.scenario.io.ScenarioTextFileException;
import org.javai.scenario.io.ScriptDirectory;
import org.javai.scenario.io.ScriptFiles;
import org.javai.scenario.script.ScriptDocument;
import org.javai.scenario.script.ScriptException;
import org.javai.scenario.text.ScenarioText;
import org.javai.scenario.text.ScenarioTextWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Command line front end: extract scenario text for translation, merge it back,
 * or prune a script to its control-flow skeleton.
 * <p>
 * Every command also takes folders: when the script input is a directory, each
 * {@code *.ast} file below it is processed and its result written to the same
 * relative path under the output folder. A failing script is reported and the
 * batch carries on; the exit code is {@value #EXIT_FAILURE} if any script failed.
 */
@Command(
		name = "scenario-ast",
		mixinStandardHelpOptions = true,
		version = "scenario-ast 0.1.0",
		description = "Extract, prune and merge scenario text in script AST dumps.",
		subcommands = {
				ScenarioCli.ExtractCommand.class,
				ScenarioCli.PruneCommand.class,
				ScenarioCli.MergeCommand.class
		})
public class ScenarioCli implements Runnable {

	private static final Logger logger = LoggerFactory.getLogger(ScenarioCli.class);

	static final int EXIT_FAILURE = 1;

	@Spec
	CommandSpec spec;

	public static void main(String[] args) {
		int exitCode = newCommandLine().execute(args);
		System.exit(exitCode);
	}

	@Override
	public void run() {
		throw new ParameterException(spec.commandLine(), "Missing required subcommand");
	}

	/**
	 * Builds the command line with failure reporting: script, tree and file errors
	 * print a one-line message to stderr and exit with {@value #EXIT_FAILURE}.
	 */
	public static CommandLine newCommandLine() {
		CommandLine commandLine = new CommandLine(new ScenarioCli());
		commandLine.setExecutionExceptionHandler((e, cmd, parseResult) -> {
			if (e instanceof ScriptException || e instanceof ScenarioTextFileException
					|| e instanceof UncheckedIOException) {
				logger.debug("{} failed", cmd.getCommandName(), e);
				cmd.getErr().println("error: " + e.getMessage());
				return EXIT_FAILURE;
			}
			throw e;
		});
		return commandLine;
	}

	static class LanguageOption {

		@Option(names = "--lang", description = "Language key holding the scenario text (default: ${DEFAULT-VALUE})",
				defaultValue = ScenarioTextWalker.DEFAULT_LANGUAGE)
		String language;

		ScenarioText scenarioText() {
			return new ScenarioText(language);
		}
	}

	static class TextExtensionOption {

		@Option(names = "--text-ext",
				description = "Extension of string list files in folder mode (default: ${DEFAULT-VALUE})",
				defaultValue = "yaml")
		String extension;
	}

	@FunctionalInterface
	interface ScriptTask {
		void run(Path script);
	}

	static int forEachScript(CommandSpec spec, ScriptDirectory directory, ScriptTask task) {
		List<Path> scripts = directory.scripts();
		int failed = 0;
		for (Path script : scripts) {
			try {
				task.run(script);
			} catch (ScriptException | ScenarioTextFileException | UncheckedIOException e) {
				failed++;
				logger.debug("{} failed", script, e);
				spec.commandLine().getErr().println("error: " + script + ": " + e.getMessage());
			}
		}
		logger.info("Processed {} scripts under {}, {} failed", scripts.size(), directory.root(), failed);
		return failed == 0 ? 0 : EXIT_FAILURE;
	}

	static void requireDistinct(CommandSpec spec, Path input, Path output) {
		if (input.toAbsolutePath().normalize().equals(output.toAbsolutePath().normalize())) {
			throw new ParameterException(spec.commandLine(),
					"Output folder must differ from input folder: " + output);
		}
	}

	@Command(name = "extract", mixinStandardHelpOptions = true,
			description = "Extract all scenario text to a YAML list.")
	static class ExtractCommand implements Callable<Integer> {

		@Spec
		CommandSpec spec;

		@Mixin
		LanguageOption languageOption;

		@Mixin
		TextExtensionOption textExtension;

		@Parameters(index = "0", description = "Script AST file, or folder of them, to read")
		Path input;

		@Parameters(index = "1", description = "YAML file, or folder, to write")
		Path output;

		@Override
		public Integer call() {
			ScenarioText scenarioText = languageOption.scenarioText();
			if (Files.isDirectory(input)) {
				ScriptDirectory directory = new ScriptDirectory(input);
				return forEachScript(spec, directory, script -> extract(scenarioText, script,
						ScriptDirectory.prepare(directory.companion(script, output, textExtension.extension))));
			}
			extract(scenarioText, input, output);
			return 0;
		}

		private void extract(ScenarioText scenarioText, Path script, Path target) {
			List<String> texts = scenarioText.extract(ScriptFiles.read(script));
			new ScenarioTextFile().write(texts, target);
			logger.info("Extracted {} strings from {} to {}", texts.size(), script, target);
		}
	}

	@Command(name = "prune", mixinStandardHelpOptions = true,
			description = "Prune the script, removing all scenario text and item content.")
	static class PruneCommand implements Callable<Integer> {

		@Spec
		CommandSpec spec;

		@Mixin
		LanguageOption languageOption;

		@Parameters(index = "0", description = "Script AST file, or folder of them, to read")
		Path input;

		@Parameters(index = "1", description = "Pruned script file, or folder, to write")
		Path output;

		@Override
		public Integer call() {
			ScenarioText scenarioText = languageOption.scenarioText();
			if (Files.isDirectory(input)) {
				requireDistinct(spec, input, output);
				ScriptDirectory directory = new ScriptDirectory(input);
				return forEachScript(spec, directory, script -> prune(scenarioText, script,
						ScriptDirectory.prepare(directory.companion(script, output, ScriptDirectory.SCRIPT_EXTENSION))));
			}
			prune(scenarioText, input, output);
			return 0;
		}

		private void prune(ScenarioText scenarioText, Path script, Path target) {
			ScriptDocument document = ScriptFiles.read(script);
			scenarioText.prune(document);
			ScriptFiles.write(document, target);
			logger.info("Pruned {} to {}", script, target);
		}
	}

	@Command(name = "merge", mixinStandardHelpOptions = true,
			description = "Merge a YAML list of scenario text back into the script.")
	static class MergeCommand implements Callable<Integer> {

		@Spec
		CommandSpec spec;

		@Mixin
		LanguageOption languageOption;

		@Mixin
		TextExtensionOption textExtension;

		@Parameters(index = "0", description = "Script AST file, or folder of them, to read")
		Path astInput;

		@Parameters(index = "1",
				description = "YAML file with one string per scenario line, or folder mirroring the script folder")
		Path yamlInput;

		@Parameters(index = "2", description = "Merged script file, or folder, to write")
		Path output;

		@Override
		public Integer call() {
			ScenarioText scenarioText = languageOption.scenarioText();
			if (Files.isDirectory(astInput)) {
				requireDistinct(spec, astInput, output);
				ScriptDirectory directory = new ScriptDirectory(astInput);
				return forEachScript(spec, directory, script -> merge(scenarioText, script,
						directory.companion(script, yamlInput, textExtension.extension),
						ScriptDirectory.prepare(directory.companion(script, output, ScriptDirectory.SCRIPT_EXTENSION))));
			}
			merge(scenarioText, astInput, yamlInput, output);
			return 0;
		}

		private void merge(ScenarioText scenarioText, Path script, Path texts, Path target) {
			ScriptDocument document = ScriptFiles.read(script);
			List<String> translated = new ScenarioTextFile().read(texts);
			scenarioText.merge(document, translated);
			ScriptFiles.write(document, target);
			logger.info("Merged {} strings from {} into {}", translated.size(), texts, target);
		}
	}
}
