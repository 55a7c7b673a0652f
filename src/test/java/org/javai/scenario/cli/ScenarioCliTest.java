package org.javai.scenario.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.javai.scenario.io.ScenarioTextFile;
import org.javai.scenario.io.ScriptFiles;
import org.javai.scenario.script.ScriptDocument;
import org.javai.scenario.text.ScenarioText;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class ScenarioCliTest {

	private static final String SCRIPT = """
			astver = 2.0
			ast = {
				block_00000 = {
					{"bg", file="bg001a"},
					text = {ja = {{name = {"妃愛"}, "「お兄、あさー」", {"rt2"}}}},
					linknext = "block_00001",
					line = 18,
				},
				block_00001 = {
					text = {ja = {{"まだ眠い。"}}},
					line = 24,
				},
			}
			""";

	@TempDir
	Path tempDir;

	private Path script;
	private StringWriter err;
	private CommandLine commandLine;

	@BeforeEach
	void setUp() throws IOException {
		script = tempDir.resolve("script.ast");
		Files.writeString(script, SCRIPT, StandardCharsets.UTF_8);
		err = new StringWriter();
		commandLine = ScenarioCli.newCommandLine();
		commandLine.setErr(new PrintWriter(err, true));
	}

	@Test
	void extractWritesYamlList() {
		Path yaml = tempDir.resolve("texts.yaml");

		int exitCode = commandLine.execute("extract", script.toString(), yaml.toString());

		assertThat(exitCode).isZero();
		assertThat(new ScenarioTextFile().read(yaml)).containsExactly("「お兄、あさー」", "まだ眠い。");
	}

	@Test
	void mergeReplacesTextInOrder() {
		Path yaml = tempDir.resolve("texts.yaml");
		Path output = tempDir.resolve("merged.ast");
		new ScenarioTextFile().write(List.of("\"Morning!\"", "Still sleepy."), yaml);

		int exitCode = commandLine.execute("merge", script.toString(), yaml.toString(), output.toString());

		assertThat(exitCode).isZero();
		ScriptDocument merged = ScriptFiles.read(output);
		assertThat(new ScenarioText().extract(merged)).containsExactly("\"Morning!\"", "Still sleepy.");
	}

	@Test
	void pruneWritesSkeleton() throws IOException {
		Path output = tempDir.resolve("pruned.ast");

		int exitCode = commandLine.execute("prune", script.toString(), output.toString());

		assertThat(exitCode).isZero();
		String pruned = Files.readString(output, StandardCharsets.UTF_8);
		assertThat(pruned).contains("linknext=\"block_00001\"", "line=18", "line=24", "astver = 2.0");
		assertThat(pruned).doesNotContain("bg001a", "まだ眠い。", "ja=");
	}

	@Test
	void extractHonoursLanguageOption() throws IOException {
		Files.writeString(script, "ast = {block_1 = {text = {en = {{\"hello\"}}}}}", StandardCharsets.UTF_8);
		Path yaml = tempDir.resolve("texts.yaml");

		int exitCode = commandLine.execute("extract", "--lang", "en", script.toString(), yaml.toString());

		assertThat(exitCode).isZero();
		assertThat(new ScenarioTextFile().read(yaml)).containsExactly("hello");
	}

	@Test
	void mergeCountMismatchFailsWithoutWritingOutput() {
		Path yaml = tempDir.resolve("texts.yaml");
		Path output = tempDir.resolve("merged.ast");
		new ScenarioTextFile().write(List.of("only one"), yaml);

		int exitCode = commandLine.execute("merge", script.toString(), yaml.toString(), output.toString());

		assertThat(exitCode).isEqualTo(ScenarioCli.EXIT_FAILURE);
		assertThat(err.toString()).startsWith("error: Ran out of texts");
		assertThat(output).doesNotExist();
	}

	@Test
	void malformedScriptReportsLexError() throws IOException {
		Files.writeString(script, "ast = {\"open", StandardCharsets.UTF_8);

		int exitCode = commandLine.execute("extract", script.toString(), tempDir.resolve("out.yaml").toString());

		assertThat(exitCode).isEqualTo(ScenarioCli.EXIT_FAILURE);
		assertThat(err.toString()).contains("Unterminated string");
	}

	@Test
	void missingInputFileReportsError() {
		int exitCode = commandLine.execute("prune", tempDir.resolve("nope.ast").toString(),
				tempDir.resolve("out.ast").toString());

		assertThat(exitCode).isEqualTo(ScenarioCli.EXIT_FAILURE);
		assertThat(err.toString()).contains("nope.ast");
	}

	@Test
	void missingSubcommandIsUsageError() {
		int exitCode = commandLine.execute();

		assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
		assertThat(err.toString()).contains("Missing required subcommand");
	}

	@Test
	void missingParameterIsUsageError() {
		int exitCode = commandLine.execute("merge", script.toString());

		assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
	}

	@Test
	void extractFolderWritesTextsBesideEachScript() throws IOException {
		Path folder = scriptFolder();

		int exitCode = commandLine.execute("extract", folder.toString(), folder.toString());

		assertThat(exitCode).isZero();
		assertThat(new ScenarioTextFile().read(folder.resolve("a.yaml"))).containsExactly("「お兄、あさー」", "まだ眠い。");
		assertThat(new ScenarioTextFile().read(folder.resolve("sub/b.yaml"))).containsExactly("hello");
	}

	@Test
	void mergeFolderUsesTextExtension() throws IOException {
		Path folder = scriptFolder();
		Path output = tempDir.resolve("out");
		new ScenarioTextFile().write(List.of("Morning!", "Still sleepy."), folder.resolve("a.cn"));
		new ScenarioTextFile().write(List.of("你好"), folder.resolve("sub/b.cn"));

		int exitCode = commandLine.execute("merge", "--text-ext", "cn", folder.toString(), folder.toString(),
				output.toString());

		assertThat(exitCode).isZero();
		ScenarioText scenarioText = new ScenarioText();
		assertThat(scenarioText.extract(ScriptFiles.read(output.resolve("a.ast"))))
				.containsExactly("Morning!", "Still sleepy.");
		assertThat(scenarioText.extract(ScriptFiles.read(output.resolve("sub/b.ast")))).containsExactly("你好");
	}

	@Test
	void pruneFolderMirrorsLayout() throws IOException {
		Path folder = scriptFolder();
		Path output = tempDir.resolve("pruned");

		int exitCode = commandLine.execute("prune", folder.toString(), output.toString());

		assertThat(exitCode).isZero();
		assertThat(Files.readString(output.resolve("a.ast"), StandardCharsets.UTF_8)).contains("line=18");
		assertThat(output.resolve("sub/b.ast")).exists();
	}

	@Test
	void folderBatchReportsFailuresAndKeepsGoing() throws IOException {
		Path folder = scriptFolder();
		Files.writeString(folder.resolve("bad.ast"), "ast = {", StandardCharsets.UTF_8);

		int exitCode = commandLine.execute("extract", folder.toString(), folder.toString());

		assertThat(exitCode).isEqualTo(ScenarioCli.EXIT_FAILURE);
		assertThat(err.toString()).contains("bad.ast").contains("end of input");
		assertThat(folder.resolve("a.yaml")).exists();
		assertThat(folder.resolve("sub/b.yaml")).exists();
		assertThat(folder.resolve("bad.yaml")).doesNotExist();
	}

	@Test
	void mergeFolderWithMissingTextsFails() throws IOException {
		Path folder = scriptFolder();

		int exitCode = commandLine.execute("merge", folder.toString(), folder.toString(),
				tempDir.resolve("out").toString());

		assertThat(exitCode).isEqualTo(ScenarioCli.EXIT_FAILURE);
		assertThat(err.toString()).contains("a.yaml");
	}

	@Test
	void pruneFolderOntoItselfIsUsageError() throws IOException {
		Path folder = scriptFolder();

		int exitCode = commandLine.execute("prune", folder.toString(), folder.toString());

		assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
		assertThat(err.toString()).contains("must differ");
	}

	private Path scriptFolder() throws IOException {
		Path folder = tempDir.resolve("scripts");
		Files.createDirectories(folder.resolve("sub"));
		Files.writeString(folder.resolve("a.ast"), SCRIPT, StandardCharsets.UTF_8);
		Files.writeString(folder.resolve("sub/b.ast"), "ast = {block_1 = {text = {ja = {{\"hello\"}}}}}",
				StandardCharsets.UTF_8);
		Files.writeString(folder.resolve("notes.txt"), "not a script", StandardCharsets.UTF_8);
		return folder;
	}
}
