package org.javai.scenario.script;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.javai.scenario.script.ScriptValue.ArrayValue;
import org.javai.scenario.script.ScriptValue.DictionaryValue;
import org.javai.scenario.script.ScriptValue.FloatValue;
import org.javai.scenario.script.ScriptValue.IntegerValue;
import org.javai.scenario.script.ScriptValue.StringValue;
import org.junit.jupiter.api.Test;

class ScriptWriterTest {

	@Test
	void writeTopLevelScalars() {
		ScriptDocument document = new ScriptDocument()
				.put("astver", new FloatValue(2.0))
				.put("line", new IntegerValue(18))
				.put("name", new StringValue("x"));

		assertThat(ScriptWriter.write(document)).isEqualTo("astver = 2.0\nline = 18\nname = \"x\"\n");
	}

	@Test
	void writeArrayIndentsElements() {
		ScriptDocument document = new ScriptDocument()
				.put("a", ArrayValue.of(new IntegerValue(1), ArrayValue.of(new StringValue("b"))));

		assertThat(ScriptWriter.write(document)).isEqualTo("""
				a = {
				\t1,
				\t{
				\t\t"b"
				\t}
				}
				""");
	}

	@Test
	void writeNestedDictionaryAsKeyValueLines() {
		ScriptDocument document = new ScriptDocument()
				.put("a", ArrayValue.of(new StringValue("bg"), DictionaryValue.single("time", new IntegerValue(2000))));

		assertThat(ScriptWriter.write(document)).isEqualTo("a = {\n\t\"bg\",\n\t\n\t\ttime=2000\n\t\n}\n");
	}

	@Test
	void customIndentUnit() {
		ScriptDocument document = new ScriptDocument().put("a", ArrayValue.of(new IntegerValue(1)));

		assertThat(new ScriptWriter("  ").render(document)).isEqualTo("a = {\n  1\n}\n");
	}

	@Test
	void nonWhitespaceIndentIsRejected() {
		assertThatThrownBy(() -> new ScriptWriter("x"))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void stringsAreEscaped() {
		assertThat(new ScriptWriter().render(new StringValue("say \"hi\"\\\n\tend")))
				.isEqualTo("\"say \\\"hi\\\"\\\\\\n\\tend\"");
	}

	@Test
	void floatFormatting() {
		assertThat(ScriptWriter.formatFloat(2.0)).isEqualTo("2.0");
		assertThat(ScriptWriter.formatFloat(2.2)).isEqualTo("2.2");
		assertThat(ScriptWriter.formatFloat(-2.25)).isEqualTo("-2.25");
		assertThat(ScriptWriter.formatFloat(0.0)).isEqualTo("0.0");
		assertThat(ScriptWriter.formatFloat(-0.0)).isEqualTo("-0.0");
		assertThat(ScriptWriter.formatFloat(1.0e20)).isEqualTo("100000000000000000000.0");
		assertThat(ScriptWriter.formatFloat(0.00001)).isEqualTo("0.00001");
	}

	@Test
	void nonFiniteFloatIsRejected() {
		assertThatThrownBy(() -> ScriptWriter.formatFloat(Double.NaN))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void roundTripPreservesEscapedStrings() {
		ScriptDocument document = ScriptParser.parse("a = {\"q\\\"uote\", \"back\\\\slash\", \"tab\\there\", \"two\\nlines\"}");

		ScriptDocument reparsed = ScriptParser.parse(ScriptWriter.write(document));

		assertThat(reparsed).isEqualTo(document);
	}

	@Test
	void roundTripPreservesNumbers() {
		ScriptDocument document = ScriptParser.parse("a = {-1, 0, 9223372036854775807, -0.0, 0.1, 2.2, 1234.5678, 3.0}");

		ScriptDocument reparsed = ScriptParser.parse(ScriptWriter.write(document));

		assertThat(reparsed).isEqualTo(document);
	}

	@Test
	void roundTripSampleScript() throws IOException {
		ScriptDocument document = ScriptParser.parse(readSample());

		String written = ScriptWriter.write(document);
		ScriptDocument reparsed = ScriptParser.parse(written);

		assertThat(reparsed).isEqualTo(document);
		assertThat(reparsed.entries().keySet()).containsExactly("astver", "ast");
		assertThat(ScriptWriter.write(reparsed)).isEqualTo(written);
	}

	@Test
	void emptyArrayRoundTrips() {
		ScriptDocument document = ScriptParser.parse("a = {}");

		assertThat(ScriptParser.parse(ScriptWriter.write(document))).isEqualTo(document);
	}

	static String readSample() throws IOException {
		try (InputStream in = ScriptWriterTest.class.getResourceAsStream("/scripts/sample.ast")) {
			assertThat(in).as("sample.ast on test classpath").isNotNull();
			return new String(in.readAllBytes(), StandardCharsets.UTF_8);
		}
	}
}
