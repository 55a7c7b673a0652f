package org.javai.scenario.script;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import org.javai.scenario.script.ScriptValue.ArrayValue;
import org.javai.scenario.script.ScriptValue.DictionaryValue;
import org.javai.scenario.script.ScriptValue.FloatValue;
import org.javai.scenario.script.ScriptValue.IntegerValue;
import org.javai.scenario.script.ScriptValue.StringValue;

/**
 * Renders a {@link ScriptDocument} back to the script dump format.
 * <p>
 * Output re-parses to a structurally equal document. Arrays put each element on
 * its own line, one indent deeper than the container; nested dictionaries are
 * written as {@code key=value} lines; top-level pairs are written as
 * {@code key = value}, one per line, in document order.
 * <p>
 * Empty dictionaries have no textual form and disappear on re-parse.
 */
public class ScriptWriter {

	private final String indentUnit;

	public ScriptWriter() {
		this("\t");
	}

	public ScriptWriter(String indentUnit) {
		if (indentUnit == null || !indentUnit.isBlank()) {
			throw new IllegalArgumentException("Indent must consist of whitespace only");
		}
		this.indentUnit = indentUnit;
	}

	/**
	 * Static convenience method to write a document with tab indentation.
	 */
	public static String write(ScriptDocument document) {
		return new ScriptWriter().render(document);
	}

	public String render(ScriptDocument document) {
		StringBuilder output = new StringBuilder();
		for (Map.Entry<String, ScriptValue> entry : document.entries().entrySet()) {
			output.append(entry.getKey()).append(" = ");
			appendValue(output, entry.getValue(), 0);
			output.append('\n');
		}
		return output.toString();
	}

	public String render(ScriptValue value) {
		StringBuilder output = new StringBuilder();
		appendValue(output, value, 0);
		return output.toString();
	}

	private void appendValue(StringBuilder output, ScriptValue value, int level) {
		if (value instanceof StringValue s) {
			output.append('"').append(escapeString(s.value())).append('"');
		} else if (value instanceof IntegerValue i) {
			output.append(i.value());
		} else if (value instanceof FloatValue f) {
			output.append(formatFloat(f.value()));
		} else if (value instanceof ArrayValue a) {
			appendArray(output, a, level);
		} else if (value instanceof DictionaryValue d) {
			appendDictionary(output, d, level);
		}
	}

	private void appendArray(StringBuilder output, ArrayValue array, int level) {
		output.append("{\n");
		indent(output, level + 1);
		boolean first = true;
		for (ScriptValue element : array.elements()) {
			if (!first) {
				output.append(",\n");
				indent(output, level + 1);
			}
			appendValue(output, element, level + 1);
			first = false;
		}
		output.append('\n');
		indent(output, level);
		output.append('}');
	}

	private void appendDictionary(StringBuilder output, DictionaryValue dictionary, int level) {
		output.append('\n');
		indent(output, level + 1);
		boolean first = true;
		for (Map.Entry<String, ScriptValue> entry : dictionary.entries().entrySet()) {
			if (!first) {
				output.append(",\n");
				indent(output, level + 1);
			}
			output.append(entry.getKey()).append('=');
			appendValue(output, entry.getValue(), level + 1);
			first = false;
		}
		output.append('\n');
		indent(output, level);
	}

	/**
	 * Inverse of the tokenizer's escape table.
	 */
	static String escapeString(String value) {
		StringBuilder sb = new StringBuilder(value.length());
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			switch (c) {
				case '\\' -> sb.append("\\\\");
				case '"' -> sb.append("\\\"");
				case '\n' -> sb.append("\\n");
				case '\t' -> sb.append("\\t");
				default -> sb.append(c);
			}
		}
		return sb.toString();
	}

	/**
	 * Whole numbers keep one decimal place ({@code 2.0}); anything else is
	 * written in plain (non-exponent) decimal notation.
	 */
	static String formatFloat(double value) {
		if (Double.isNaN(value) || Double.isInfinite(value)) {
			throw new IllegalArgumentException("Float value has no script representation: " + value);
		}
		if (value == 0.0) {
			return Double.compare(value, -0.0) == 0 ? "-0.0" : "0.0";
		}
		BigDecimal decimal = BigDecimal.valueOf(value);
		if (value == Math.rint(value)) {
			return decimal.setScale(1, RoundingMode.UNNECESSARY).toPlainString();
		}
		return decimal.stripTrailingZeros().toPlainString();
	}

	private void indent(StringBuilder output, int level) {
		output.append(indentUnit.repeat(level));
	}
}
