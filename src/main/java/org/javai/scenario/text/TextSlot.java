package org.javai.scenario.text;

import java.util.List;
import org.javai.scenario.script.ScriptValue;
import org.javai.scenario.script.ScriptValue.StringValue;

/**
 * Position of one dialogue string: an element of a line array under the
 * language key.
 *
 * @param line the line array holding the string
 * @param index the element index within {@code line}
 */
public record TextSlot(List<ScriptValue> line, int index) {

	public String text() {
		return line.get(index).asString()
				.orElseThrow(() -> new IllegalStateException("No string at index " + index));
	}

	public void replace(String text) {
		line.set(index, new StringValue(text));
	}
}
