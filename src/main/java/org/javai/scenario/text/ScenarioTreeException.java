package org.javai.scenario.text;

import org.javai.scenario.script.ScriptException;

/**
 * Exception thrown when a document does not have the block layout the scenario
 * text algorithms walk, or when a translated string list does not fit it.
 */
public class ScenarioTreeException extends ScriptException {

	public enum Kind {
		MISSING_FIELD,
		TYPE_MISMATCH,
		EXHAUSTED_INPUT,
		UNUSED_INPUT
	}

	private final Kind kind;

	public ScenarioTreeException(Kind kind, String message) {
		super(message);
		this.kind = kind;
	}

	static ScenarioTreeException missingField(String path) {
		return new ScenarioTreeException(Kind.MISSING_FIELD, "Missing field '" + path + "'");
	}

	static ScenarioTreeException typeMismatch(String path, String expected, String actual) {
		return new ScenarioTreeException(Kind.TYPE_MISMATCH,
				"Expected " + expected + " at '" + path + "' but found " + actual);
	}

	public Kind kind() {
		return kind;
	}
}
