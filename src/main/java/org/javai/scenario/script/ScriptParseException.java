package org.javai.scenario.script;

import java.util.Optional;

/**
 * Exception thrown when a token sequence does not follow the script grammar.
 */
public class ScriptParseException extends ScriptException {

	public enum Kind {
		EXPECTED_IDENTIFIER,
		UNEXPECTED_TOKEN,
		UNEXPECTED_END_OF_INPUT,
		NESTING_TOO_DEEP
	}

	private final Kind kind;
	private final ScriptToken token;

	public ScriptParseException(Kind kind, ScriptToken token, String message) {
		super(token != null ? message + " at position " + token.position() : message);
		this.kind = kind;
		this.token = token;
	}

	public static ScriptParseException endOfInput(String expectation) {
		return new ScriptParseException(Kind.UNEXPECTED_END_OF_INPUT, null,
				"Unexpected end of input: " + expectation);
	}

	public Kind kind() {
		return kind;
	}

	/**
	 * The offending token; empty when the input ended early.
	 */
	public Optional<ScriptToken> token() {
		return Optional.ofNullable(token);
	}
}
