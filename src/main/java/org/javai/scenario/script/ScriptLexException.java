package org.javai.scenario.script;

/**
 * Exception thrown when script text cannot be split into tokens.
 */
public class ScriptLexException extends ScriptException {

	public enum Kind {
		UNKNOWN_ESCAPE,
		INCOMPLETE_ESCAPE,
		UNTERMINATED_STRING,
		UNEXPECTED_CHARACTER,
		NUMBER_FORMAT
	}

	private final Kind kind;
	private final int position;

	public ScriptLexException(Kind kind, int position, String message) {
		super(message + " at position " + position);
		this.kind = kind;
		this.position = position;
	}

	public ScriptLexException(Kind kind, int position, String message, Throwable cause) {
		super(message + " at position " + position, cause);
		this.kind = kind;
		this.position = position;
	}

	public Kind kind() {
		return kind;
	}

	/**
	 * Character offset in the input where the failure was detected.
	 */
	public int position() {
		return position;
	}
}
