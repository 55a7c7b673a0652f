package org.javai.scenario.script;

/**
 * Represents a token in the script format.
 *
 * @param type the token type
 * @param text the token text (decoded content for strings, source text otherwise)
 * @param number the parsed value for numeric literals, {@code null} otherwise
 * @param position the character position in the input string
 */
public record ScriptToken(TokenType type, String text, Number number, int position) {

	public enum TokenType {
		EQUAL,         // =
		OPEN_BRACE,    // {
		CLOSE_BRACE,   // }
		COMMA,         // ,
		IDENTIFIER,    // astver, block_00000, text
		STRING,        // "quoted strings"
		INTEGER,       // 18, -1
		FLOAT          // 2.0, -2.25
	}

	public static ScriptToken symbol(TokenType type, String text, int position) {
		return new ScriptToken(type, text, null, position);
	}

	public static ScriptToken identifier(String name, int position) {
		return new ScriptToken(TokenType.IDENTIFIER, name, null, position);
	}

	public static ScriptToken string(String value, int position) {
		return new ScriptToken(TokenType.STRING, value, null, position);
	}

	public static ScriptToken integer(String text, long value, int position) {
		return new ScriptToken(TokenType.INTEGER, text, value, position);
	}

	public static ScriptToken decimal(String text, double value, int position) {
		return new ScriptToken(TokenType.FLOAT, text, value, position);
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}

	public long longValue() {
		if (type != TokenType.INTEGER) {
			throw new IllegalStateException("Not an integer token: " + this);
		}
		return number.longValue();
	}

	public double doubleValue() {
		if (type != TokenType.FLOAT) {
			throw new IllegalStateException("Not a float token: " + this);
		}
		return number.doubleValue();
	}

	@Override
	public String toString() {
		return switch (type) {
			case STRING -> "STRING(\"" + text + "\")";
			case IDENTIFIER, INTEGER, FLOAT -> type + "(" + text + ")";
			default -> type.toString();
		};
	}
}
