package org.javai.scenario.script;

import java.util.ArrayList;
import java.util.List;
import org.javai.scenario.script.ScriptLexException.Kind;
import org.javai.scenario.script.ScriptToken.TokenType;

/**
 * Tokenizer for the script dump format.
 * Converts input string into a flat list of tokens; whitespace is discarded.
 */
public class ScriptTokenizer {

	private static final char BYTE_ORDER_MARK = '\uFEFF';

	private final String input;
	private int pos = 0;

	public ScriptTokenizer(String input) {
		this.input = input != null ? input : "";
		if (!this.input.isEmpty() && this.input.charAt(0) == BYTE_ORDER_MARK) {
			pos = 1;
		}
	}

	/**
	 * Tokenizes the entire input string.
	 *
	 * @return list of tokens in input order (no end marker)
	 * @throws ScriptLexException if invalid syntax is encountered
	 */
	public List<ScriptToken> tokenize() {
		List<ScriptToken> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			skipWhitespace();
			if (isAtEnd()) break;

			tokens.add(nextToken());
		}

		return tokens;
	}

	private ScriptToken nextToken() {
		int start = pos;
		char c = peek();

		return switch (c) {
			case '=' -> {
				advance();
				yield ScriptToken.symbol(TokenType.EQUAL, "=", start);
			}
			case '{' -> {
				advance();
				yield ScriptToken.symbol(TokenType.OPEN_BRACE, "{", start);
			}
			case '}' -> {
				advance();
				yield ScriptToken.symbol(TokenType.CLOSE_BRACE, "}", start);
			}
			case ',' -> {
				advance();
				yield ScriptToken.symbol(TokenType.COMMA, ",", start);
			}
			case '"' -> scanString();
			default -> {
				if (isDigit(c) || (c == '-' && pos + 1 < input.length() && isDigit(input.charAt(pos + 1)))) {
					yield scanNumber();
				} else if (isIdentifierChar(input.codePointAt(pos))) {
					yield scanIdentifier();
				} else {
					throw new ScriptLexException(Kind.UNEXPECTED_CHARACTER, pos,
							"Unexpected character '" + new String(Character.toChars(input.codePointAt(pos))) + "'");
				}
			}
		};
	}

	private ScriptToken scanString() {
		int start = pos;
		advance(); // consume opening "

		StringBuilder sb = new StringBuilder();
		while (!isAtEnd() && peek() != '"') {
			char c = advance();
			if (c == '\\') {
				if (isAtEnd()) {
					throw new ScriptLexException(Kind.INCOMPLETE_ESCAPE, pos - 1, "Incomplete escape sequence");
				}
				char next = advance();
				sb.append(switch (next) {
					case 'n' -> '\n';
					case 't' -> '\t';
					case '"' -> '"';
					case '\\' -> '\\';
					default -> throw new ScriptLexException(Kind.UNKNOWN_ESCAPE, pos - 2,
							"Unknown escape sequence '\\" + next + "'");
				});
			} else {
				sb.append(c);
			}
		}

		if (isAtEnd()) {
			throw new ScriptLexException(Kind.UNTERMINATED_STRING, start, "Unterminated string");
		}

		advance(); // consume closing "
		return ScriptToken.string(sb.toString(), start);
	}

	private ScriptToken scanNumber() {
		int start = pos;
		boolean isFloat = false;

		advance(); // leading digit or '-'
		while (!isAtEnd() && (isDigit(peek()) || peek() == '.')) {
			if (advance() == '.') {
				isFloat = true;
			}
		}

		String text = input.substring(start, pos);
		try {
			if (isFloat) {
				return ScriptToken.decimal(text, Double.parseDouble(text), start);
			}
			return ScriptToken.integer(text, Long.parseLong(text), start);
		} catch (NumberFormatException e) {
			throw new ScriptLexException(Kind.NUMBER_FORMAT, start, "Malformed number '" + text + "'", e);
		}
	}

	private ScriptToken scanIdentifier() {
		int start = pos;

		while (!isAtEnd() && isIdentifierChar(input.codePointAt(pos))) {
			pos += Character.charCount(input.codePointAt(pos));
		}

		return ScriptToken.identifier(input.substring(start, pos), start);
	}

	private void skipWhitespace() {
		while (!isAtEnd() && isWhitespace(peek())) {
			advance();
		}
	}

	private char peek() {
		return input.charAt(pos);
	}

	private char advance() {
		return input.charAt(pos++);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	// Unicode White_Space: isWhitespace leaves out no-break spaces and NEL
	private static boolean isWhitespace(char c) {
		return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\u0085';
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private static boolean isIdentifierChar(int codePoint) {
		return Character.isLetterOrDigit(codePoint) || codePoint == '_';
	}
}
