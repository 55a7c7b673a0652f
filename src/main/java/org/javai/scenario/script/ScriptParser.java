package org.javai.scenario.script;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.javai.scenario.script.ScriptParseException.Kind;
import org.javai.scenario.script.ScriptToken.TokenType;
import org.javai.scenario.script.ScriptValue.ArrayValue;
import org.javai.scenario.script.ScriptValue.DictionaryValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent parser for the script dump format.
 * <p>
 * Grammar:
 *
 * <pre>
 * document := (identifier '=' value)*
 * value    := array | string | integer | float | identifier ['=' value]
 * array    := '{' (value (',' value)* ','?)? '}'
 * </pre>
 *
 * A bare identifier followed by {@code =} becomes a one-entry dictionary wrapping
 * the following value; any other bare identifier is a string value.
 * <p>
 * Example usage:
 *
 * <pre>
 * List&lt;ScriptToken&gt; tokens = new ScriptTokenizer(text).tokenize();
 * ScriptDocument document = new ScriptParser(tokens).parse();
 *
 * // or in one step
 * ScriptDocument document = ScriptParser.parse(text);
 * </pre>
 */
public class ScriptParser {

	private static final Logger logger = LoggerFactory.getLogger(ScriptParser.class);

	/**
	 * Deepest value nesting accepted before parsing fails with {@link Kind#NESTING_TOO_DEEP}.
	 */
	public static final int MAX_NESTING_DEPTH = 1000;

	private final List<ScriptToken> tokens;
	private int current = 0;
	private int depth = 0;

	public ScriptParser(List<ScriptToken> tokens) {
		this.tokens = tokens != null ? tokens : List.of();
	}

	/**
	 * Tokenizes and parses script text.
	 *
	 * @throws ScriptLexException if the text cannot be tokenized
	 * @throws ScriptParseException if the tokens do not form a document
	 */
	public static ScriptDocument parse(String text) {
		return new ScriptParser(new ScriptTokenizer(text).tokenize()).parse();
	}

	/**
	 * Parses the tokens into a document.
	 *
	 * @return the document (empty when there are no tokens)
	 * @throws ScriptParseException if syntax errors are encountered
	 */
	public ScriptDocument parse() {
		Map<String, ScriptValue> entries = new LinkedHashMap<>();

		while (!isAtEnd()) {
			ScriptToken keyToken = advance();
			if (!keyToken.isType(TokenType.IDENTIFIER)) {
				throw new ScriptParseException(Kind.EXPECTED_IDENTIFIER, keyToken,
						"Expected identifier at top level, found " + keyToken);
			}
			expectEqualAfter(keyToken);

			ScriptValue value = parseValue();
			if (entries.put(keyToken.text(), value) != null) {
				logger.warn("Duplicate top-level key '{}' at position {}; keeping the last value",
						keyToken.text(), keyToken.position());
			}
		}

		logger.debug("Parsed {} tokens into top-level keys {}", tokens.size(), entries.keySet());
		return new ScriptDocument(new DictionaryValue(entries));
	}

	private void expectEqualAfter(ScriptToken keyToken) {
		if (isAtEnd()) {
			throw ScriptParseException.endOfInput("expected '=' after '" + keyToken.text() + "'");
		}
		ScriptToken next = advance();
		if (!next.isType(TokenType.EQUAL)) {
			throw new ScriptParseException(Kind.UNEXPECTED_TOKEN, next,
					"Expected '=' after '" + keyToken.text() + "', found " + next);
		}
	}

	private ScriptValue parseValue() {
		if (isAtEnd()) {
			throw ScriptParseException.endOfInput("expected a value");
		}
		ScriptToken token = advance();
		if (++depth > MAX_NESTING_DEPTH) {
			throw new ScriptParseException(Kind.NESTING_TOO_DEEP, token,
					"Values nested deeper than " + MAX_NESTING_DEPTH + " levels");
		}

		try {
			return switch (token.type()) {
				case OPEN_BRACE -> parseArray(token);
				case STRING -> ScriptValue.string(token.text());
				case INTEGER -> ScriptValue.integer(token.longValue());
				case FLOAT -> ScriptValue.decimal(token.doubleValue());
				case IDENTIFIER -> parseIdentifierValue(token);
				case EQUAL, CLOSE_BRACE, COMMA -> throw new ScriptParseException(Kind.UNEXPECTED_TOKEN, token,
						"Unexpected token " + token);
			};
		} finally {
			depth--;
		}
	}

	private ScriptValue parseIdentifierValue(ScriptToken identifier) {
		ScriptToken next = lookahead().orElseThrow(() -> ScriptParseException.endOfInput(
				"identifier '" + identifier.text() + "' is not followed by anything"));

		if (next.isType(TokenType.EQUAL)) {
			advance(); // consume '='
			return DictionaryValue.single(identifier.text(), parseValue());
		}
		return ScriptValue.string(identifier.text());
	}

	private ArrayValue parseArray(ScriptToken openBrace) {
		List<ScriptValue> values = new ArrayList<>();

		while (true) {
			ScriptToken token = lookahead().orElseThrow(() -> ScriptParseException.endOfInput(
					"'{' at position " + openBrace.position() + " is never closed"));

			if (token.isType(TokenType.CLOSE_BRACE)) {
				advance();
				return new ArrayValue(values);
			}
			if (token.isType(TokenType.COMMA)) {
				advance();
				continue;
			}
			values.add(parseValue());
		}
	}

	private Optional<ScriptToken> lookahead() {
		return isAtEnd() ? Optional.empty() : Optional.of(tokens.get(current));
	}

	private ScriptToken advance() {
		return tokens.get(current++);
	}

	private boolean isAtEnd() {
		return current >= tokens.size();
	}
}
