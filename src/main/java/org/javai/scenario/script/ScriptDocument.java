package org.javai.scenario.script;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.javai.scenario.script.ScriptValue.ArrayValue;
import org.javai.scenario.script.ScriptValue.DictionaryValue;

/**
 * The result of parsing a script file: the top-level {@code key = value} pairs
 * in source order.
 * <p>
 * A document is owned by a single operation from parse to serialization; tree
 * algorithms mutate it in place.
 */
public final class ScriptDocument {

	public static final String AST_VERSION_KEY = "astver";
	public static final String AST_KEY = "ast";

	private final DictionaryValue root;

	public ScriptDocument() {
		this(new DictionaryValue(new LinkedHashMap<>()));
	}

	public ScriptDocument(DictionaryValue root) {
		if (root == null) {
			throw new IllegalArgumentException("Document root cannot be null");
		}
		this.root = root;
	}

	public DictionaryValue root() {
		return root;
	}

	/**
	 * Live view of the top-level entries.
	 */
	public Map<String, ScriptValue> entries() {
		return root.entries();
	}

	public Optional<ScriptValue> get(String key) {
		return root.get(key);
	}

	public ScriptDocument put(String key, ScriptValue value) {
		root.entries().put(key, value);
		return this;
	}

	/**
	 * The {@code astver} tag, when present and numeric.
	 */
	public Optional<Double> astVersion() {
		return get(AST_VERSION_KEY).flatMap(value -> {
			if (value instanceof ScriptValue.FloatValue f) {
				return Optional.of(f.value());
			} else if (value instanceof ScriptValue.IntegerValue i) {
				return Optional.of((double) i.value());
			}
			return Optional.empty();
		});
	}

	/**
	 * The {@code ast} array of block wrappers, when present and an array.
	 */
	public Optional<ArrayValue> ast() {
		return get(AST_KEY).flatMap(ScriptValue::asArray);
	}

	@Override
	public boolean equals(Object o) {
		return this == o || (o instanceof ScriptDocument other && root.equals(other.root));
	}

	@Override
	public int hashCode() {
		return root.hashCode();
	}

	@Override
	public String toString() {
		return "ScriptDocument" + root.entries();
	}
}
