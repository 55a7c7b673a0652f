package org.javai.scenario.script;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A value in a parsed script tree. Sealed to ensure all value kinds are known.
 * <p>
 * Values can be:
 * <ul>
 *   <li>{@link IntegerValue} - a 64-bit signed integer literal</li>
 *   <li>{@link FloatValue} - a 64-bit floating point literal</li>
 *   <li>{@link StringValue} - a quoted string, or a bare identifier used as a value</li>
 *   <li>{@link ArrayValue} - a brace-delimited, ordered sequence of values</li>
 *   <li>{@link DictionaryValue} - {@code key=value} entries</li>
 * </ul>
 * Arrays and dictionaries are mutable containers so that tree algorithms can
 * rewrite a document in place. Equality is structural: dictionary equality
 * ignores key order, array equality does not.
 */
public sealed interface ScriptValue {

	record IntegerValue(long value) implements ScriptValue {
	}

	record FloatValue(double value) implements ScriptValue {
	}

	record StringValue(String value) implements ScriptValue {
		public StringValue {
			if (value == null) {
				throw new IllegalArgumentException("String value cannot be null");
			}
		}
	}

	/**
	 * @param elements the elements in source order; copied on construction, the copy
	 * is owned by this value and may be mutated
	 */
	record ArrayValue(List<ScriptValue> elements) implements ScriptValue {
		public ArrayValue {
			elements = elements != null ? new ArrayList<>(elements) : new ArrayList<>();
		}

		public ArrayValue() {
			this(new ArrayList<>());
		}

		public static ArrayValue of(ScriptValue... values) {
			return new ArrayValue(List.of(values));
		}
	}

	/**
	 * @param entries the entries in insertion order; copied on construction, the copy
	 * is owned by this value and may be mutated
	 */
	record DictionaryValue(Map<String, ScriptValue> entries) implements ScriptValue {
		public DictionaryValue {
			entries = entries != null ? new LinkedHashMap<>(entries) : new LinkedHashMap<>();
		}

		public DictionaryValue() {
			this(new LinkedHashMap<>());
		}

		/**
		 * The shape the parser builds for {@code identifier = value} inside a value position.
		 */
		public static DictionaryValue single(String key, ScriptValue value) {
			DictionaryValue dictionary = new DictionaryValue();
			dictionary.entries().put(key, value);
			return dictionary;
		}

		public Optional<ScriptValue> get(String key) {
			return Optional.ofNullable(entries.get(key));
		}
	}

	static StringValue string(String value) {
		return new StringValue(value);
	}

	static IntegerValue integer(long value) {
		return new IntegerValue(value);
	}

	static FloatValue decimal(double value) {
		return new FloatValue(value);
	}

	default Optional<String> asString() {
		return this instanceof StringValue s ? Optional.of(s.value()) : Optional.empty();
	}

	default Optional<ArrayValue> asArray() {
		return this instanceof ArrayValue a ? Optional.of(a) : Optional.empty();
	}

	default Optional<DictionaryValue> asDictionary() {
		return this instanceof DictionaryValue d ? Optional.of(d) : Optional.empty();
	}

	/**
	 * Short kind name used in error messages.
	 */
	default String kind() {
		if (this instanceof IntegerValue) {
			return "integer";
		} else if (this instanceof FloatValue) {
			return "float";
		} else if (this instanceof StringValue) {
			return "string";
		} else if (this instanceof ArrayValue) {
			return "array";
		}
		return "dictionary";
	}
}
