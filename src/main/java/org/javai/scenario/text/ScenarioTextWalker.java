package org.javai.scenario.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.javai.scenario.script.ScriptDocument;
import org.javai.scenario.script.ScriptValue;
import org.javai.scenario.script.ScriptValue.ArrayValue;
import org.javai.scenario.script.ScriptValue.DictionaryValue;
import org.javai.scenario.script.ScriptValue.StringValue;

/**
 * Walks the fixed path from a document down to its dialogue strings:
 *
 * <pre>
 * ast[] -&gt; block wrapper {block_NNNNN = items[]} -&gt; item {text = [...]}
 *       -&gt; text block {&lt;lang&gt; = [...]} -&gt; line[] -&gt; string
 * </pre>
 *
 * Arrays are visited in element order and each block wrapper in its entry order,
 * so two walks over the same document yield the same sequence. Anything off the
 * path that has an unexpected shape is skipped; only {@code ast} and the block
 * wrappers are required.
 */
public final class ScenarioTextWalker {

	public static final String DEFAULT_LANGUAGE = "ja";
	public static final String BLOCK_PREFIX = "block_";
	public static final String TEXT_KEY = "text";

	private final String languageKey;

	public ScenarioTextWalker() {
		this(DEFAULT_LANGUAGE);
	}

	public ScenarioTextWalker(String languageKey) {
		if (languageKey == null || languageKey.isBlank()) {
			throw new IllegalArgumentException("Language key cannot be blank");
		}
		this.languageKey = languageKey;
	}

	public String languageKey() {
		return languageKey;
	}

	/**
	 * Collects the item arrays of every {@code block_} entry, in traversal order.
	 *
	 * @throws ScenarioTreeException if {@code ast} is missing, is not an array, or
	 * holds something other than block wrapper dictionaries
	 */
	public List<ArrayValue> blockItems(ScriptDocument document) {
		ScriptValue ast = document.get(ScriptDocument.AST_KEY)
				.orElseThrow(() -> ScenarioTreeException.missingField(ScriptDocument.AST_KEY));
		if (!(ast instanceof ArrayValue astArray)) {
			throw ScenarioTreeException.typeMismatch(ScriptDocument.AST_KEY, "array", ast.kind());
		}

		List<ArrayValue> blocks = new ArrayList<>();
		List<ScriptValue> wrappers = astArray.elements();
		for (int i = 0; i < wrappers.size(); i++) {
			if (!(wrappers.get(i) instanceof DictionaryValue wrapper)) {
				throw ScenarioTreeException.typeMismatch("ast[" + i + "]", "dictionary", wrappers.get(i).kind());
			}
			for (Map.Entry<String, ScriptValue> entry : wrapper.entries().entrySet()) {
				if (entry.getKey().startsWith(BLOCK_PREFIX) && entry.getValue() instanceof ArrayValue items) {
					blocks.add(items);
				}
			}
		}
		return blocks;
	}

	/**
	 * Collects every dialogue string position, in traversal order.
	 */
	public List<TextSlot> textSlots(ScriptDocument document) {
		List<TextSlot> slots = new ArrayList<>();
		for (ArrayValue items : blockItems(document)) {
			for (ScriptValue item : items.elements()) {
				item.asDictionary()
						.flatMap(dictionary -> dictionary.get(TEXT_KEY))
						.flatMap(ScriptValue::asArray)
						.ifPresent(textBlocks -> collectTextBlocks(textBlocks, slots));
			}
		}
		return slots;
	}

	private void collectTextBlocks(ArrayValue textBlocks, List<TextSlot> slots) {
		for (ScriptValue textBlock : textBlocks.elements()) {
			textBlock.asDictionary()
					.flatMap(dictionary -> dictionary.get(languageKey))
					.flatMap(ScriptValue::asArray)
					.ifPresent(lines -> collectLines(lines, slots));
		}
	}

	private void collectLines(ArrayValue lines, List<TextSlot> slots) {
		for (ScriptValue line : lines.elements()) {
			if (line instanceof ArrayValue lineArray) {
				List<ScriptValue> elements = lineArray.elements();
				for (int i = 0; i < elements.size(); i++) {
					if (elements.get(i) instanceof StringValue) {
						slots.add(new TextSlot(elements, i));
					}
				}
			}
		}
	}
}
