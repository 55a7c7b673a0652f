package org.javai.scenario.text;

import java.util.List;
import java.util.Set;
import org.javai.scenario.script.ScriptDocument;
import org.javai.scenario.script.ScriptValue;
import org.javai.scenario.script.ScriptValue.ArrayValue;
import org.javai.scenario.script.ScriptValue.DictionaryValue;
import org.javai.scenario.text.ScenarioTreeException.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves dialogue strings out of and back into a parsed script, and strips
 * scripts down to their control-flow skeleton.
 * <p>
 * Example usage:
 *
 * <pre>
 * ScenarioText scenarioText = new ScenarioText();
 * List&lt;String&gt; lines = scenarioText.extract(document);
 * // ... translate lines, keeping order and count ...
 * scenarioText.merge(document, translated);
 * </pre>
 *
 * {@link #extract} and {@link #merge} share one {@link ScenarioTextWalker}, so
 * the n-th extracted string is the n-th string replaced.
 */
public class ScenarioText {

	private static final Logger logger = LoggerFactory.getLogger(ScenarioText.class);

	/**
	 * Item keys that survive {@link #prune}.
	 */
	public static final Set<String> SKELETON_KEYS = Set.of("linknext", "line");

	private final ScenarioTextWalker walker;

	public ScenarioText() {
		this(new ScenarioTextWalker());
	}

	public ScenarioText(String languageKey) {
		this(new ScenarioTextWalker(languageKey));
	}

	public ScenarioText(ScenarioTextWalker walker) {
		if (walker == null) {
			throw new IllegalArgumentException("Walker cannot be null");
		}
		this.walker = walker;
	}

	/**
	 * Lists every dialogue string in traversal order. The document is not modified.
	 *
	 * @throws ScenarioTreeException if the document has no usable {@code ast}
	 */
	public List<String> extract(ScriptDocument document) {
		List<String> texts = walker.textSlots(document).stream()
				.map(TextSlot::text)
				.toList();
		logger.debug("Extracted {} '{}' strings", texts.size(), walker.languageKey());
		return texts;
	}

	/**
	 * Reduces every block item to its {@code linknext}/{@code line} entries and
	 * removes items that are not dictionaries. Keys above the item level are kept.
	 *
	 * @return the same document, modified in place
	 * @throws ScenarioTreeException if the document has no usable {@code ast};
	 * nothing is modified in that case
	 */
	public ScriptDocument prune(ScriptDocument document) {
		List<ArrayValue> blocks = walker.blockItems(document);

		int removed = 0;
		for (ArrayValue items : blocks) {
			List<ScriptValue> elements = items.elements();
			int before = elements.size();
			elements.removeIf(item -> !(item instanceof DictionaryValue));
			removed += before - elements.size();
			for (ScriptValue item : elements) {
				((DictionaryValue) item).entries().keySet().retainAll(SKELETON_KEYS);
			}
		}

		logger.debug("Pruned {} blocks, dropped {} non-dictionary items", blocks.size(), removed);
		return document;
	}

	/**
	 * Replaces every dialogue string, in traversal order, with the next entry of
	 * {@code texts}. Counts are checked before anything is written.
	 *
	 * @return the same document, modified in place
	 * @throws ScenarioTreeException with {@link Kind#EXHAUSTED_INPUT} when there are
	 * fewer texts than strings, {@link Kind#UNUSED_INPUT} when there are more
	 */
	public ScriptDocument merge(ScriptDocument document, List<String> texts) {
		if (texts == null) {
			throw new IllegalArgumentException("Texts cannot be null");
		}
		List<TextSlot> slots = walker.textSlots(document);

		if (texts.size() < slots.size()) {
			throw new ScenarioTreeException(Kind.EXHAUSTED_INPUT,
					"Ran out of texts: document has " + slots.size() + " strings but only "
							+ texts.size() + " were supplied");
		}
		if (texts.size() > slots.size()) {
			throw new ScenarioTreeException(Kind.UNUSED_INPUT,
					(texts.size() - slots.size()) + " texts left unused: document has only "
							+ slots.size() + " strings");
		}

		for (int i = 0; i < texts.size(); i++) {
			if (texts.get(i) == null) {
				throw new IllegalArgumentException("Text at index " + i + " is null");
			}
		}

		for (int i = 0; i < slots.size(); i++) {
			slots.get(i).replace(texts.get(i));
		}

		logger.debug("Merged {} '{}' strings", slots.size(), walker.languageKey());
		return document;
	}
}
