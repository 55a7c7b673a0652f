package org.javai.scenario.script;

/**
 * Base class for failures raised while reading, transforming or writing a script.
 */
public abstract class ScriptException extends RuntimeException {

	protected ScriptException(String message) {
		super(message);
	}

	protected ScriptException(String message, Throwable cause) {
		super(message, cause);
	}
}
