package org.javai.scenario.io;

/**
 * Exception thrown when a scenario text list cannot be read or written.
 */
public class ScenarioTextFileException extends RuntimeException {

	public ScenarioTextFileException(String message) {
		super(message);
	}

	public ScenarioTextFileException(String message, Throwable cause) {
		super(message, cause);
	}
}
