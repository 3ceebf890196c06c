package io.vena.factoid.exceptions;

/**
 * Indicates that an object was constructed with collaborators that can't support it,
 * such as a store lacking a field the object needs.
 */
public class InvalidConfigurationException extends IllegalArgumentException {
	public InvalidConfigurationException(String message) {
		super(message);
	}

	public InvalidConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
