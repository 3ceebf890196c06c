package io.vena.factoid.exceptions;

/**
 * Indicates a broken contract between collaborators, such as an element that is
 * in an {@link io.vena.factoid.ElementSet}'s index but has no entry in the store,
 * or two entries with the same id.
 *
 * <p>
 * This is a programming error, not an operational one, so it is never retried or ignored.
 */
public class InvariantViolationException extends IllegalStateException {
	public InvariantViolationException(String message) {
		super(message);
	}
}
