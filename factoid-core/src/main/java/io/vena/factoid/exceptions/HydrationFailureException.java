package io.vena.factoid.exceptions;

import io.vena.factoid.Identifier;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Indicates that an element could not be loaded from its
 * {@link io.vena.factoid.ElementCache}, or could not be made live.
 * The operation that needed the element has made no changes.
 */
@Getter
@Accessors(fluent = true)
public class HydrationFailureException extends RuntimeException {
	private final Identifier elementID;

	public HydrationFailureException(Identifier elementID, Throwable cause) {
		super("Unable to hydrate element " + elementID + ": " + cause.getMessage(), cause);
		this.elementID = elementID;
	}
}
