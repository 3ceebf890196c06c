package io.vena.factoid.exceptions;

/**
 * Indicates that a {@link io.vena.factoid.store.ReplicatedStore} rejected an update.
 *
 * <p>
 * Stores report this as the failure of the future returned by the update method.
 * Callers see it unmodified; nothing between the store and the caller retries.
 */
public class ReplicationFailureException extends RuntimeException {
	public ReplicationFailureException(String message) {
		super(message);
	}

	public ReplicationFailureException(String message, Throwable cause) {
		super(message, cause);
	}

	public ReplicationFailureException(Throwable cause) {
		super(cause);
	}
}
