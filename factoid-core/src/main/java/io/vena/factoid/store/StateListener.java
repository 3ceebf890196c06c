package io.vena.factoid.store;

import java.util.concurrent.CompletionStage;

/**
 * Notified by a {@link ReplicatedStore} when its state changes.
 *
 * <p>
 * The returned stage completes when the listener has finished reacting to the change.
 * Stores deliver remote changes one at a time, waiting for every listener to finish with
 * one change before delivering the next.
 */
@FunctionalInterface
public interface StateListener {
	/**
	 * @param updated the store state after the change
	 * @param previous the store state before the change
	 */
	CompletionStage<Void> onChange(StoreSnapshot updated, StoreSnapshot previous);
}
