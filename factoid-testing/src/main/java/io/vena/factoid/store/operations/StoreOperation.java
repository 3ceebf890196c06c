package io.vena.factoid.store.operations;

import io.vena.factoid.store.Field;
import io.vena.factoid.store.ReplicatedStore;
import io.vena.factoid.store.UpdateOptions;
import java.util.concurrent.CompletableFuture;

/**
 * One call to an update method of a {@link ReplicatedStore}, reified so it can be
 * recorded, filtered, and replayed.
 */
public interface StoreOperation {
	Field<?> field();
	UpdateOptions options();

	/**
	 * Calls the appropriate update method on the given store.
	 */
	CompletableFuture<Void> submitTo(ReplicatedStore store);
}
