package io.vena.factoid.store;

import io.vena.factoid.Identified;
import io.vena.factoid.Identifier;
import io.vena.factoid.Registration;
import java.util.concurrent.CompletableFuture;
import org.jetbrains.annotations.Nullable;

/**
 * Holds replicated state as a set of named {@link Field}s and propagates
 * changes between the parties sharing that state.
 *
 * <p>
 * Reads are synchronous and see the local replica, including local updates
 * whose replication has not yet been acknowledged.
 * Updates apply to the local replica immediately and return a future that
 * completes when the update has been accepted; a rejection is reported as a
 * {@link io.vena.factoid.exceptions.ReplicationFailureException ReplicationFailureException}
 * or {@link io.vena.factoid.exceptions.InvariantViolationException InvariantViolationException}.
 * Stores do not retry.
 *
 * <p>
 * Changes made by other parties are delivered to {@link #onRemoteDiff} listeners,
 * one change at a time.
 */
public interface ReplicatedStore {
	boolean declares(Field<?> field);

	/**
	 * @return the current local value of <code>field</code>, or null if it's not declared
	 */
	<T> @Nullable T get(Field<T> field);

	StoreSnapshot snapshot();

	/**
	 * @return true if this store is currently synchronizing with the other parties
	 */
	boolean live();

	/**
	 * Starts or stops synchronization with the other parties.
	 */
	CompletableFuture<Void> synch(boolean enable);

	<T> CompletableFuture<Void> update(Field<T> field, T value, UpdateOptions options);

	/**
	 * Appends <code>item</code> to a list field.
	 */
	<T> CompletableFuture<Void> push(ListField<T> field, T item, UpdateOptions options);

	/**
	 * Removes every occurrence of <code>item</code> from a list field.
	 */
	<T> CompletableFuture<Void> pull(ListField<T> field, T item, UpdateOptions options);

	/**
	 * Removes the item with the given id from a list field.
	 */
	<T extends Identified> CompletableFuture<Void> pullByID(ListField<T> field, Identifier id, UpdateOptions options);

	/**
	 * Replaces, in place, the item of a list field that has the same id as <code>patched</code>.
	 */
	<T extends Identified> CompletableFuture<Void> mergeByID(ListField<T> field, T patched, UpdateOptions options);

	/**
	 * Subscribes to changes made by other parties.
	 */
	Registration onRemoteDiff(StateListener listener);

	/**
	 * Subscribes to updates made through this store, except {@link UpdateOptions#silent() silent} ones.
	 */
	Registration onLocalUpdate(StateListener listener);
}
