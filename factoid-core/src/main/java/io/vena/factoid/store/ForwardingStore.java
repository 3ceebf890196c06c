package io.vena.factoid.store;

import io.vena.factoid.Identified;
import io.vena.factoid.Identifier;
import io.vena.factoid.Registration;
import java.util.concurrent.CompletableFuture;
import lombok.NonNull;
import org.jetbrains.annotations.Nullable;

/**
 * Passes every call through to a <code>downstream</code> store.
 * Decorators extend this and override just the methods they care about.
 */
public abstract class ForwardingStore implements ReplicatedStore {
	protected final ReplicatedStore downstream;

	protected ForwardingStore(@NonNull ReplicatedStore downstream) {
		this.downstream = downstream;
	}

	@Override
	public boolean declares(Field<?> field) {
		return downstream.declares(field);
	}

	@Override
	public <T> @Nullable T get(Field<T> field) {
		return downstream.get(field);
	}

	@Override
	public StoreSnapshot snapshot() {
		return downstream.snapshot();
	}

	@Override
	public boolean live() {
		return downstream.live();
	}

	@Override
	public CompletableFuture<Void> synch(boolean enable) {
		return downstream.synch(enable);
	}

	@Override
	public <T> CompletableFuture<Void> update(Field<T> field, T value, UpdateOptions options) {
		return downstream.update(field, value, options);
	}

	@Override
	public <T> CompletableFuture<Void> push(ListField<T> field, T item, UpdateOptions options) {
		return downstream.push(field, item, options);
	}

	@Override
	public <T> CompletableFuture<Void> pull(ListField<T> field, T item, UpdateOptions options) {
		return downstream.pull(field, item, options);
	}

	@Override
	public <T extends Identified> CompletableFuture<Void> pullByID(ListField<T> field, Identifier id, UpdateOptions options) {
		return downstream.pullByID(field, id, options);
	}

	@Override
	public <T extends Identified> CompletableFuture<Void> mergeByID(ListField<T> field, T patched, UpdateOptions options) {
		return downstream.mergeByID(field, patched, options);
	}

	@Override
	public Registration onRemoteDiff(StateListener listener) {
		return downstream.onRemoteDiff(listener);
	}

	@Override
	public Registration onLocalUpdate(StateListener listener) {
		return downstream.onLocalUpdate(listener);
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "(" + downstream + ")";
	}
}
