package io.vena.factoid.store.operations;

import io.vena.factoid.store.ListField;
import io.vena.factoid.store.ReplicatedStore;
import io.vena.factoid.store.UpdateOptions;
import java.util.concurrent.CompletableFuture;

public record Pull<T>(
	ListField<T> field,
	T item,
	UpdateOptions options
) implements StoreOperation {

	@Override
	public CompletableFuture<Void> submitTo(ReplicatedStore store) {
		return store.pull(field, item, options);
	}
}
