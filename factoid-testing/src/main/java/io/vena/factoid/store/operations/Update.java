package io.vena.factoid.store.operations;

import io.vena.factoid.store.Field;
import io.vena.factoid.store.ReplicatedStore;
import io.vena.factoid.store.UpdateOptions;
import java.util.concurrent.CompletableFuture;

public record Update<T>(
	Field<T> field,
	T value,
	UpdateOptions options
) implements StoreOperation {

	@Override
	public CompletableFuture<Void> submitTo(ReplicatedStore store) {
		return store.update(field, value, options);
	}
}
