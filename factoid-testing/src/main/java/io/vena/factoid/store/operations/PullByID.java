package io.vena.factoid.store.operations;

import io.vena.factoid.Identified;
import io.vena.factoid.Identifier;
import io.vena.factoid.store.ListField;
import io.vena.factoid.store.ReplicatedStore;
import io.vena.factoid.store.UpdateOptions;
import java.util.concurrent.CompletableFuture;

public record PullByID<T extends Identified>(
	ListField<T> field,
	Identifier id,
	UpdateOptions options
) implements StoreOperation {

	@Override
	public CompletableFuture<Void> submitTo(ReplicatedStore store) {
		return store.pullByID(field, id, options);
	}
}
