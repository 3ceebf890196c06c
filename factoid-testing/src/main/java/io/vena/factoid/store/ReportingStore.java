package io.vena.factoid.store;

import io.vena.factoid.Identified;
import io.vena.factoid.Identifier;
import io.vena.factoid.store.operations.MergeByID;
import io.vena.factoid.store.operations.Pull;
import io.vena.factoid.store.operations.PullByID;
import io.vena.factoid.store.operations.Push;
import io.vena.factoid.store.operations.StoreOperation;
import io.vena.factoid.store.operations.Update;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Sends a {@link StoreOperation} to a given listener whenever one of the update methods is called.
 * <p>
 * <em>Implementation note</em>: this class calls the downstream store using {@link StoreOperation#submitTo}
 * so that the ordinary {@link StoreConformanceTest} suite also tests all the {@link StoreOperation} objects.
 */
public class ReportingStore extends ForwardingStore {
	private final Consumer<StoreOperation> updateListener;

	private ReportingStore(ReplicatedStore downstream, Consumer<StoreOperation> updateListener) {
		super(downstream);
		this.updateListener = updateListener;
	}

	public static StoreFactory factory(Consumer<StoreOperation> listener) {
		return downstream -> new ReportingStore(downstream, listener);
	}

	@Override
	public <T> CompletableFuture<Void> update(Field<T> field, T value, UpdateOptions options) {
		return report(new Update<>(field, value, options));
	}

	@Override
	public <T> CompletableFuture<Void> push(ListField<T> field, T item, UpdateOptions options) {
		return report(new Push<>(field, item, options));
	}

	@Override
	public <T> CompletableFuture<Void> pull(ListField<T> field, T item, UpdateOptions options) {
		return report(new Pull<>(field, item, options));
	}

	@Override
	public <T extends Identified> CompletableFuture<Void> pullByID(ListField<T> field, Identifier id, UpdateOptions options) {
		return report(new PullByID<>(field, id, options));
	}

	@Override
	public <T extends Identified> CompletableFuture<Void> mergeByID(ListField<T> field, T patched, UpdateOptions options) {
		return report(new MergeByID<>(field, patched, options));
	}

	private CompletableFuture<Void> report(StoreOperation op) {
		updateListener.accept(op);
		return op.submitTo(downstream);
	}
}
