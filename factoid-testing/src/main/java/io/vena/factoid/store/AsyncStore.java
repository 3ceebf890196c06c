package io.vena.factoid.store;

import io.vena.factoid.Identified;
import io.vena.factoid.Identifier;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies updates to the downstream store right away, like any store does to its local replica,
 * but acknowledges them on another thread, like a store waiting for a server would.
 */
public class AsyncStore extends ForwardingStore implements AutoCloseable {
	private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
		Thread thread = new Thread(r, "AsyncStore");
		thread.setDaemon(true);
		return thread;
	});

	private AsyncStore(ReplicatedStore downstream) {
		super(downstream);
	}

	public static StoreFactory factory() {
		return AsyncStore::new;
	}

	@Override
	public <T> CompletableFuture<Void> update(Field<T> field, T value, UpdateOptions options) {
		return acknowledgeLater("update " + field, () -> downstream.update(field, value, options));
	}

	@Override
	public <T> CompletableFuture<Void> push(ListField<T> field, T item, UpdateOptions options) {
		return acknowledgeLater("push " + field, () -> downstream.push(field, item, options));
	}

	@Override
	public <T> CompletableFuture<Void> pull(ListField<T> field, T item, UpdateOptions options) {
		return acknowledgeLater("pull " + field, () -> downstream.pull(field, item, options));
	}

	@Override
	public <T extends Identified> CompletableFuture<Void> pullByID(ListField<T> field, Identifier id, UpdateOptions options) {
		return acknowledgeLater("pullByID " + field, () -> downstream.pullByID(field, id, options));
	}

	@Override
	public <T extends Identified> CompletableFuture<Void> mergeByID(ListField<T> field, T patched, UpdateOptions options) {
		return acknowledgeLater("mergeByID " + field, () -> downstream.mergeByID(field, patched, options));
	}

	private CompletableFuture<Void> acknowledgeLater(String description, Supplier<CompletableFuture<Void>> update) {
		LOGGER.debug("Submit {}", description);
		return update.get().whenCompleteAsync((v, e) -> LOGGER.trace("Acknowledge {}", description), executor);
	}

	@Override
	public void close() {
		executor.shutdown();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(AsyncStore.class);
}
