package io.vena.factoid.store;

import io.vena.factoid.Identified;
import io.vena.factoid.Identifier;
import io.vena.factoid.exceptions.ReplicationFailureException;
import io.vena.factoid.store.operations.MergeByID;
import io.vena.factoid.store.operations.Pull;
import io.vena.factoid.store.operations.PullByID;
import io.vena.factoid.store.operations.Push;
import io.vena.factoid.store.operations.StoreOperation;
import io.vena.factoid.store.operations.Update;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rejects the updates that match a given predicate with a {@link ReplicationFailureException},
 * without passing them downstream, the way a server would reject an update it refuses to accept.
 * Other updates pass through.
 */
public class FailingStore extends ForwardingStore {
	private final Predicate<StoreOperation> shouldFail;

	private FailingStore(ReplicatedStore downstream, Predicate<StoreOperation> shouldFail) {
		super(downstream);
		this.shouldFail = shouldFail;
	}

	public static StoreFactory factory(Predicate<StoreOperation> shouldFail) {
		return downstream -> new FailingStore(downstream, shouldFail);
	}

	public static StoreFactory failingEverything() {
		return factory(op -> true);
	}

	@Override
	public <T> CompletableFuture<Void> update(Field<T> field, T value, UpdateOptions options) {
		return submit(new Update<>(field, value, options));
	}

	@Override
	public <T> CompletableFuture<Void> push(ListField<T> field, T item, UpdateOptions options) {
		return submit(new Push<>(field, item, options));
	}

	@Override
	public <T> CompletableFuture<Void> pull(ListField<T> field, T item, UpdateOptions options) {
		return submit(new Pull<>(field, item, options));
	}

	@Override
	public <T extends Identified> CompletableFuture<Void> pullByID(ListField<T> field, Identifier id, UpdateOptions options) {
		return submit(new PullByID<>(field, id, options));
	}

	@Override
	public <T extends Identified> CompletableFuture<Void> mergeByID(ListField<T> field, T patched, UpdateOptions options) {
		return submit(new MergeByID<>(field, patched, options));
	}

	private CompletableFuture<Void> submit(StoreOperation op) {
		if (shouldFail.test(op)) {
			LOGGER.debug("Rejecting {}", op);
			return CompletableFuture.failedFuture(new ReplicationFailureException("Rejected " + op));
		} else {
			return op.submitTo(downstream);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(FailingStore.class);
}
