package io.vena.factoid.store;

import io.vena.factoid.Identified;
import io.vena.factoid.Identifier;
import io.vena.factoid.Registration;
import io.vena.factoid.exceptions.InvariantViolationException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;
import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.factoid.util.Futures.unwrap;
import static java.util.concurrent.CompletableFuture.completedFuture;

/**
 * A {@link ReplicatedStore} held in memory.
 *
 * <p>
 * The state is an immutable {@link StoreSnapshot} that is replaced as a whole on every update,
 * so readers always see a consistent state without locking.
 * Local updates are accepted immediately.
 * Changes from other parties are applied by calling {@link #receiveRemote}, which is what a
 * transport (or a {@link MirroringStore}, or a test) does when it has news.
 *
 * <p>
 * Remote changes are delivered to {@link #onRemoteDiff} listeners in the order they were received,
 * and a change is not delivered until every listener has finished with the previous one.
 * Listeners are never called while this store's monitor is held.
 */
@Accessors(fluent = true)
public class LocalStore implements ReplicatedStore {
	@Getter private final String name;
	private final List<StateListener> remoteDiffListeners = new CopyOnWriteArrayList<>();
	private final List<StateListener> localUpdateListeners = new CopyOnWriteArrayList<>();

	// Mutable state
	private volatile StoreSnapshot current;
	private volatile boolean live = false;
	private CompletableFuture<Void> lastRemoteDelivery = completedFuture(null); // Guarded by this

	public LocalStore(String name, @NonNull StoreSnapshot initialState) {
		this.name = name;
		this.current = initialState;
	}

	@Override
	public boolean declares(Field<?> field) {
		return current.declares(field);
	}

	@Override
	public <T> @Nullable T get(Field<T> field) {
		return current.get(field);
	}

	@Override
	public StoreSnapshot snapshot() {
		return current;
	}

	@Override
	public boolean live() {
		return live;
	}

	@Override
	public CompletableFuture<Void> synch(boolean enable) {
		LOGGER.debug("{}: synch({})", name, enable);
		live = enable;
		return completedFuture(null);
	}

	@Override
	public <T> CompletableFuture<Void> update(Field<T> field, T value, UpdateOptions options) {
		return applyLocal("update " + field, s -> s.with(field, value), options);
	}

	@Override
	public <T> CompletableFuture<Void> push(ListField<T> field, T item, UpdateOptions options) {
		return applyLocal("push " + field, s -> s.withPushed(field, item), options);
	}

	@Override
	public <T> CompletableFuture<Void> pull(ListField<T> field, T item, UpdateOptions options) {
		return applyLocal("pull " + field, s -> s.withPulled(field, item), options);
	}

	@Override
	public <T extends Identified> CompletableFuture<Void> pullByID(ListField<T> field, Identifier id, UpdateOptions options) {
		return applyLocal("pullByID " + field, s -> s.withPulledByID(field, id), options);
	}

	@Override
	public <T extends Identified> CompletableFuture<Void> mergeByID(ListField<T> field, T patched, UpdateOptions options) {
		return applyLocal("mergeByID " + field, s -> s.withMergedByID(field, patched), options);
	}

	@Override
	public Registration onRemoteDiff(@NonNull StateListener listener) {
		remoteDiffListeners.add(listener);
		return () -> remoteDiffListeners.remove(listener);
	}

	@Override
	public Registration onLocalUpdate(@NonNull StateListener listener) {
		localUpdateListeners.add(listener);
		return () -> localUpdateListeners.remove(listener);
	}

	/**
	 * Applies a change made by another party, and notifies {@link #onRemoteDiff} listeners.
	 *
	 * @return a future that completes when every listener has finished with this change,
	 * or fails if any of them failed.
	 */
	public CompletableFuture<Void> receiveRemote(UnaryOperator<StoreSnapshot> change) {
		StoreSnapshot previous, updated;
		CompletableFuture<Void> predecessor;
		CompletableFuture<Void> delivery = new CompletableFuture<>();
		synchronized (this) {
			previous = current;
			try {
				updated = change.apply(previous);
			} catch (InvariantViolationException e) {
				LOGGER.warn("{}: rejecting remote change: {}", name, e.getMessage());
				return CompletableFuture.failedFuture(e);
			}
			if (updated.equals(previous)) {
				LOGGER.debug("{}: remote change has no effect", name);
				return completedFuture(null);
			}
			current = updated;
			predecessor = lastRemoteDelivery;
			lastRemoteDelivery = delivery;
		}
		LOGGER.debug("{}: received remote change", name);
		predecessor
			.handle((v, e) -> null) // A failed delivery doesn't hold up the next one
			.thenCompose(__ -> notifyListeners(remoteDiffListeners, updated, previous))
			.whenComplete((v, e) -> {
				if (e == null) {
					delivery.complete(null);
				} else {
					Throwable cause = unwrap(e);
					LOGGER.error("{}: remote diff listener failed: {}", name, cause.getMessage(), cause);
					delivery.completeExceptionally(cause);
				}
			});
		return delivery;
	}

	public CompletableFuture<Void> receiveRemote(@NonNull StoreSnapshot newState) {
		return receiveRemote(__ -> newState);
	}

	private CompletableFuture<Void> applyLocal(String description, UnaryOperator<StoreSnapshot> change, UpdateOptions options) {
		StoreSnapshot previous, updated;
		synchronized (this) {
			previous = current;
			try {
				updated = change.apply(previous);
			} catch (InvariantViolationException e) {
				LOGGER.debug("{}: rejecting {}: {}", name, description, e.getMessage());
				return CompletableFuture.failedFuture(e);
			}
			current = updated;
		}
		LOGGER.debug("{}: {}{}", name, description, options.silent() ? " (silent)" : "");
		if (!options.silent() && !updated.equals(previous)) {
			notifyListeners(localUpdateListeners, updated, previous).whenComplete((v, e) -> {
				if (e != null) {
					LOGGER.warn("{}: local update listener failed after {}", name, description, unwrap(e));
				}
			});
		}
		return completedFuture(null);
	}

	private static CompletableFuture<Void> notifyListeners(List<StateListener> listeners, StoreSnapshot updated, StoreSnapshot previous) {
		List<CompletableFuture<Void>> results = new ArrayList<>(listeners.size());
		for (StateListener listener: listeners) {
			CompletionStage<Void> result;
			try {
				result = listener.onChange(updated, previous);
			} catch (RuntimeException e) {
				result = CompletableFuture.failedFuture(e);
			}
			results.add(result.toCompletableFuture());
		}
		return CompletableFuture.allOf(results.toArray(new CompletableFuture[0]));
	}

	@Override
	public String toString() {
		return "LocalStore(" + name + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(LocalStore.class);
}
