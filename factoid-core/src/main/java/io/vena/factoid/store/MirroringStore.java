package io.vena.factoid.store;

import io.vena.factoid.Identified;
import io.vena.factoid.Identifier;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.factoid.util.Futures.unwrap;

/**
 * Sends every update accepted by the downstream store to a <code>mirror</code>,
 * which receives it as a remote change.
 *
 * <p>
 * Two of these, each mirroring into the other's downstream store,
 * act like two sessions editing the same document.
 *
 * <p>
 * The returned futures complete once the mirror has finished delivering the change to its listeners.
 * The update has already been accepted by then, so a failure in the mirror is logged
 * rather than reported to the caller.
 */
public class MirroringStore extends ForwardingStore {
	private final LocalStore mirror;

	private MirroringStore(ReplicatedStore downstream, LocalStore mirror) {
		super(downstream);
		this.mirror = mirror;
	}

	public static MirroringStore targeting(@NonNull LocalStore mirror, @NonNull ReplicatedStore downstream) {
		return new MirroringStore(downstream, mirror);
	}

	@Override
	public <T> CompletableFuture<Void> update(Field<T> field, T value, UpdateOptions options) {
		return mirrored("update " + field, () -> downstream.update(field, value, options), s -> s.with(field, value));
	}

	@Override
	public <T> CompletableFuture<Void> push(ListField<T> field, T item, UpdateOptions options) {
		return mirrored("push " + field, () -> downstream.push(field, item, options), s -> s.withPushed(field, item));
	}

	@Override
	public <T> CompletableFuture<Void> pull(ListField<T> field, T item, UpdateOptions options) {
		return mirrored("pull " + field, () -> downstream.pull(field, item, options), s -> s.withPulled(field, item));
	}

	@Override
	public <T extends Identified> CompletableFuture<Void> pullByID(ListField<T> field, Identifier id, UpdateOptions options) {
		return mirrored("pullByID " + field, () -> downstream.pullByID(field, id, options), s -> s.withPulledByID(field, id));
	}

	@Override
	public <T extends Identified> CompletableFuture<Void> mergeByID(ListField<T> field, T patched, UpdateOptions options) {
		return mirrored("mergeByID " + field, () -> downstream.mergeByID(field, patched, options), s -> s.withMergedByID(field, patched));
	}

	private CompletableFuture<Void> mirrored(String description, Supplier<CompletableFuture<Void>> update, UnaryOperator<StoreSnapshot> change) {
		return update.get().thenCompose(__ -> {
			LOGGER.debug("Mirroring {} to {}", description, mirror);
			return mirror.receiveRemote(change).handle((v, e) -> {
				if (e != null) {
					LOGGER.warn("Mirror {} failed to apply {}", mirror, description, unwrap(e));
				}
				return null;
			});
		});
	}

	@Override
	public String toString() {
		return "Mirroring " + downstream + " to " + mirror;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MirroringStore.class);
}
