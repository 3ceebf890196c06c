package io.vena.factoid;

import io.vena.factoid.ElementSetEvent.Kind;
import io.vena.factoid.exceptions.HydrationFailureException;
import io.vena.factoid.exceptions.InvalidConfigurationException;
import io.vena.factoid.exceptions.InvariantViolationException;
import io.vena.factoid.store.ListField;
import io.vena.factoid.store.ReplicatedStore;
import io.vena.factoid.store.StoreSnapshot;
import io.vena.factoid.store.UpdateOptions;
import io.vena.factoid.util.Futures;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.Nullable;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.factoid.ElementSetEvent.Kind.ADD;
import static io.vena.factoid.ElementSetEvent.Kind.LOCAL_ADD;
import static io.vena.factoid.ElementSetEvent.Kind.LOCAL_REGROUP;
import static io.vena.factoid.ElementSetEvent.Kind.LOCAL_REMOVE;
import static io.vena.factoid.ElementSetEvent.Kind.REGROUP;
import static io.vena.factoid.ElementSetEvent.Kind.REMOTE_ADD;
import static io.vena.factoid.ElementSetEvent.Kind.REMOTE_REGROUP;
import static io.vena.factoid.ElementSetEvent.Kind.REMOTE_REMOVE;
import static io.vena.factoid.ElementSetEvent.Kind.REMOVE;
import static io.vena.factoid.util.Futures.unwrap;
import static java.util.concurrent.CompletableFuture.completedFuture;
import static java.util.concurrent.CompletableFuture.failedFuture;

/**
 * A set of live element objects whose membership is replicated through the
 * <code>entries</code> list of a {@link ReplicatedStore}.
 *
 * <p>
 * Two views of membership are kept consistent:
 *
 * <ol><li>
 * The <em>entries</em>, an ordered list of {@link Entry} records in the store,
 * which is the replicated source of truth; and
 * </li><li>
 * the <em>index</em>, a map from id to the hydrated element object,
 * which is local to this set and is what the query methods consult.
 * </li></ol>
 *
 * Local mutations update the index at once, then ask the store to update the entries.
 * Remote changes to the entries are reconciled into the index after the newly added
 * elements have been loaded from the {@link ElementCache}; see {@link #reconcile}.
 *
 * <p>
 * The index is an immutable map that is replaced while holding this object's monitor,
 * so readers never lock and never see a partially applied batch.
 * Events are published after the monitor is released.
 */
@Accessors(fluent = true)
public class ElementSet<E extends Element> implements AutoCloseable {
	public static final ListField<Entry> ENTRIES = ListField.listNamed("entries");

	@Getter private final ReplicatedStore store;
	@Getter private final ElementCache<E> cache;
	@Getter private final ElementSetSettings settings;
	private final EventPublisher<? super ElementSetEvent<E>> publisher;
	private final Registration remoteDiffRegistration;

	// Mutable state
	private volatile PMap<Identifier, E> elementsById = HashTreePMap.empty();
	private volatile boolean closed = false;

	public ElementSet(EventPublisher<? super ElementSetEvent<E>> publisher, ReplicatedStore store, ElementCache<E> cache) {
		this(publisher, store, cache, ElementSetSettings.defaults());
	}

	public ElementSet(@NonNull EventPublisher<? super ElementSetEvent<E>> publisher, @NonNull ReplicatedStore store, @NonNull ElementCache<E> cache, @NonNull ElementSetSettings settings) {
		if (!store.declares(ENTRIES)) {
			throw new InvalidConfigurationException("Store " + store + " has no \"" + ENTRIES + "\" field");
		}
		this.publisher = publisher;
		this.store = store;
		this.cache = cache;
		this.settings = settings;
		this.remoteDiffRegistration = store.onRemoteDiff(this::onRemoteDiff);
		LOGGER.debug("{}: attached to {}", settings.getName(), store);
	}

	/**
	 * Same as the constructor.
	 *
	 * @throws InvalidConfigurationException if <code>store</code> doesn't declare {@link #ENTRIES}
	 */
	public static <EE extends Element> ElementSet<EE> attach(EventPublisher<? super ElementSetEvent<EE>> publisher, ReplicatedStore store, ElementCache<EE> cache) {
		return new ElementSet<>(publisher, store, cache);
	}

	//
	// Bulk hydration
	//

	/**
	 * Loads every element listed in the entries, adds them all to the index at once,
	 * activates their synchronization if the store is live, and then publishes a single
	 * {@link Kind#LOAD_ELEMENTS LOAD_ELEMENTS} event.
	 *
	 * <p>
	 * If any element can't be loaded, the returned future fails with a
	 * {@link HydrationFailureException} and the index is unchanged.
	 */
	public CompletableFuture<Void> loadElements() {
		List<Entry> entries = store.snapshot().list(ENTRIES);
		LOGGER.debug("{}: loading {} elements", name(), entries.size());
		List<CompletableFuture<E>> loads = entries.stream()
			.map(entry -> load(entry.id()))
			.toList();
		return Futures.allOf(loads)
			.thenCompose(loaded -> {
				synchronized (this) {
					PMap<Identifier, E> newIndex = elementsById;
					for (E element: loaded) {
						newIndex = newIndex.plus(element.id(), element);
					}
					elementsById = newIndex;
				}
				return Futures.allOf(loaded.stream()
					.map(element -> maybeSynch(element))
					.toList());
			})
			.thenRun(() -> {
				LOGGER.debug("{}: loaded elements", name());
				publisher.publish(ElementSetEvent.<E>loadElements());
			});
	}

	/**
	 * Same as {@link #loadElements()}.
	 */
	public CompletableFuture<Void> load() {
		return loadElements();
	}

	/**
	 * Same as {@link #loadElements()}.
	 */
	public CompletableFuture<Void> create() {
		return loadElements();
	}

	//
	// Local mutations
	//

	public CompletableFuture<Void> add(E element) {
		return add(element, MutationOptions.DEFAULT);
	}

	/**
	 * Adds <code>element</code> to the index immediately, then pushes a new entry to the store.
	 * Does nothing if an element with the same id is already a member.
	 *
	 * <p>
	 * If the store rejects the entry, the returned future fails with the store's exception.
	 */
	public CompletableFuture<Void> add(@NonNull E element, @NonNull MutationOptions options) {
		Identifier id = element.id();
		Entry entry = Entry.of(id, options.group());
		synchronized (this) {
			if (elementsById.containsKey(id) || entryFor(id).isPresent()) {
				LOGGER.debug("{}: {} is already a member", name(), id);
				return completedFuture(null);
			}
			elementsById = elementsById.plus(id, element);
		}
		CompletableFuture<Void> result = store.push(ENTRIES, entry, updateOptions(options));
		if (!options.silent()) {
			publishPair(ADD, LOCAL_ADD, element, entry.group(), null);
		}
		return compensateOnFailure(result, "add " + id, () -> {
			if (removeFromIndexIfSame(element) && !options.silent()) {
				publishPair(REMOVE, LOCAL_REMOVE, element, entry.group(), null);
			}
		});
	}

	public CompletableFuture<Void> remove(E element) {
		return remove(element.id(), MutationOptions.DEFAULT);
	}

	public CompletableFuture<Void> remove(Identifier id) {
		return remove(id, MutationOptions.DEFAULT);
	}

	public CompletableFuture<Void> remove(E element, MutationOptions options) {
		return remove(element.id(), options);
	}

	/**
	 * Removes the member with the given id from the index immediately, then removes its entry from the store.
	 * Does nothing if there is no such member.
	 */
	public CompletableFuture<Void> remove(@NonNull Identifier id, @NonNull MutationOptions options) {
		E element;
		Entry entry;
		synchronized (this) {
			element = elementsById.get(id);
			if (element == null) {
				LOGGER.debug("{}: {} is not a member", name(), id);
				return completedFuture(null);
			}
			Optional<Entry> existing = entryFor(id);
			if (existing.isEmpty()) {
				return failedFuture(missingEntry(id));
			}
			entry = existing.get();
			elementsById = elementsById.minus(id);
		}
		CompletableFuture<Void> result = store.pullByID(ENTRIES, id, updateOptions(options));
		if (!options.silent()) {
			publishPair(REMOVE, LOCAL_REMOVE, element, entry.group(), null);
		}
		return compensateOnFailure(result, "remove " + id, () -> {
			if (addToIndexIfAbsent(element) && !options.silent()) {
				publishPair(ADD, LOCAL_ADD, element, entry.group(), null);
			}
		});
	}

	public CompletableFuture<Void> regroup(E element, @Nullable String group) {
		return regroup(element.id(), MutationOptions.inGroup(group));
	}

	public CompletableFuture<Void> regroup(Identifier id, @Nullable String group) {
		return regroup(id, MutationOptions.inGroup(group));
	}

	public CompletableFuture<Void> regroup(E element, MutationOptions options) {
		return regroup(element.id(), options);
	}

	/**
	 * Moves the member with the given id into {@link MutationOptions#group() options.group()}.
	 * Does nothing if there is no such member.
	 */
	public CompletableFuture<Void> regroup(@NonNull Identifier id, @NonNull MutationOptions options) {
		E element = elementsById.get(id);
		if (element == null) {
			LOGGER.debug("{}: can't regroup {}; not a member", name(), id);
			return completedFuture(null);
		}
		Optional<Entry> existing = entryFor(id);
		if (existing.isEmpty()) {
			return failedFuture(missingEntry(id));
		}
		Entry oldEntry = existing.get();
		Entry newEntry = oldEntry.withGroup(options.group());
		CompletableFuture<Void> result = store.mergeByID(ENTRIES, newEntry, updateOptions(options));
		if (!options.silent()) {
			publishPair(REGROUP, LOCAL_REGROUP, element, newEntry.group(), oldEntry.group());
		}
		return compensateOnFailure(result, "regroup " + id, () -> {
			if (!options.silent() && elementsById.get(id) == element) {
				publishPair(REGROUP, LOCAL_REGROUP, element, oldEntry.group(), newEntry.group());
			}
		});
	}

	//
	// Queries
	//

	public boolean has(Identifier id) {
		return resolve(id).isPresent();
	}

	public boolean has(E element) {
		return has(element.id());
	}

	/**
	 * @return the member with the given id, as held in the index
	 */
	public Optional<E> get(Identifier id) {
		return resolve(id);
	}

	/**
	 * @return the canonical member object having the same id as <code>element</code>,
	 * which need not be <code>element</code> itself
	 */
	public Optional<E> get(E element) {
		return resolve(element.id());
	}

	public int size() {
		return elementsById.size();
	}

	/**
	 * @return the hydrated members in entry order
	 */
	public List<E> elements() {
		return elements(null);
	}

	/**
	 * @param group if not null, include only the members in this group
	 * @return the hydrated members in entry order.
	 * Entries whose elements are not yet in the index are skipped.
	 */
	public List<E> elements(@Nullable String group) {
		PMap<Identifier, E> index = elementsById;
		List<E> result = new ArrayList<>();
		for (Entry entry: store.snapshot().list(ENTRIES)) {
			if (group == null || group.equals(entry.group())) {
				E element = index.get(entry.id());
				if (element != null) {
					result.add(element);
				}
			}
		}
		return result;
	}

	/**
	 * @return the group of the member with the given id, which is {@link Group#NONE} if it has no group;
	 * or empty if it is not a member
	 */
	public Optional<Group> group(Identifier id) {
		return entry(id).map(entry -> Group.of(entry.group()));
	}

	public Optional<Group> group(E element) {
		return group(element.id());
	}

	/**
	 * @return the entry of the member with the given id, or empty if it is not a member
	 */
	public Optional<Entry> entry(Identifier id) {
		if (has(id)) {
			return entryFor(id);
		} else {
			return Optional.empty();
		}
	}

	public Optional<Entry> entry(E element) {
		return entry(element.id());
	}

	//
	// Synchronization
	//

	/**
	 * Starts or stops synchronization of every member.
	 */
	public CompletableFuture<Void> synch(boolean enable) {
		Collection<E> members = elementsById.values();
		LOGGER.debug("{}: synch({}) for {} members", name(), enable, members.size());
		List<CompletableFuture<Void>> results = members.stream()
			.map(element -> synchElement(element, enable))
			.toList();
		return Futures.allOf(results).thenApply(__ -> null);
	}

	/**
	 * Stops reconciling remote changes. The index is left as it is.
	 */
	@Override
	public void close() {
		if (!closed) {
			closed = true;
			remoteDiffRegistration.close();
			LOGGER.debug("{}: closed", name());
		}
	}

	//
	// Reconciliation
	//

	private CompletableFuture<Void> onRemoteDiff(StoreSnapshot updated, StoreSnapshot previous) {
		if (closed) {
			LOGGER.debug("{}: ignoring remote change after close", name());
			return completedFuture(null);
		}
		if (!updated.changed(ENTRIES, previous)) {
			return completedFuture(null);
		}
		return reconcile(updated.list(ENTRIES), previous.list(ENTRIES));
	}

	/**
	 * Brings the index in line with a remote change to the entries.
	 *
	 * <p>
	 * Added entries are hydrated concurrently; once all of them are ready, the additions and
	 * removals are applied to the index in one step, and regroups are detected among the entries
	 * present both before and after. The events are then published in that order: additions,
	 * removals, regroups.
	 *
	 * <p>
	 * If any hydration fails, the returned future fails with a {@link HydrationFailureException},
	 * the index is not changed, and no events are published.
	 */
	CompletableFuture<Void> reconcile(List<Entry> updatedEntries, List<Entry> previousEntries) {
		Map<Identifier, Entry> updatedByID = byID(updatedEntries);
		Map<Identifier, Entry> previousByID = byID(previousEntries);

		List<Entry> added = new ArrayList<>();
		List<Entry> unchangedMembership = new ArrayList<>();
		updatedByID.values().forEach(entry -> {
			if (previousByID.containsKey(entry.id())) {
				unchangedMembership.add(entry);
			} else {
				added.add(entry);
			}
		});
		List<Entry> removed = previousByID.values().stream()
			.filter(entry -> !updatedByID.containsKey(entry.id()))
			.toList();

		// Removals can only refer to elements we already have
		PMap<Identifier, E> indexBefore = elementsById;
		List<Member<E>> removals = new ArrayList<>();
		for (Entry entry: removed) {
			E element = indexBefore.get(entry.id());
			if (element == null) {
				LOGGER.debug("{}: remote removal of {}, which was never hydrated", name(), entry.id());
			} else {
				removals.add(new Member<>(element, entry));
			}
		}

		LOGGER.debug("{}: reconciling {} additions, {} removals", name(), added.size(), removed.size());
		List<CompletableFuture<Member<E>>> hydrations = added.stream()
			.map(entry -> hydrate(entry))
			.toList();

		return Futures.allOf(hydrations).thenAccept(additions -> {
			List<ElementSetEvent<E>> events = new ArrayList<>();
			synchronized (this) {
				PMap<Identifier, E> newIndex = elementsById;
				for (Member<E> member: additions) {
					newIndex = newIndex.plus(member.entry().id(), member.element());
					addPair(events, ADD, REMOTE_ADD, member.element(), member.entry().group(), null);
				}
				for (Member<E> member: removals) {
					newIndex = newIndex.minus(member.entry().id());
					addPair(events, REMOVE, REMOTE_REMOVE, member.element(), member.entry().group(), null);
				}
				for (Entry entry: unchangedMembership) {
					Entry before = previousByID.get(entry.id());
					if (!Objects.equals(entry.group(), before.group())) {
						E element = newIndex.get(entry.id());
						if (element == null) {
							LOGGER.debug("{}: remote regroup of {}, which was never hydrated", name(), entry.id());
						} else {
							addPair(events, REGROUP, REMOTE_REGROUP, element, entry.group(), before.group());
						}
					}
				}
				elementsById = newIndex;
			}
			events.forEach(publisher::publish);
		});
	}

	private CompletableFuture<Member<E>> hydrate(Entry entry) {
		return load(entry.id())
			.thenCompose(this::maybeSynch)
			.thenApply(element -> new Member<>(element, entry));
	}

	/**
	 * Any failure is reported as a {@link HydrationFailureException}.
	 */
	private CompletableFuture<E> load(Identifier id) {
		return hydrationStep(id, () -> cache.load(id));
	}

	/**
	 * Elements join in synchronization if the store is live.
	 */
	private CompletableFuture<E> maybeSynch(E element) {
		if (store.live() && !element.live()) {
			return hydrationStep(element.id(), () -> element.synch(true).thenApply(__ -> element));
		} else {
			return completedFuture(element);
		}
	}

	private CompletableFuture<E> hydrationStep(Identifier id, Supplier<CompletableFuture<E>> step) {
		CompletableFuture<E> result;
		try {
			result = step.get();
		} catch (RuntimeException e) {
			result = failedFuture(e);
		}
		return result.handle((element, e) -> {
			if (e == null) {
				return element;
			}
			Throwable cause = unwrap(e);
			if (cause instanceof HydrationFailureException h) {
				throw h;
			}
			LOGGER.debug("{}: unable to hydrate {}", name(), id, cause);
			throw new HydrationFailureException(id, cause);
		});
	}

	private CompletableFuture<Void> synchElement(E element, boolean enable) {
		try {
			return element.synch(enable);
		} catch (RuntimeException e) {
			return failedFuture(e);
		}
	}

	//
	// Compensation
	//

	/**
	 * @return a future that completes the same way as <code>storeResult</code>,
	 * after running <code>compensation</code> if it failed.
	 */
	private CompletableFuture<Void> compensateOnFailure(CompletableFuture<Void> storeResult, String description, Runnable compensation) {
		CompletableFuture<Void> outcome = new CompletableFuture<>();
		storeResult.whenComplete((v, e) -> {
			if (e == null) {
				outcome.complete(null);
				return;
			}
			Throwable cause = unwrap(e);
			if (settings.isCompensateOnRejection()) {
				LOGGER.warn("{}: store rejected {}; reverting: {}", name(), description, cause.getMessage());
				try {
					compensation.run();
				} catch (RuntimeException compensationFailure) {
					cause.addSuppressed(compensationFailure);
				}
			} else {
				LOGGER.warn("{}: store rejected {}: {}", name(), description, cause.getMessage());
			}
			outcome.completeExceptionally(cause);
		});
		return outcome;
	}

	private synchronized boolean removeFromIndexIfSame(E element) {
		if (elementsById.get(element.id()) == element) {
			elementsById = elementsById.minus(element.id());
			return true;
		} else {
			LOGGER.debug("{}: {} has changed since the rejected update; not reverting", name(), element.id());
			return false;
		}
	}

	private synchronized boolean addToIndexIfAbsent(E element) {
		if (elementsById.containsKey(element.id())) {
			LOGGER.debug("{}: {} has changed since the rejected update; not reverting", name(), element.id());
			return false;
		} else {
			elementsById = elementsById.plus(element.id(), element);
			return true;
		}
	}

	//
	// Helpers
	//

	/**
	 * The one place where an id is turned into a member object.
	 */
	private Optional<E> resolve(Identifier id) {
		return Optional.ofNullable(elementsById.get(id));
	}

	private Optional<Entry> entryFor(Identifier id) {
		return store.snapshot().list(ENTRIES).stream()
			.filter(entry -> entry.id().equals(id))
			.findFirst();
	}

	private InvariantViolationException missingEntry(Identifier id) {
		LOGGER.error("{}: {} is in the index but has no entry", name(), id);
		return new InvariantViolationException("Element " + id + " is a member of " + name() + " but has no entry");
	}

	private static UpdateOptions updateOptions(MutationOptions options) {
		return UpdateOptions.silentIf(options.silent());
	}

	private Map<Identifier, Entry> byID(List<Entry> entries) {
		Map<Identifier, Entry> result = new LinkedHashMap<>();
		for (Entry entry: entries) {
			if (result.putIfAbsent(entry.id(), entry) != null) {
				LOGGER.warn("{}: ignoring duplicate entry {}", name(), entry);
			}
		}
		return result;
	}

	private void publishPair(Kind generic, Kind specific, E element, @Nullable String group, @Nullable String oldGroup) {
		List<ElementSetEvent<E>> events = new ArrayList<>(2);
		addPair(events, generic, specific, element, group, oldGroup);
		events.forEach(publisher::publish);
	}

	private static <E extends Element> void addPair(List<ElementSetEvent<E>> events, Kind generic, Kind specific, E element, @Nullable String group, @Nullable String oldGroup) {
		events.add(new ElementSetEvent<>(generic, element, group, oldGroup));
		events.add(new ElementSetEvent<>(specific, element, group, oldGroup));
	}

	private String name() {
		return settings.getName();
	}

	private record Member<M>(M element, Entry entry) { }

	@Override
	public String toString() {
		return "ElementSet(" + name() + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ElementSet.class);
}
