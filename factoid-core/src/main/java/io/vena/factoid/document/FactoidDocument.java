package io.vena.factoid.document;

import io.vena.factoid.Element;
import io.vena.factoid.ElementCache;
import io.vena.factoid.ElementSet;
import io.vena.factoid.ElementSetSettings;
import io.vena.factoid.Entry;
import io.vena.factoid.EventPublisher;
import io.vena.factoid.FactoidEvent;
import io.vena.factoid.Identifier;
import io.vena.factoid.MutationOptions;
import io.vena.factoid.Registration;
import io.vena.factoid.exceptions.InvalidConfigurationException;
import io.vena.factoid.store.Field;
import io.vena.factoid.store.ListField;
import io.vena.factoid.store.ReplicatedStore;
import io.vena.factoid.store.StoreSnapshot;
import io.vena.factoid.store.UpdateOptions;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.factoid.document.DocumentEvent.Kind.LOCAL_RENAME;
import static io.vena.factoid.document.DocumentEvent.Kind.LOCAL_TOGGLE_ORGANISM;
import static io.vena.factoid.document.DocumentEvent.Kind.REMOTE_RENAME;
import static io.vena.factoid.document.DocumentEvent.Kind.REMOTE_TOGGLE_ORGANISM;
import static io.vena.factoid.document.DocumentEvent.Kind.RENAME;
import static io.vena.factoid.document.DocumentEvent.Kind.TOGGLE_ORGANISM;
import static java.util.concurrent.CompletableFuture.completedFuture;

/**
 * A factoid: a named, replicated document made of elements, plus the organisms it concerns.
 *
 * <p>
 * Membership is managed by an {@link ElementSet} sharing this document's store and publisher;
 * the document itself looks after the <code>name</code> and <code>organisms</code> fields.
 * A document is itself an {@link Element}, so documents can be members of other sets.
 */
@Accessors(fluent = true)
public class FactoidDocument<E extends Element> implements Element, AutoCloseable {
	public static final Field<Identifier> ID = Field.named("id");
	public static final Field<String> NAME = Field.named("name");
	public static final ListField<Identifier> ORGANISMS = ListField.listNamed("organisms");

	@Getter private final ReplicatedStore store;
	@Getter private final ElementSet<E> elementSet;
	private final EventPublisher<? super FactoidEvent> publisher;
	private final Registration remoteDiffRegistration;

	public FactoidDocument(EventPublisher<? super FactoidEvent> publisher, ReplicatedStore store, ElementCache<E> cache) {
		this(publisher, store, cache, ElementSetSettings.defaults());
	}

	public FactoidDocument(@NonNull EventPublisher<? super FactoidEvent> publisher, @NonNull ReplicatedStore store, @NonNull ElementCache<E> cache, @NonNull ElementSetSettings settings) {
		if (!store.declares(ID)) {
			throw new InvalidConfigurationException("Store " + store + " has no \"" + ID + "\" field");
		}
		this.publisher = publisher;
		this.store = store;
		this.elementSet = new ElementSet<>(publisher, store, cache, settings);
		this.remoteDiffRegistration = store.onRemoteDiff(this::onRemoteDiff);
	}

	/**
	 * @return the state of a new, empty document
	 */
	public static StoreSnapshot initialState(Identifier id, @Nullable String name) {
		StoreSnapshot result = StoreSnapshot.empty()
			.with(ID, id)
			.with(ORGANISMS, List.of())
			.with(ElementSet.ENTRIES, List.<Entry>of());
		if (name == null) {
			return result;
		} else {
			return result.with(NAME, name);
		}
	}

	@Override
	public Identifier id() {
		Identifier result = store.get(ID);
		assert result != null: "Checked in constructor";
		return result;
	}

	@Override
	public boolean live() {
		return store.live();
	}

	/**
	 * Starts or stops synchronization of the document's own fields, then of its elements.
	 */
	@Override
	public CompletableFuture<Void> synch(boolean enable) {
		return store.synch(enable).thenCompose(__ -> elementSet.synch(enable));
	}

	/**
	 * Hydrates every element of the document.
	 *
	 * @see ElementSet#loadElements()
	 */
	public CompletableFuture<Void> load() {
		return elementSet.loadElements();
	}

	//
	// Name
	//

	public @Nullable String name() {
		return store.get(NAME);
	}

	public CompletableFuture<Void> rename(@NonNull String newName) {
		CompletableFuture<Void> result = store.update(NAME, newName, UpdateOptions.LOUD);
		LOGGER.debug("{}: rename to \"{}\"", id(), newName);
		publisher.publish(DocumentEvent.renamed(RENAME, newName));
		publisher.publish(DocumentEvent.renamed(LOCAL_RENAME, newName));
		return result;
	}

	//
	// Organisms
	//

	public List<Identifier> toggledOrganisms() {
		return store.snapshot().list(ORGANISMS);
	}

	public boolean organismToggled(Identifier organism) {
		return toggledOrganisms().contains(organism);
	}

	/**
	 * @param on true to toggle <code>organism</code> on, false to toggle it off,
	 *           or null to flip it. Nothing happens if it's already in the requested state.
	 */
	public CompletableFuture<Void> toggleOrganism(@NonNull Identifier organism, @Nullable Boolean on) {
		boolean wasOn = organismToggled(organism);
		boolean turnOn = (on == null) ? !wasOn : on;
		if (turnOn == wasOn) {
			LOGGER.debug("{}: organism {} is already {}", id(), organism, wasOn ? "on" : "off");
			return completedFuture(null);
		}
		CompletableFuture<Void> result;
		if (turnOn) {
			result = store.push(ORGANISMS, organism, UpdateOptions.LOUD);
		} else {
			result = store.pull(ORGANISMS, organism, UpdateOptions.LOUD);
		}
		publisher.publish(DocumentEvent.toggled(TOGGLE_ORGANISM, organism, turnOn));
		publisher.publish(DocumentEvent.toggled(LOCAL_TOGGLE_ORGANISM, organism, turnOn));
		return result;
	}

	public CompletableFuture<Void> toggleOrganism(Identifier organism) {
		return toggleOrganism(organism, null);
	}

	//
	// Elements
	//

	public boolean has(Identifier id) {
		return elementSet.has(id);
	}

	public boolean has(E element) {
		return elementSet.has(element);
	}

	public Optional<E> get(Identifier id) {
		return elementSet.get(id);
	}

	public int size() {
		return elementSet.size();
	}

	public List<E> elements() {
		return elementSet.elements();
	}

	public List<E> elements(@Nullable String group) {
		return elementSet.elements(group);
	}

	public CompletableFuture<Void> add(E element) {
		return elementSet.add(element);
	}

	public CompletableFuture<Void> add(E element, MutationOptions options) {
		return elementSet.add(element, options);
	}

	public CompletableFuture<Void> remove(E element) {
		return elementSet.remove(element);
	}

	public CompletableFuture<Void> remove(E element, MutationOptions options) {
		return elementSet.remove(element, options);
	}

	@Override
	public void close() {
		remoteDiffRegistration.close();
		elementSet.close();
	}

	private CompletionStage<Void> onRemoteDiff(StoreSnapshot updated, StoreSnapshot previous) {
		if (updated.changed(NAME, previous)) {
			String newName = updated.get(NAME);
			LOGGER.debug("{}: remote rename to \"{}\"", id(), newName);
			publisher.publish(DocumentEvent.renamed(RENAME, newName));
			publisher.publish(DocumentEvent.renamed(REMOTE_RENAME, newName));
		}
		if (updated.changed(ORGANISMS, previous)) {
			List<Identifier> before = previous.list(ORGANISMS);
			List<Identifier> after = updated.list(ORGANISMS);
			after.stream()
				.filter(organism -> !before.contains(organism))
				.forEach(organism -> publishRemoteToggle(organism, true));
			before.stream()
				.filter(organism -> !after.contains(organism))
				.forEach(organism -> publishRemoteToggle(organism, false));
		}
		return completedFuture(null);
	}

	private void publishRemoteToggle(Identifier organism, boolean on) {
		publisher.publish(DocumentEvent.toggled(TOGGLE_ORGANISM, organism, on));
		publisher.publish(DocumentEvent.toggled(REMOTE_TOGGLE_ORGANISM, organism, on));
	}

	@Override
	public String toString() {
		return "FactoidDocument(" + store.get(ID) + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(FactoidDocument.class);
}
