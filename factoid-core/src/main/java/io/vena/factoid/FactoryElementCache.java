package io.vena.factoid;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An {@link ElementCache} that creates missing elements using an {@link ElementFactory}.
 *
 * <p>
 * Concurrent loads of the same id share a single call to the factory,
 * so there is at most one element object per id.
 * A failed load is forgotten, so that a later load can try again.
 */
@RequiredArgsConstructor
public class FactoryElementCache<E extends Element> implements ElementCache<E> {
	private final ElementFactory<E> factory;
	private final ConcurrentMap<Identifier, CompletableFuture<E>> elementsById = new ConcurrentHashMap<>();

	@Override
	public CompletableFuture<E> load(Identifier id) {
		CompletableFuture<E> existing = elementsById.get(id);
		if (existing != null) {
			LOGGER.trace("Cache hit for {}", id);
			return existing.copy();
		}
		CompletableFuture<E> pending = new CompletableFuture<>();
		existing = elementsById.putIfAbsent(id, pending);
		if (existing != null) {
			return existing.copy();
		}

		LOGGER.debug("Cache miss for {}; making new element", id);
		CompletableFuture<E> made;
		try {
			made = factory.make(id);
		} catch (RuntimeException e) {
			made = CompletableFuture.failedFuture(e);
		}
		made.whenComplete((element, exception) -> {
			if (exception == null) {
				if (!id.equals(element.id())) {
					LOGGER.warn("Factory made element {} when asked for {}", element.id(), id);
				}
				pending.complete(element);
			} else {
				LOGGER.debug("Unable to make element {}; evicting", id, exception);
				elementsById.remove(id, pending);
				pending.completeExceptionally(exception);
			}
		});
		return pending.copy();
	}

	/**
	 * Forgets the element with the given id, if any.
	 * The next {@link #load} for that id will make a new element.
	 */
	public void evict(Identifier id) {
		elementsById.remove(id);
	}

	public boolean contains(Identifier id) {
		return elementsById.containsKey(id);
	}

	public int size() {
		return elementsById.size();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(FactoryElementCache.class);
}
