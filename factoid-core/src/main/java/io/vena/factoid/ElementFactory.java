package io.vena.factoid;

import java.util.concurrent.CompletableFuture;

/**
 * Creates and hydrates a new element object for a given id.
 * Used by {@link FactoryElementCache} on a cache miss.
 */
@FunctionalInterface
public interface ElementFactory<E extends Element> {
	CompletableFuture<E> make(Identifier id);
}
