package io.vena.factoid;

import java.util.concurrent.CompletableFuture;

/**
 * Turns an id into the canonical hydrated {@link Element} for that id.
 * May be shared by several {@link ElementSet}s; whatever it returns
 * for an id is treated as canonical.
 */
public interface ElementCache<E extends Element> {
	CompletableFuture<E> load(Identifier id);
}
