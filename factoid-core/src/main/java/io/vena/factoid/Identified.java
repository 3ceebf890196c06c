package io.vena.factoid;

/**
 * Something with an {@link Identifier}.
 * Items of an id-keyed list field in a {@link io.vena.factoid.store.ReplicatedStore}
 * must implement this so they can be pulled and merged by id.
 */
public interface Identified {
	Identifier id();
}
