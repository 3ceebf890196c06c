package io.vena.factoid;

import java.util.concurrent.CompletableFuture;

/**
 * A hydrated domain object (an entity or an interaction) that can be a member
 * of an {@link ElementSet}.
 *
 * <p>
 * Elements own their own replication lifecycle; the set only asks them to
 * start or stop synchronizing. Elements are allocated by an {@link ElementCache},
 * which guarantees at most one instance per id, so sets hold them by reference.
 */
public interface Element extends Identified {
	/**
	 * @return true if this element is currently synchronizing itself with its replicas
	 */
	boolean live();

	/**
	 * Starts or stops this element's own synchronization.
	 */
	CompletableFuture<Void> synch(boolean enable);
}
