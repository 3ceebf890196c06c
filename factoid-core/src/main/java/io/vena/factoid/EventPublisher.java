package io.vena.factoid;

/**
 * Where an {@link ElementSet} sends its events.
 * Usually an {@link EventBus} owned by the enclosing document.
 */
@FunctionalInterface
public interface EventPublisher<V> {
	void publish(V event);
}
