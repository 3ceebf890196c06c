package io.vena.factoid;

/**
 * Receives events from an {@link EventBus}.
 */
@FunctionalInterface
public interface EventListener<V> {
	void onEvent(V event);
}
