package io.vena.factoid;

import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Semaphore;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publish/subscribe channel shared by a document and the {@link ElementSet}s it composes.
 *
 * <p>
 * Delivery offers three guarantees:
 *
 * <ol><li>
 * Events are delivered to each listener in the order they were published.
 * </li><li>
 * Listeners are run sequentially: no listener begins until the previous one finishes.
 * </li><li>
 * Delivery is breadth-first: events published by a listener are delivered only after
 * every delivery that was already queued.
 * </li></ol>
 *
 * There is no delivery thread. Whichever thread publishes an event drains the queue,
 * unless another thread is already draining it, in which case that thread delivers the event.
 *
 * <p>
 * A listener that throws does not prevent delivery to other listeners; the exception is logged.
 */
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class EventBus<V> implements EventPublisher<V> {
	@Getter private final String name;
	private final List<Subscription<?>> subscriptions = new CopyOnWriteArrayList<>();
	private final Deque<Runnable> deliveryQueue = new ConcurrentLinkedDeque<>();
	private final Semaphore deliveryPermit = new Semaphore(1);

	public Registration subscribe(String listenerName, @NonNull EventListener<? super V> listener) {
		return register(new Subscription<V>(listenerName, null, listener));
	}

	/**
	 * Subscribes to just those events that are instances of <code>eventType</code>.
	 */
	public <T extends V> Registration subscribe(String listenerName, @NonNull Class<T> eventType, @NonNull EventListener<? super T> listener) {
		return register(new Subscription<T>(listenerName, eventType, listener));
	}

	private Registration register(Subscription<?> subscription) {
		subscriptions.add(subscription);
		LOGGER.debug("{}: subscribed {}", name, subscription.name);
		return () -> {
			if (subscriptions.remove(subscription)) {
				LOGGER.debug("{}: unsubscribed {}", name, subscription.name);
			}
		};
	}

	public List<String> subscriberNames() {
		return subscriptions.stream().map(s -> s.name).toList();
	}

	@Override
	public void publish(@NonNull V event) {
		for (Subscription<?> s: subscriptions) {
			if (s.accepts(event)) {
				LOGGER.debug("{}: queue {}({})", name, s.name, event);
				deliveryQueue.addLast(() -> s.deliver(event));
			}
		}
		drainQueueIfAllowed();
	}

	/**
	 * Delivers queued events, but only at the outermost level: a listener that publishes
	 * an event will find the permit taken, and the event will be delivered by the loop
	 * that called that listener once the listener returns.
	 */
	private void drainQueueIfAllowed() {
		do {
			if (deliveryPermit.tryAcquire()) {
				try {
					for (Runnable delivery = deliveryQueue.pollFirst(); delivery != null; delivery = deliveryQueue.pollFirst()) {
						try {
							delivery.run();
						} catch (RuntimeException e) {
							LOGGER.error("{}: listener aborted due to exception: {}", name, e.getMessage(), e);
						}
					}
				} finally {
					deliveryPermit.release();
				}
			} else {
				LOGGER.trace("{}: not draining the delivery queue", name);
				return;
			}

			// Another thread may have queued a delivery after our loop ended but
			// before we released the permit, and then failed to take the permit.
			// If the queue is empty now, any later publisher will take the permit itself.
		} while (!deliveryQueue.isEmpty());
	}

	@RequiredArgsConstructor
	private final class Subscription<T> {
		final String name;
		final Class<T> eventType;
		final EventListener<? super T> listener;

		boolean accepts(Object event) {
			return eventType == null || eventType.isInstance(event);
		}

		@SuppressWarnings("unchecked")
		void deliver(Object event) {
			if (!subscriptions.contains(this)) {
				LOGGER.trace("{}: skipping {} because it unsubscribed", EventBus.this.name, name);
				return;
			}
			LOGGER.trace("{}: RUN {}({})", EventBus.this.name, name, event);
			listener.onEvent((T) event);
		}
	}

	@Override
	public String toString() {
		return "EventBus(" + name + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(EventBus.class);
}
