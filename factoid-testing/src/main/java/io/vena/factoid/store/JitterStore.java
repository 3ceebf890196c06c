package io.vena.factoid.store;

import io.vena.factoid.Identified;
import io.vena.factoid.Identifier;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sleeps for a random time before each update, to shake out timing assumptions.
 */
public final class JitterStore extends ForwardingStore {
	private final Random random;
	private final double meanMillis;
	private final double limitMillis;

	public static StoreFactory factory(double meanMillis, double limitMillis, long seed) {
		return downstream -> new JitterStore(downstream, meanMillis, limitMillis, seed);
	}

	private JitterStore(ReplicatedStore downstream, double meanMillis, double limitMillis, long seed) {
		super(downstream);
		this.random = new Random(seed);
		this.meanMillis = meanMillis;
		this.limitMillis = limitMillis;
	}

	/**
	 * Exponentially distributed with the configured mean, capped at the limit.
	 */
	private synchronized long nextDelayNanos() {
		double millis = meanMillis * -Math.log(1.0 - random.nextDouble());
		return (long) (Math.min(millis, limitMillis) * 1_000_000);
	}

	private void sleep() {
		long delay = nextDelayNanos();
		LOGGER.trace("Delaying {} ns", delay);
		try {
			TimeUnit.NANOSECONDS.sleep(delay);
		} catch (InterruptedException e) {
			LOGGER.debug("Delay interrupted", e);
			Thread.currentThread().interrupt();
		}
	}

	@Override
	public CompletableFuture<Void> synch(boolean enable) {
		sleep();
		return downstream.synch(enable);
	}

	@Override
	public <T> CompletableFuture<Void> update(Field<T> field, T value, UpdateOptions options) {
		sleep();
		return downstream.update(field, value, options);
	}

	@Override
	public <T> CompletableFuture<Void> push(ListField<T> field, T item, UpdateOptions options) {
		sleep();
		return downstream.push(field, item, options);
	}

	@Override
	public <T> CompletableFuture<Void> pull(ListField<T> field, T item, UpdateOptions options) {
		sleep();
		return downstream.pull(field, item, options);
	}

	@Override
	public <T extends Identified> CompletableFuture<Void> pullByID(ListField<T> field, Identifier id, UpdateOptions options) {
		sleep();
		return downstream.pullByID(field, id, options);
	}

	@Override
	public <T extends Identified> CompletableFuture<Void> mergeByID(ListField<T> field, T patched, UpdateOptions options) {
		sleep();
		return downstream.mergeByID(field, patched, options);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JitterStore.class);
}
