package io.vena.factoid.store;

/**
 * Wraps a store in a decorator, so tests can assemble a stack of them.
 */
@FunctionalInterface
public interface StoreFactory {
	ReplicatedStore build(ReplicatedStore downstream);

	static StoreFactory identity() {
		return downstream -> downstream;
	}

	/**
	 * @return a factory that applies <code>this</code> and then <code>outer</code>
	 */
	default StoreFactory then(StoreFactory outer) {
		return downstream -> outer.build(this.build(downstream));
	}
}
