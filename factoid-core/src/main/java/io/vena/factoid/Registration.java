package io.vena.factoid;

/**
 * Returned by subscription methods; closing it ends the subscription.
 * Closing more than once has no further effect.
 */
@FunctionalInterface
public interface Registration extends AutoCloseable {
	@Override
	void close();
}
